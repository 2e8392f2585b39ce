package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.ConstDecl;
import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.LetSection;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.Signature;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.TypeDecl;
import info.isaksson.erland.swanmodel.ast.VarDecl;
import info.isaksson.erland.swanmodel.parse.SwanParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeNamespaceTest {

    private SwanModel model;
    private ScopeNamespace names;

    @BeforeEach
    void setUp() {
        model = new SwanModel(List.of(
                SwanSource.ofText("App", ModuleKind.BODY, """
                        use Lib::Math as M;
                        const K: int32 = 1;
                        node Op (i: int32;) returns (o: int32;)
                        {
                          var
                            t: int32;
                          let
                            t = i + K;
                            o = t;
                        }
                        """),
                SwanSource.ofText("App", ModuleKind.INTERFACE, """
                        type Public = int32;
                        node Op (i: int32;) returns (o: int32;);
                        """),
                SwanSource.ofText("Lib::Math", ModuleKind.BODY, """
                        const PI: float64 = 3.14;
                        """)), new SwanParser());
        names = new ScopeNamespace(model);
    }

    private Equation firstEquation() {
        Operator op = (Operator) model.findByPath("App::Op").orElseThrow();
        return op.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0).equations().get(0);
    }

    @Test
    void localVariableIsFoundInTheEnclosingScope() {
        Declaration t = names.resolve(firstEquation(), "t").orElseThrow();

        VarDecl var = assertInstanceOf(VarDecl.class, t);
        assertEquals("App::Op::t", var.fullPath());
    }

    @Test
    void inputsThenModuleMembers() {
        SwanNode eq = firstEquation();

        assertEquals("i", names.resolve(eq, "i").orElseThrow().name());
        assertInstanceOf(ConstDecl.class, names.resolve(eq, "K").orElseThrow());
        assertTrue(names.resolve(eq, "missing").isEmpty());
    }

    @Test
    void bodyFallsBackToItsInterface() {
        Declaration publicType = names.resolve(firstEquation(), "Public").orElseThrow();

        assertInstanceOf(TypeDecl.class, publicType);
        assertTrue(model.module("App", ModuleKind.INTERFACE).orElseThrow().isInterface());
    }

    @Test
    void qualifiedNamesHonourUseAliases() {
        SwanNode eq = firstEquation();

        assertEquals("PI", names.resolve(eq, "M::PI").orElseThrow().name());
        assertEquals("PI", names.resolve(eq, "Lib::Math::PI").orElseThrow().name());
        assertTrue(names.resolve(eq, "Nope::PI").isEmpty());
    }

    @Test
    void interfaceSignatureVariables() {
        Signature sig = model.module("App", ModuleKind.INTERFACE).orElseThrow().declarations().stream()
                .filter(d -> d instanceof Signature).map(d -> (Signature) d).findFirst().orElseThrow();

        assertEquals("o", names.resolve(sig, "o").orElseThrow().name());
        assertEquals("App::Op", sig.fullPath());
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> names.resolve(firstEquation(), " "));
    }
}
