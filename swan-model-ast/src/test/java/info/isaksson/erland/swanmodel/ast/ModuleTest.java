package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.expr.LiteralExpr;
import info.isaksson.erland.swanmodel.expr.LiteralKind;
import info.isaksson.erland.swanmodel.types.PredefinedType;
import info.isaksson.erland.swanmodel.types.PredefinedTypeName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleTest {

    private static final SourceSpan S = SourceSpan.NONE;

    private static ConstDecl constant(String name, String value) {
        return new ConstDecl(S, Identifier.of(name), new PredefinedType(S, PredefinedTypeName.INT32),
                new LiteralExpr(S, LiteralKind.INTEGER, value));
    }

    private static Module module(GlobalDeclaration... decls) {
        return new Module(S, ModuleKind.BODY, PathIdentifier.parse("P::Q"), null, List.of(decls),
                ModuleInformation.none(), null);
    }

    private static Operator operator(String name, String input) {
        Signature sig = new Signature(S, Identifier.of(name), false, false, List.of(),
                List.of(VarDecl.of(S, Identifier.of(input), new PredefinedType(S, PredefinedTypeName.BOOL))),
                List.of(), List.of(), null);
        return new Operator(S, sig, (Scope) null);
    }

    @Test
    void fullPathJoinsModuleAndEnclosingDeclarations() {
        ConstDecl k = constant("K", "1");
        Operator f = operator("F", "a");
        Module m = module(new ConstDeclarations(S, List.of(k)), f);

        assertEquals("P::Q", m.fullPath());
        assertEquals("P::Q::K", k.fullPath());
        assertEquals("P::Q::F", f.fullPath());
        assertEquals("P::Q::F", f.signature().fullPath());
        assertEquals("P::Q::F::a", f.signature().inputs().get(0).fullPath());
        assertEquals("P::Q::K", k.value().orElseThrow().fullPath());
    }

    @Test
    void detachedNodeHasNoFullPath() {
        ConstDecl k = constant("K", "1");

        UsagePreconditionException e = assertThrows(UsagePreconditionException.class, k::fullPath);
        assertTrue(e.getMessage().contains("no enclosing module"));
        assertTrue(k.module().isEmpty());
        assertTrue(k.sourceText().isEmpty());
    }

    @Test
    void adoptionLinksChildToItsOwner() {
        ConstDecl k = constant("K", "1");
        ConstDeclarations list = new ConstDeclarations(S, List.of(k));

        assertSame(list, k.owner());
        assertEquals(List.of(k), list.children());
        assertNull(list.owner());
    }

    @Test
    void nodeCannotBeAdoptedTwice() {
        ConstDecl k = constant("K", "1");
        new ConstDeclarations(S, List.of(k));

        assertThrows(UsagePreconditionException.class, () -> new ConstDeclarations(S, List.of(k)));
    }

    @Test
    void membersAreFoundByName() {
        ConstDecl k = constant("K", "1");
        Operator f = operator("F", "a");
        Module m = module(new ConstDeclarations(S, List.of(k)), f);

        assertSame(k, m.member("K").orElseThrow());
        assertSame(f, m.member("F").orElseThrow());
        assertTrue(m.member("a").isEmpty());
        m.checkNamespace();
    }

    @Test
    void duplicateNamesAreReported() {
        Module m = module(new ConstDeclarations(S, List.of(constant("K", "1"))),
                new ConstDeclarations(S, List.of(constant("K", "2"))));

        StructuralInvariantException e = assertThrows(StructuralInvariantException.class, m::checkNamespace);
        assertTrue(e.getMessage().contains("'K'"));
    }

    @Test
    void rendersDeclarationsOnePerLine() {
        Module m = module(new ConstDeclarations(S, List.of(constant("K", "1"), constant("L", "0x1F"))),
                operator("F", "a"));

        assertEquals("const K: int32 = 1; L: int32 = 0x1F;\nfunction F (a: bool;) returns ();\n", m.render());
    }

    @Test
    void unstructuredModuleKeepsItsText() {
        String text = "const K: int32 = {syntax%1;\n";
        Module m = Module.unstructured(S, ModuleKind.BODY, PathIdentifier.parse("M"), text);

        assertTrue(m.isUnstructured());
        assertEquals(text, m.render());
        ProtectedDecl whole = (ProtectedDecl) m.declarations().get(0);
        assertTrue(whole.isProtected());
        assertEquals("M::<protected>", whole.fullPath());
        assertEquals(text, whole.protectedText().rawText());
    }
}
