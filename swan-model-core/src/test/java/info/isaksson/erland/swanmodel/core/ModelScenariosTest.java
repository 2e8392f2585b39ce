package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.ExprEquation;
import info.isaksson.erland.swanmodel.ast.LetSection;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.ProtectedEquation;
import info.isaksson.erland.swanmodel.diagram.Block;
import info.isaksson.erland.swanmodel.diagram.Diagram;
import info.isaksson.erland.swanmodel.diagram.DiagramGraph;
import info.isaksson.erland.swanmodel.diagram.DiagramObject;
import info.isaksson.erland.swanmodel.diagram.Endpoint;
import info.isaksson.erland.swanmodel.parse.SwanParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** Whole-model scenarios: parse, look up, then navigate. */
public class ModelScenariosTest {

    private static final String LIB = """
            node A (i: int32;) returns (out: int32;)
              out = i;
            node B (in: int32;) returns (o: int32;)
              o = in;
            """;

    private static final String CTL = """
            use Lib;
            node Ctl (x: int32;) returns (y: int32;)
            {
              diagram
                (#1 block Lib::A)
                (#2 block Lib::B)
                (#3 wire #1 .(out) => #2 .(in))
            }
            """;

    @Test
    void diagramWireIsNavigableFromBothBlocks() {
        SwanModel model = new SwanModel(List.of(
                SwanSource.ofText("M", ModuleKind.BODY, CTL),
                SwanSource.ofText("Lib", ModuleKind.BODY, LIB)), new SwanParser());

        Operator ctl = (Operator) model.findByPath("M::Ctl").orElseThrow();
        Diagram diagram = ctl.scopeBody().orElseThrow().sectionsOf(Diagram.class).get(0);
        DiagramGraph graph = DiagramGraph.of(diagram);

        DiagramObject a = graph.object("#1").orElseThrow();
        DiagramObject b = graph.object("#2").orElseThrow();
        assertInstanceOf(Block.class, a);
        assertEquals("(#1 block Lib::A)", a.render());

        List<Endpoint> targets = graph.targets(a);
        assertEquals(1, targets.size());
        assertSame(b, targets.get(0).vertex());
        assertEquals("in", targets.get(0).port());

        List<Endpoint> sources = graph.sources(b);
        assertEquals(1, sources.size());
        assertSame(a, sources.get(0).vertex());
        assertEquals("out", sources.get(0).port());

        assertFalse(graph.hasFeedback());
        assertEquals(1, model.parseCount());
    }

    @Test
    void invalidEquationIsKeptNextToItsNeighbours() {
        SwanModel model = new SwanModel(List.of(SwanSource.ofText("M", ModuleKind.BODY, """
                node N (i: int32;) returns (o: int32;)
                {
                  let
                    a = i;
                    b = 1 + ;
                    c = a * 2;
                    o = c;
                }
                """)), new SwanParser());

        Operator n = model.operators().iterator().next();
        List<Equation> equations = n.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0).equations();

        assertEquals(4, equations.size());
        assertEquals(3, equations.stream().filter(e -> e instanceof ExprEquation).count());
        ProtectedEquation broken = assertInstanceOf(ProtectedEquation.class, equations.get(1));
        assertEquals("b = 1 + ;", broken.protectedText().rawText());
        assertTrue(broken.isProtected());
        assertEquals("M::N", broken.ancestor(Operator.class).orElseThrow().fullPath());
        assertFalse(model.module("M").orElseThrow().isUnstructured());
    }
}
