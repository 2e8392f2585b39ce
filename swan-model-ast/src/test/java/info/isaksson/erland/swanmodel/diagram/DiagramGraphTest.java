package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.expr.GroupAdaptation;
import info.isaksson.erland.swanmodel.expr.GroupRenaming;
import info.isaksson.erland.swanmodel.expr.PathOperatorCall;
import info.isaksson.erland.swanmodel.expr.PortExpr;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramGraphTest {

    private static final SourceSpan S = SourceSpan.NONE;

    private static Block block(String luid, String operator) {
        return new Block(S, Luid.of(luid), new PathOperatorCall(S, PathIdentifier.parse(operator), List.of()), List.of());
    }

    private static Bar bar(String luid) {
        return new Bar(S, Luid.of(luid), GroupOperation.NONE, List.of());
    }

    /** {@code #luid} or {@code #luid .(name, ...)}; a name written {@code a:b} renames. */
    private static Connection end(String luid, String... names) {
        PortExpr port = luid.equals("self") ? PortExpr.self(S) : PortExpr.of(S, Luid.of(luid));
        if (names.length == 0) return Connection.of(S, port, null);
        List<GroupRenaming> renamings = new ArrayList<>();
        for (String n : names) {
            int colon = n.indexOf(':');
            if (colon < 0) renamings.add(new GroupRenaming(S, n, false, null, false));
            else renamings.add(new GroupRenaming(S, n.substring(0, colon), false,
                    Identifier.of(n.substring(colon + 1)), false));
        }
        return Connection.of(S, port, new GroupAdaptation(S, renamings));
    }

    private static Wire wire(String luid, Connection source, Connection... targets) {
        return new Wire(S, Luid.of(luid), source, List.of(targets));
    }

    private static Diagram diagram(SwanNode... items) {
        return new Diagram(S, List.of(items));
    }

    @Test
    void singleWireIsSeenFromBothEnds() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, wire("3", end("1", "out"), end("2", "in"))));

        assertEquals(List.of(new Endpoint(b, "in", "in")), g.targets(a));
        assertEquals(List.of(new Endpoint(a, "out", "out")), g.sources(b));
        assertTrue(g.sources(a).isEmpty());
        assertTrue(g.targets(b).isEmpty());
        assertSame(a, g.object("#1").orElseThrow());
        assertSame(b, g.object("2").orElseThrow());
        assertTrue(g.object("3").isEmpty());
    }

    @Test
    void everySourceIsATargetOfItsSource() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        Block c = block("3", "C");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, c,
                wire("10", end("self", "i"), end("1")),
                wire("11", end("1"), end("2"), end("3")),
                wire("12", end("2"), end("3")),
                wire("13", end("3"), end("self", "o"))));

        List<DiagramVertex> vertices = new ArrayList<>(g.objects());
        vertices.add(g.boundary());
        for (DiagramVertex v : vertices) {
            for (Endpoint s : g.sources(v)) {
                assertTrue(g.targets(s.vertex()).stream().anyMatch(t -> t.vertex() == v), v + " <- " + s);
            }
            for (Endpoint t : g.targets(v)) {
                assertTrue(g.sources(t.vertex()).stream().anyMatch(s -> s.vertex() == v), v + " -> " + t);
            }
        }
        assertEquals(2, g.sources(c).size());
        assertEquals(5, g.edges().size());
    }

    @Test
    void adaptationsOfEqualSizeArePairedByPosition() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, wire("3", end("1", "x", "y"), end("2", "p", "q"))));

        List<Endpoint> targets = g.targets(a);
        assertEquals(2, targets.size());
        assertEquals("p", targets.get(0).port());
        assertEquals("q", targets.get(1).port());
        assertEquals("y", g.incoming(b).get(1).source().port());
    }

    @Test
    void barIsLookedThroughByName() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        Block c = block("3", "C");
        Bar bus = bar("4");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, c, bus,
                wire("10", end("1"), end("4", "x:speed")),
                wire("11", end("2"), end("4", "y:mode")),
                wire("12", end("4", "speed"), end("3"))));

        assertEquals(List.of(new Endpoint(bus, "x", "speed")), g.targets(a));
        assertEquals(List.of(new Endpoint(c, null, null)), g.resolvedTargets(a));
        assertTrue(g.resolvedTargets(b).isEmpty());
        assertEquals(List.of(new Endpoint(a, null, null)), g.resolvedSources(c));
    }

    @Test
    void edgesOfAVertexComeInWireOrder() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        Block c = block("3", "C");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, c,
                wire("10", end("2"), end("3")),
                wire("11", end("1"), end("3")),
                wire("12", end("1"), end("3")),
                wire("13", end("3"), end("3"))));

        List<WireEdge> in = g.incoming(c);
        assertEquals(4, in.size());
        assertEquals(List.of(b, a, a, c), in.stream().map(e -> e.source().vertex()).toList());
        assertEquals(List.of(0, 1, 2, 3), in.stream().map(WireEdge::ordinal).toList());
        assertNotSame(g.outgoing(a).get(0), g.outgoing(a).get(1));
        assertEquals(List.of(new Endpoint(c, null, null), new Endpoint(c, null, null)), g.targets(a));
        assertEquals(4, g.graph().incomingEdgesOf(c).size());
        assertEquals(in.get(3), g.outgoing(c).get(0));
    }

    @Test
    void directEndsStopAtABarWhileResolvedEndsSeeThroughIt() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        Block c = block("3", "C");
        Bar bus = bar("4");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, c, bus,
                wire("10", end("1"), end("4", "x:speed")),
                wire("11", end("2"), end("4", "y:mode")),
                wire("12", end("4", "mode"), end("3"))));

        assertEquals(List.of(new Endpoint(bus, "mode", "mode")), g.sources(c));
        assertEquals(List.of(new Endpoint(b, null, null)), g.resolvedSources(c));
        assertEquals(List.of(new Endpoint(c, null, null)), g.resolvedTargets(b));
        assertTrue(g.resolvedTargets(a).isEmpty());
    }

    @Test
    void chainedBarsAndCyclesTerminate() {
        Block a = block("1", "A");
        Bar b1 = bar("2");
        Bar b2 = bar("3");
        DiagramGraph g = DiagramGraph.of(diagram(a, b1, b2,
                wire("10", end("1"), end("2")),
                wire("11", end("2"), end("3")),
                wire("12", end("3"), end("2"), end("1"))));

        assertEquals(List.of(new Endpoint(a, null, null)), g.resolvedTargets(a));
        assertTrue(g.hasFeedback());
        assertTrue(g.feedbackVertices().containsAll(Set.of(a, b1, b2)));
    }

    @Test
    void traversalSharesTheVisitedSet() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        Block c = block("3", "C");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, c,
                wire("10", end("1"), end("2")),
                wire("11", end("2"), end("3")),
                wire("12", end("3"), end("1"))));

        Set<DiagramVertex> visited = new HashSet<>();
        assertEquals(List.of(b, c), DiagramTraversal.downstream(g, a, visited));
        assertTrue(DiagramTraversal.upstream(g, a, visited).isEmpty());
        assertEquals(List.of(b, a), DiagramTraversal.upstream(g, c, new HashSet<>()));
    }

    @Test
    void acyclicDiagramHasNoFeedback() {
        Block a = block("1", "A");
        Block b = block("2", "B");
        DiagramGraph g = DiagramGraph.of(diagram(a, b, wire("3", end("1"), end("2"))));

        assertFalse(g.hasFeedback());
        assertTrue(g.feedbackVertices().isEmpty());
    }

    @Test
    void unconnectedEndsAddNoEdge() {
        Block a = block("1", "A");
        DiagramGraph g = DiagramGraph.of(diagram(a, new Wire(S, Luid.of("2"), end("1"), List.of(Connection.unconnected(S)))));

        assertTrue(g.targets(a).isEmpty());
        assertEquals("(#2 wire #1 => ())", g.diagram().wires().get(0).render());
    }

    @Test
    void duplicateLuidIsRejected() {
        StructuralInvariantException e = assertThrows(StructuralInvariantException.class,
                () -> DiagramGraph.of(diagram(block("1", "A"), block("1", "B"))));
        assertTrue(e.getMessage().contains("#1"));
    }

    @Test
    void wireToUndeclaredLuidIsRejected() {
        Block a = block("1", "A");
        assertThrows(StructuralInvariantException.class,
                () -> DiagramGraph.of(diagram(a, wire("2", end("1"), end("9")))));
    }

    @Test
    void foreignVertexIsAUsageError() {
        DiagramGraph g = DiagramGraph.of(diagram(block("1", "A")));
        assertThrows(IllegalArgumentException.class, () -> g.sources(block("1", "A")));
    }
}
