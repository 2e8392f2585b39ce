package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.expr.PathIdExpr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ForkTest {

    private static final SourceSpan S = SourceSpan.NONE;

    private static Expression guard(String name) {
        return new PathIdExpr(S, PathIdentifier.parse(name));
    }

    private static Arrow arrow(Expression guard, String state) {
        return new Arrow(S, guard, null, new Target(S, new Identification(null, Identifier.of(state)), false));
    }

    private static GuardOracle oracle(Map<String, Boolean> values) {
        return g -> values.get(g.render());
    }

    @Test
    void treeSelectsFirstHoldingArrow() {
        Arrow a1 = arrow(guard("g1"), "S1");
        Arrow a2 = arrow(guard("g2"), "S2");
        Arrow a3 = arrow(guard("g3"), "S3");
        ForkTree fork = new ForkTree(S, a1, List.of(a2, a3), arrow(null, "S4"));

        Arrow selected = fork.select(oracle(Map.of("g1", false, "g2", true, "g3", true))).orElseThrow();

        assertSame(a2, selected);
    }

    @Test
    void treeFallsBackToElse() {
        Arrow otherwise = arrow(null, "S2");
        ForkTree fork = new ForkTree(S, arrow(guard("g1"), "S1"), List.of(), otherwise);

        assertSame(otherwise, fork.select(g -> false).orElseThrow());
        assertEquals("if (g1) restart S1 else restart S2 end", fork.render());
    }

    @Test
    void treeWithoutElseMaySelectNothing() {
        ForkTree fork = new ForkTree(S, arrow(guard("g1"), "S1"), List.of(), null);

        assertTrue(fork.select(g -> false).isEmpty());
    }

    @Test
    void priorityListIsConsideredInPriorityOrder() {
        Arrow low = arrow(guard("g1"), "S1");
        Arrow high = arrow(guard("g2"), "S2");
        Arrow unnumbered = arrow(guard("g3"), "S3");
        Arrow otherwise = arrow(null, "S4");
        ForkPriorityList fork = new ForkPriorityList(S, List.of(
                new ForkWithPriority(S, null, unnumbered, true),
                new ForkWithPriority(S, 2, low, true),
                new ForkWithPriority(S, 3, otherwise, false),
                new ForkWithPriority(S, 1, high, true)));

        assertEquals(List.of(high, low, unnumbered, otherwise), fork.arrows());
        assertSame(low, fork.select(oracle(Map.of("g1", true, "g2", false, "g3", true))).orElseThrow());
        assertSame(otherwise, fork.select(g -> false).orElseThrow());
        assertEquals(":: if (g3) restart S3 :2: if (g1) restart S1 :3: else restart S4 :1: if (g2) restart S2 end",
                fork.render());
    }

    @Test
    void selectionIsRepeatable() {
        ForkTree fork = new ForkTree(S, arrow(guard("g1"), "S1"), List.of(arrow(guard("g2"), "S2")), null);
        GuardOracle o = oracle(Map.of("g1", false, "g2", true));

        assertSame(fork.select(o).orElseThrow(), fork.select(o).orElseThrow());
    }

    @Test
    void oracleIsRequired() {
        ForkTree fork = new ForkTree(S, arrow(guard("g1"), "S1"), List.of(), null);
        assertThrows(IllegalArgumentException.class, () -> fork.select(null));
    }
}
