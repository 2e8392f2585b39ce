package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.expr.Expression;

/** Supplies guard values when selecting a fork branch; the model never evaluates guards. */
@FunctionalInterface
public interface GuardOracle {

    boolean holds(Expression guard);
}
