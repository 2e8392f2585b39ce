package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

import java.util.List;
import java.util.Optional;

/** Branching arrow target: {@link ForkTree} or {@link ForkPriorityList}. */
public abstract class Fork extends SwanNode {

    protected Fork(SourceSpan span) {
        super(span);
    }

    /** Arrows in evaluation order, else arrows last. */
    public abstract List<Arrow> arrows();

    /**
     * First arrow whose guard holds according to the oracle, else the else arrow.
     * An arrow without guard is taken as holding.
     */
    public Optional<Arrow> select(GuardOracle oracle) {
        if (oracle == null) throw new IllegalArgumentException("oracle is null");
        return doSelect(oracle);
    }

    protected abstract Optional<Arrow> doSelect(GuardOracle oracle);

    protected static boolean holds(Arrow arrow, GuardOracle oracle) {
        return arrow.guard().map(oracle::holds).orElse(true);
    }
}
