package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

/** Body of an {@code activate if} branch: a data definition or a nested activation. */
public abstract class IfteBranch extends SwanNode {

    protected IfteBranch(SourceSpan span) {
        super(span);
    }
}
