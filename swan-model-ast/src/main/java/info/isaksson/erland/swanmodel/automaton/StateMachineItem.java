package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

public abstract class StateMachineItem extends SwanNode {

    protected StateMachineItem(SourceSpan span) {
        super(span);
    }

    public abstract StateMachineItemKind kind();
}
