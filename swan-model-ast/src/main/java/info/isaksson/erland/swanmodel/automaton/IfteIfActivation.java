package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class IfteIfActivation extends IfteBranch {

    private final IfActivation activation;

    public IfteIfActivation(SourceSpan span, IfActivation activation) {
        super(span);
        if (activation == null) throw new IllegalArgumentException("activation is null");
        this.activation = adopt(activation);
    }

    public IfActivation activation() {
        return activation;
    }

    @Override public void write(SwanWriter out) {
        out.node(activation);
    }
}
