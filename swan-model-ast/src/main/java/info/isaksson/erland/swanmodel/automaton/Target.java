package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code restart X} or {@code resume X}. */
public final class Target extends SwanNode {

    private final Identification state;
    private final boolean resume;

    public Target(SourceSpan span, Identification state, boolean resume) {
        super(span);
        this.state = state == null ? Identification.UNDEFINED : state;
        this.resume = resume;
    }

    public Identification state() {
        return state;
    }

    public boolean isResume() {
        return resume;
    }

    public boolean isRestart() {
        return !resume;
    }

    @Override public void write(SwanWriter out) {
        out.text(resume ? "resume" : "restart");
        if (!state.isUndefined()) out.text(" ").text(state.render());
    }
}
