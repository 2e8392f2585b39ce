package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code if (guard) [scope] target;} or, unguarded, {@code [scope] target;}. */
public final class Transition extends SwanNode {

    private final Arrow arrow;

    public Transition(SourceSpan span, Arrow arrow) {
        super(span);
        if (arrow == null) throw new IllegalArgumentException("arrow is null");
        this.arrow = adopt(arrow);
    }

    public Arrow arrow() {
        return arrow;
    }

    public boolean isGuarded() {
        return arrow.guard().isPresent();
    }

    @Override public void write(SwanWriter out) {
        if (isGuarded() || arrow.fork().isPresent()) out.text("if ");
        out.node(arrow).text(";");
    }
}
