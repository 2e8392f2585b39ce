package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code :p: if arrow} or {@code :p: else arrow}; the priority may be omitted ({@code ::}). */
public final class ForkWithPriority extends SwanNode {

    private final Integer priority;
    private final Arrow arrow;
    private final boolean ifArrow;

    public ForkWithPriority(SourceSpan span, Integer priority, Arrow arrow, boolean ifArrow) {
        super(span);
        if (arrow == null) throw new IllegalArgumentException("arrow is null");
        this.priority = priority;
        this.arrow = adopt(arrow);
        this.ifArrow = ifArrow;
    }

    public Optional<Integer> priority() {
        return Optional.ofNullable(priority);
    }

    public Arrow arrow() {
        return arrow;
    }

    public boolean isIfArrow() {
        return ifArrow;
    }

    @Override public void write(SwanWriter out) {
        out.text(":").text(priority == null ? "" : priority.toString()).text(": ");
        out.text(ifArrow ? "if " : "else ").node(arrow);
    }
}
