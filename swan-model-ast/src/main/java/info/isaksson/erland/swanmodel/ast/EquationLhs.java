package info.isaksson.erland.swanmodel.ast;

import java.util.List;

/** {@code x, _, y}, {@code x, ..} (partial), or {@code ()}. */
public final class EquationLhs extends SwanNode {

    private final List<LhsItem> items;
    private final boolean partial;

    public EquationLhs(SourceSpan span, List<LhsItem> items, boolean partial) {
        super(span);
        this.items = adoptAll(items);
        if (partial && this.items.isEmpty()) throw new IllegalArgumentException("partial lhs needs an item");
        this.partial = partial;
    }

    public List<LhsItem> items() {
        return items;
    }

    public boolean isPartial() {
        return partial;
    }

    @Override public void write(SwanWriter out) {
        if (items.isEmpty()) {
            out.text("()");
            return;
        }
        out.join(items, ", ");
        if (partial) out.text(", ..");
    }
}
