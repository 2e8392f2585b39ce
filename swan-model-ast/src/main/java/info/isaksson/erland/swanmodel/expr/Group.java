package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** Comma separated group items, written without enclosing brackets. */
public final class Group extends SwanNode {

    private final List<GroupItem> items;

    public Group(SourceSpan span, List<GroupItem> items) {
        super(span);
        this.items = adoptAll(items);
    }

    public List<GroupItem> items() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override public void write(SwanWriter out) {
        out.join(items, ", ");
    }
}
