package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code (T, U, a: V)}: positional items come before named ones. */
public final class GroupTypeList extends GroupTypeExpression {

    private final List<GroupTypeItem> items;

    public GroupTypeList(SourceSpan span, List<GroupTypeItem> items) {
        super(span);
        this.items = adoptAll(items);
        boolean named = false;
        for (GroupTypeItem i : this.items) {
            if (i.label().isPresent()) named = true;
            else if (named) throw new IllegalArgumentException("positional group item after a named one");
        }
    }

    public List<GroupTypeItem> items() {
        return items;
    }

    @Override public void write(SwanWriter out) {
        out.text("(").join(items, ", ").text(")");
    }
}
