package info.isaksson.erland.swanmodel.ast;

import java.util.List;

/** A keyword followed by {@code ;}-terminated declarations: {@code type A = int32; B = bool;}. */
public abstract class DeclarationList<T extends SwanNode & Declaration> extends GlobalDeclaration {

    private final List<T> items;

    protected DeclarationList(SourceSpan span, List<T> items) {
        super(span);
        this.items = adoptAll(items);
    }

    public List<T> items() {
        return items;
    }

    @Override public List<T> members() {
        return items;
    }

    protected abstract String keyword();

    @Override public void write(SwanWriter out) {
        out.text(keyword());
        for (T item : items) {
            out.text(" ").node(item).text(";");
        }
    }
}
