package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/**
 * Entry of a group adaptation: {@code a} or {@code 1} selects, {@code a: b} selects and
 * renames, {@code a:} selects and keeps the name as a label.
 */
public final class GroupRenaming extends SwanNode {

    private final String source;
    private final boolean index;
    private final Identifier renaming;
    private final boolean shortcut;

    public GroupRenaming(SourceSpan span, String source, boolean index, Identifier renaming, boolean shortcut) {
        super(span);
        if (source == null || source.isEmpty()) throw new IllegalArgumentException("source is empty");
        if (renaming != null && shortcut) throw new IllegalArgumentException("a shortcut has no renaming");
        this.source = source;
        this.index = index;
        this.renaming = renaming;
        this.shortcut = shortcut;
    }

    /** Selected item: a label or a position. */
    public String source() {
        return source;
    }

    public boolean isIndex() {
        return index;
    }

    public Optional<Identifier> renaming() {
        return Optional.ofNullable(renaming);
    }

    public boolean isShortcut() {
        return shortcut;
    }

    /** Name the selected item carries after adaptation. */
    public String resultName() {
        return renaming != null ? renaming.value() : source;
    }

    @Override public void write(SwanWriter out) {
        out.text(source);
        if (renaming != null) out.text(": ").text(renaming.render());
        else if (shortcut) out.text(":");
    }
}
