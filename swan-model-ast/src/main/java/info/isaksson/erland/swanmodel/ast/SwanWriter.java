package info.isaksson.erland.swanmodel.ast;

import java.util.List;

/**
 * Canonical text writer used by {@link SwanNode#render()}.
 *
 * <p>Indentation is two spaces per level and is emitted lazily at the first text of a line,
 * so blank lines never carry trailing spaces. Raw text is written as is.</p>
 */
public final class SwanWriter {

    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private int level = 0;
    private boolean atLineStart = true;

    public SwanWriter text(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            sb.append(INDENT.repeat(level));
            atLineStart = false;
        }
        sb.append(text);
        return this;
    }

    public SwanWriter node(SwanNode node) {
        if (node != null) node.write(this);
        return this;
    }

    /** Writes the nodes separated by {@code separator}. */
    public SwanWriter join(List<? extends SwanNode> nodes, String separator) {
        boolean first = true;
        for (SwanNode n : nodes) {
            if (!first) text(separator);
            first = false;
            node(n);
        }
        return this;
    }

    /** Verbatim text; embedded line breaks are not re-indented. */
    public SwanWriter raw(String text) {
        return text(text);
    }

    public SwanWriter line() {
        sb.append('\n');
        atLineStart = true;
        return this;
    }

    public SwanWriter indent() {
        level++;
        return this;
    }

    public SwanWriter dedent() {
        if (level == 0) throw new IllegalStateException("unbalanced dedent");
        level--;
        return this;
    }

    @Override public String toString() {
        return sb.toString();
    }
}
