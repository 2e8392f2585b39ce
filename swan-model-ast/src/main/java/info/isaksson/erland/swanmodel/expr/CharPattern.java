package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** Character literal pattern; the text keeps its quotes. */
public final class CharPattern extends Pattern {

    private final String text;

    public CharPattern(SourceSpan span, String text) {
        super(span);
        if (text == null || text.length() < 3) throw new IllegalArgumentException("not a char literal: " + text);
        this.text = text;
    }

    @Override public PatternKind kind() {
        return PatternKind.CHAR;
    }

    public String text() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.text(text);
    }
}
