package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** Integer literal pattern, optionally negative: {@code -1}. */
public final class IntPattern extends Pattern {

    private final String text;
    private final boolean negative;

    public IntPattern(SourceSpan span, String text, boolean negative) {
        super(span);
        if (text == null || !SwanNumerics.isInteger(text)) {
            throw new IllegalArgumentException("not an integer literal: " + text);
        }
        this.text = text;
        this.negative = negative;
    }

    @Override public PatternKind kind() {
        return PatternKind.INTEGER;
    }

    public String text() {
        return text;
    }

    public boolean isNegative() {
        return negative;
    }

    public SwanNumerics.IntegerValue value() {
        return SwanNumerics.parseInteger(text, negative);
    }

    @Override public void write(SwanWriter out) {
        if (negative) out.text("-");
        out.text(text);
    }
}
