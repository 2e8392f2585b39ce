package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** Literal kept as written; {@link SwanNumerics} decodes numeric values. */
public final class LiteralExpr extends Expression {

    private final LiteralKind literalKind;
    private final String text;

    public LiteralExpr(SourceSpan span, LiteralKind literalKind, String text) {
        super(span);
        if (literalKind == null) throw new IllegalArgumentException("literalKind is null");
        if (text == null || text.isEmpty()) throw new IllegalArgumentException("literal text is empty");
        this.literalKind = literalKind;
        this.text = text;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.LITERAL;
    }

    public LiteralKind literalKind() {
        return literalKind;
    }

    public String text() {
        return text;
    }

    public boolean isTrue() {
        return literalKind == LiteralKind.BOOL && "true".equals(text);
    }

    public SwanNumerics.IntegerValue integerValue() {
        if (literalKind != LiteralKind.INTEGER) throw new IllegalStateException("not an integer literal: " + text);
        return SwanNumerics.parseInteger(text, false);
    }

    public SwanNumerics.FloatValue floatValue() {
        if (literalKind != LiteralKind.FLOAT) throw new IllegalStateException("not a float literal: " + text);
        return SwanNumerics.parseFloat(text, false);
    }

    @Override public void write(SwanWriter out) {
        out.text(text);
    }
}
