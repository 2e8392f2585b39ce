package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.ProtectedItem;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class ProtectedExpr extends Expression implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedExpr(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
