package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.ProtectedItem;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class ProtectedTypeExpr extends TypeExpression implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedTypeExpr(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
