package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.ProtectedItem;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class ProtectedPattern extends Pattern implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedPattern(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public PatternKind kind() {
        return PatternKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
