package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class DefaultPattern extends Pattern {

    public DefaultPattern(SourceSpan span) {
        super(span);
    }

    @Override public PatternKind kind() {
        return PatternKind.DEFAULT;
    }

    @Override public void write(SwanWriter out) {
        out.text("default");
    }
}
