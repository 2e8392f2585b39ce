package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class UnderscorePattern extends Pattern {

    public UnderscorePattern(SourceSpan span) {
        super(span);
    }

    @Override public PatternKind kind() {
        return PatternKind.UNDERSCORE;
    }

    @Override public void write(SwanWriter out) {
        out.text("_");
    }
}
