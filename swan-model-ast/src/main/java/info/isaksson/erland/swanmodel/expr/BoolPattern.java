package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class BoolPattern extends Pattern {

    private final boolean value;

    public BoolPattern(SourceSpan span, boolean value) {
        super(span);
        this.value = value;
    }

    @Override public PatternKind kind() {
        return PatternKind.BOOL;
    }

    public boolean value() {
        return value;
    }

    @Override public void write(SwanWriter out) {
        out.text(value ? "true" : "false");
    }
}
