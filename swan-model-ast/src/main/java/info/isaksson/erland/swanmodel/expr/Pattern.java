package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

/** Pattern of a {@code case} branch, an {@code activate when} branch or a clock match. */
public abstract class Pattern extends SwanNode {

    protected Pattern(SourceSpan span) {
        super(span);
    }

    public abstract PatternKind kind();
}
