package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

public abstract class Expression extends SwanNode {

    protected Expression(SourceSpan span) {
        super(span);
    }

    public abstract ExpressionKind kind();
}
