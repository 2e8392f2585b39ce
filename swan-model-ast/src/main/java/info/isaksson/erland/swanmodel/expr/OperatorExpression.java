package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

/** Higher order operator written between parentheses: {@code (map Op)}, {@code (+)}... */
public abstract class OperatorExpression extends SwanNode {

    protected OperatorExpression(SourceSpan span) {
        super(span);
    }

    public abstract OperatorExpressionKind kind();
}
