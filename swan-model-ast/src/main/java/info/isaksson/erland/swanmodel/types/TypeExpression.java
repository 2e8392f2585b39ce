package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

public abstract class TypeExpression extends SwanNode {

    protected TypeExpression(SourceSpan span) {
        super(span);
    }

    public abstract TypeExpressionKind kind();
}
