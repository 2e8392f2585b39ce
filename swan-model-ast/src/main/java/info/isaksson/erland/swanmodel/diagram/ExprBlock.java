package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Expression;

import java.util.List;

/** {@code (#1 expr e)} */
public final class ExprBlock extends DiagramObject {

    private final Expression expression;

    public ExprBlock(SourceSpan span, Luid luid, Expression expression, List<? extends SwanNode> locals) {
        super(span, luid, locals);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.expression = adopt(expression);
        adoptLocals();
    }

    @Override public DiagramObjectKind kind() {
        return DiagramObjectKind.EXPR_BLOCK;
    }

    public Expression expression() {
        return expression;
    }

    @Override protected void writeContent(SwanWriter out) {
        out.text("expr ").node(expression);
    }
}
