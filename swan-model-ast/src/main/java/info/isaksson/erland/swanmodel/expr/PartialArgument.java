package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** Bound argument of a partial application, or {@code _} for a free one. */
public final class PartialArgument extends SwanNode {

    private final Expression expression;

    public PartialArgument(SourceSpan span, Expression expression) {
        super(span);
        this.expression = adopt(expression);
    }

    public Optional<Expression> expression() {
        return Optional.ofNullable(expression);
    }

    public boolean isFree() {
        return expression == null;
    }

    @Override public void write(SwanWriter out) {
        if (expression == null) out.text("_");
        else out.node(expression);
    }
}
