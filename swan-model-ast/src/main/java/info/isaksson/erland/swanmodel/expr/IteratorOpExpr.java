package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code map Op}, {@code fold Op}... */
public final class IteratorOpExpr extends OperatorExpression {

    private final IteratorKind iterator;
    private final OperatorCall operator;

    public IteratorOpExpr(SourceSpan span, IteratorKind iterator, OperatorCall operator) {
        super(span);
        if (iterator == null) throw new IllegalArgumentException("iterator is null");
        if (operator == null) throw new IllegalArgumentException("operator is null");
        this.iterator = iterator;
        this.operator = adopt(operator);
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.ITERATOR;
    }

    public IteratorKind iterator() {
        return iterator;
    }

    public OperatorCall operator() {
        return operator;
    }

    @Override public void write(SwanWriter out) {
        out.text(iterator.keyword()).text(" ").node(operator);
    }
}
