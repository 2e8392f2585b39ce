package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code Op \ a, _} */
public final class PartialOpExpr extends OperatorExpression {

    private final OperatorCall operator;
    private final List<PartialArgument> arguments;

    public PartialOpExpr(SourceSpan span, OperatorCall operator, List<PartialArgument> arguments) {
        super(span);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        this.operator = adopt(operator);
        this.arguments = adoptAll(arguments);
        if (this.arguments.isEmpty()) throw new IllegalArgumentException("partial application has no argument");
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.PARTIAL;
    }

    public OperatorCall operator() {
        return operator;
    }

    public List<PartialArgument> arguments() {
        return arguments;
    }

    @Override public void write(SwanWriter out) {
        out.node(operator).text(" \\ ").join(arguments, ", ");
    }
}
