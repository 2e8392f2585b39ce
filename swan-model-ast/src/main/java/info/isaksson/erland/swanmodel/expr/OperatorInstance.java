package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code operator [#luid] (arguments)} */
public final class OperatorInstance extends Expression {

    private final OperatorCall operator;
    private final Luid luid;
    private final Group arguments;

    public OperatorInstance(SourceSpan span, OperatorCall operator, Luid luid, Group arguments) {
        super(span);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        if (arguments == null) throw new IllegalArgumentException("arguments is null");
        this.operator = adopt(operator);
        this.luid = luid;
        this.arguments = adopt(arguments);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.OPERATOR_INSTANCE;
    }

    public OperatorCall operator() {
        return operator;
    }

    public Optional<Luid> luid() {
        return Optional.ofNullable(luid);
    }

    public Group arguments() {
        return arguments;
    }

    @Override public void write(SwanWriter out) {
        out.node(operator);
        if (luid != null) out.text(" ").text(luid.toString());
        out.text(" (").node(arguments).text(")");
    }
}
