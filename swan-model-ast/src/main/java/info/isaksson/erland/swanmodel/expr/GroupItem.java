package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code [label:] expr} */
public final class GroupItem extends SwanNode {

    private final Identifier label;
    private final Expression expression;

    public GroupItem(SourceSpan span, Identifier label, Expression expression) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.label = label;
        this.expression = adopt(expression);
    }

    public Optional<Identifier> label() {
        return Optional.ofNullable(label);
    }

    public Expression expression() {
        return expression;
    }

    @Override public void write(SwanWriter out) {
        if (label != null) out.text(label.render()).text(": ");
        out.node(expression);
    }
}
