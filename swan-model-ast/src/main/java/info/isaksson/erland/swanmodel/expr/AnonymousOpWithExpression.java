package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code function|node x, y [sections] => expr} */
public final class AnonymousOpWithExpression extends OperatorExpression {

    private final boolean node;
    private final List<Identifier> parameters;
    private final List<ScopeSection> sections;
    private final Expression expression;

    public AnonymousOpWithExpression(SourceSpan span, boolean node, List<Identifier> parameters,
                                     List<ScopeSection> sections, Expression expression) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.node = node;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (this.parameters.isEmpty()) throw new IllegalArgumentException("anonymous operator has no parameter");
        this.sections = adoptAll(sections);
        this.expression = adopt(expression);
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.ANONYMOUS_WITH_EXPRESSION;
    }

    public boolean isNode() {
        return node;
    }

    public List<Identifier> parameters() {
        return parameters;
    }

    public List<ScopeSection> sections() {
        return sections;
    }

    public Expression expression() {
        return expression;
    }

    @Override public void write(SwanWriter out) {
        out.text(node ? "node " : "function ");
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) out.text(", ");
            out.text(parameters.get(i).render());
        }
        if (sections.isEmpty()) {
            out.text(" => ").node(expression);
            return;
        }
        out.indent();
        for (ScopeSection s : sections) out.line().node(s);
        out.dedent().line().text("=> ").node(expression);
    }
}
