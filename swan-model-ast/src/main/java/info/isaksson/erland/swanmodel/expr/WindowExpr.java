package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code window <<size>> (init) (params)} */
public final class WindowExpr extends Expression {

    private final Expression size;
    private final Group init;
    private final Group params;

    public WindowExpr(SourceSpan span, Expression size, Group init, Group params) {
        super(span);
        if (size == null || init == null || params == null) throw new IllegalArgumentException("operand is null");
        this.size = adopt(size);
        this.init = adopt(init);
        this.params = adopt(params);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.WINDOW;
    }

    public Expression size() {
        return size;
    }

    public Group init() {
        return init;
    }

    public Group params() {
        return params;
    }

    @Override public void write(SwanWriter out) {
        out.text("window <<").node(size).text(">> (").node(init).text(") (").node(params).text(")");
    }
}
