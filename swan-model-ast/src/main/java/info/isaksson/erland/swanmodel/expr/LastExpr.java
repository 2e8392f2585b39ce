package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code last 'x} */
public final class LastExpr extends Expression {

    private final Identifier name;

    public LastExpr(SourceSpan span, Identifier name) {
        super(span);
        if (name == null) throw new IllegalArgumentException("name is null");
        this.name = name;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.LAST;
    }

    public Identifier name() {
        return name;
    }

    @Override public void write(SwanWriter out) {
        out.text("last ").text(name.value());
    }
}
