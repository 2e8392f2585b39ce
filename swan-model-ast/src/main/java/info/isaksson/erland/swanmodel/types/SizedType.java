package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Expression;

/** {@code signed <<n>>} or {@code unsigned <<n>>} */
public final class SizedType extends TypeExpression {

    private final boolean signed;
    private final Expression size;

    public SizedType(SourceSpan span, boolean signed, Expression size) {
        super(span);
        if (size == null) throw new IllegalArgumentException("size is null");
        this.signed = signed;
        this.size = adopt(size);
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.SIZED;
    }

    public boolean isSigned() {
        return signed;
    }

    public Expression size() {
        return size;
    }

    @Override public void write(SwanWriter out) {
        out.text(signed ? "signed <<" : "unsigned <<").node(size).text(">>");
    }
}
