package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Expression;

/** {@code T ^ size} */
public final class ArrayType extends TypeExpression {

    private final TypeExpression element;
    private final Expression size;

    public ArrayType(SourceSpan span, TypeExpression element, Expression size) {
        super(span);
        if (element == null) throw new IllegalArgumentException("element is null");
        if (size == null) throw new IllegalArgumentException("size is null");
        this.element = adopt(element);
        this.size = adopt(size);
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.ARRAY;
    }

    public TypeExpression element() {
        return element;
    }

    public Expression size() {
        return size;
    }

    @Override public void write(SwanWriter out) {
        out.node(element).text(" ^ ").node(size);
    }
}
