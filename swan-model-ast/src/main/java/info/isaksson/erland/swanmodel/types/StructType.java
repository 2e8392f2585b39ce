package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code {a: T, b: U}} */
public final class StructType extends TypeExpression {

    private final List<StructField> fields;

    public StructType(SourceSpan span, List<StructField> fields) {
        super(span);
        this.fields = adoptAll(fields);
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.STRUCT;
    }

    public List<StructField> fields() {
        return fields;
    }

    @Override public void write(SwanWriter out) {
        out.text("{").join(fields, ", ").text("}");
    }
}
