package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

public final class PrimitiveOperatorCall extends OperatorCall {

    private final PrimitiveOperator operator;

    public PrimitiveOperatorCall(SourceSpan span, PrimitiveOperator operator, List<Expression> sizes) {
        super(span, sizes);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        this.operator = operator;
        adoptSizes();
    }

    @Override public OperatorCallKind kind() {
        return OperatorCallKind.PRIMITIVE;
    }

    public PrimitiveOperator operator() {
        return operator;
    }

    @Override public void write(SwanWriter out) {
        out.text(operator.keyword());
        writeSizes(out);
    }
}
