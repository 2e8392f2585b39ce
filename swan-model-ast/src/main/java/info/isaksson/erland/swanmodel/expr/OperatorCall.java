package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** Operator part of an instance, with its size parameters {@code <<a, b>>}. */
public abstract class OperatorCall extends SwanNode {

    private final List<Expression> sizes;

    protected OperatorCall(SourceSpan span, List<Expression> sizes) {
        super(span);
        this.sizes = sizes == null ? List.of() : List.copyOf(sizes);
    }

    public abstract OperatorCallKind kind();

    public final List<Expression> sizes() {
        return sizes;
    }

    /** Adopts the sizes; subclasses call it after adopting the operator part. */
    protected final void adoptSizes() {
        adoptAll(sizes);
    }

    protected final void writeSizes(SwanWriter out) {
        if (sizes.isEmpty()) return;
        out.text(" <<").join(sizes, ", ").text(">>");
    }
}
