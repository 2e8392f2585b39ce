package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** Access step {@code .label} or {@code [index]}. */
public final class LabelOrIndex extends SwanNode {

    private final Identifier label;
    private final Expression index;

    private LabelOrIndex(SourceSpan span, Identifier label, Expression index) {
        super(span);
        this.label = label;
        this.index = adopt(index);
    }

    public static LabelOrIndex label(SourceSpan span, Identifier label) {
        if (label == null) throw new IllegalArgumentException("label is null");
        return new LabelOrIndex(span, label, null);
    }

    public static LabelOrIndex index(SourceSpan span, Expression index) {
        if (index == null) throw new IllegalArgumentException("index is null");
        return new LabelOrIndex(span, null, index);
    }

    public Optional<Identifier> label() {
        return Optional.ofNullable(label);
    }

    public Optional<Expression> index() {
        return Optional.ofNullable(index);
    }

    @Override public void write(SwanWriter out) {
        if (label != null) out.text(".").text(label.value());
        else out.text("[").node(index).text("]");
    }
}
