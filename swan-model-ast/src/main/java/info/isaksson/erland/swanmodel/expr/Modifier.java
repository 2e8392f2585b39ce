package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code .l[i] = value} inside a functional update. */
public final class Modifier extends SwanNode {

    private final List<LabelOrIndex> path;
    private final Expression value;

    public Modifier(SourceSpan span, List<LabelOrIndex> path, Expression value) {
        super(span);
        this.path = adoptAll(path);
        if (this.path.isEmpty()) throw new IllegalArgumentException("modifier has no path");
        if (value == null) throw new IllegalArgumentException("value is null");
        this.value = adopt(value);
    }

    public List<LabelOrIndex> path() {
        return path;
    }

    public Expression value() {
        return value;
    }

    @Override public void write(SwanWriter out) {
        out.join(path, "").text(" = ").node(value);
    }
}
