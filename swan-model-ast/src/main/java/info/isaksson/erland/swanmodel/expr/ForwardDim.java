package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code <<size>> [with <<index>>]} */
public final class ForwardDim extends SwanNode {

    private final Expression size;
    private final Identifier index;

    public ForwardDim(SourceSpan span, Expression size, Identifier index) {
        super(span);
        if (size == null) throw new IllegalArgumentException("size is null");
        this.size = adopt(size);
        this.index = index;
    }

    public Expression size() {
        return size;
    }

    public Optional<Identifier> index() {
        return Optional.ofNullable(index);
    }

    @Override public void write(SwanWriter out) {
        out.text("<<").node(size).text(">>");
        if (index != null) out.text(" with <<").text(index.render()).text(">>");
    }
}
