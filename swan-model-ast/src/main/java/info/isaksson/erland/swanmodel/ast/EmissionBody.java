package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.expr.Expression;

import java.util.List;
import java.util.Optional;

/** {@code [#luid] 's1, 's2 [if condition]} */
public final class EmissionBody extends SwanNode {

    private final Luid luid;
    private final List<Identifier> flows;
    private final Expression condition;

    public EmissionBody(SourceSpan span, Luid luid, List<Identifier> flows, Expression condition) {
        super(span);
        if (flows == null || flows.isEmpty()) throw new IllegalArgumentException("emission has no flow");
        this.luid = luid;
        this.flows = List.copyOf(flows);
        this.condition = adopt(condition);
    }

    public Optional<Luid> luid() {
        return Optional.ofNullable(luid);
    }

    public List<Identifier> flows() {
        return flows;
    }

    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    @Override public void write(SwanWriter out) {
        if (luid != null) out.text(luid.toString()).text(" ");
        for (int i = 0; i < flows.size(); i++) {
            if (i > 0) out.text(", ");
            out.text(flows.get(i).render());
        }
        if (condition != null) out.text(" if ").node(condition);
    }
}
