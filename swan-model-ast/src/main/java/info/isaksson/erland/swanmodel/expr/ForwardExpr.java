package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;
import java.util.Optional;

/**
 * Iteration over array dimensions:
 * {@code forward [#luid] [restart|resume] <<n>> ... [unless c] sections [until c] returns (items)}.
 */
public final class ForwardExpr extends Expression {

    public enum State { NONE, RESTART, RESUME }

    private final Luid luid;
    private final State state;
    private final List<ForwardDim> dimensions;
    private final Expression unless;
    private final List<ScopeSection> sections;
    private final Expression until;
    private final List<ForwardReturn> returns;

    public ForwardExpr(SourceSpan span, Luid luid, State state, List<ForwardDim> dimensions, Expression unless,
                       List<ScopeSection> sections, Expression until, List<ForwardReturn> returns) {
        super(span);
        this.luid = luid;
        this.state = state == null ? State.NONE : state;
        this.dimensions = adoptAll(dimensions);
        if (this.dimensions.isEmpty()) throw new IllegalArgumentException("forward has no dimension");
        this.unless = adopt(unless);
        this.sections = adoptAll(sections);
        this.until = adopt(until);
        this.returns = adoptAll(returns);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.FORWARD;
    }

    public Optional<Luid> luid() {
        return Optional.ofNullable(luid);
    }

    public State state() {
        return state;
    }

    public List<ForwardDim> dimensions() {
        return dimensions;
    }

    public Optional<Expression> unless() {
        return Optional.ofNullable(unless);
    }

    public List<ScopeSection> sections() {
        return sections;
    }

    public Optional<Expression> until() {
        return Optional.ofNullable(until);
    }

    public List<ForwardReturn> returns() {
        return returns;
    }

    @Override public void write(SwanWriter out) {
        out.text("forward");
        if (luid != null) out.text(" ").text(luid.toString());
        if (state != State.NONE) out.text(state == State.RESTART ? " restart" : " resume");
        for (ForwardDim d : dimensions) out.text(" ").node(d);
        out.indent();
        if (unless != null) out.line().text("unless ").node(unless);
        for (ScopeSection s : sections) out.line().node(s);
        if (until != null) out.line().text("until ").node(until);
        out.dedent().line().text("returns (").join(returns, ", ").text(")");
    }
}
