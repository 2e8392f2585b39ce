package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.expr.ClockExpr;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.types.TypeExpression;

import java.util.Optional;

/** {@code [clock] [probe] x [: T] [when clk] [default = e] [last = e]} */
public final class VarDecl extends Variable implements Declaration {

    private final Identifier identifier;
    private final boolean clock;
    private final boolean probe;
    private final TypeExpression type;
    private final ClockExpr when;
    private final Expression defaultValue;
    private final Expression last;

    public VarDecl(SourceSpan span, Identifier identifier, boolean clock, boolean probe,
                   TypeExpression type, ClockExpr when, Expression defaultValue, Expression last) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        this.identifier = identifier;
        this.clock = clock;
        this.probe = probe;
        this.type = adopt(type);
        this.when = adopt(when);
        this.defaultValue = adopt(defaultValue);
        this.last = adopt(last);
    }

    /** Plain {@code x: T}. */
    public static VarDecl of(SourceSpan span, Identifier identifier, TypeExpression type) {
        return new VarDecl(span, identifier, false, false, type, null, null, null);
    }

    @Override public Identifier identifier() {
        return identifier;
    }

    public boolean isClock() {
        return clock;
    }

    public boolean isProbe() {
        return probe;
    }

    public Optional<TypeExpression> type() {
        return Optional.ofNullable(type);
    }

    public Optional<ClockExpr> when() {
        return Optional.ofNullable(when);
    }

    public Optional<Expression> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public Optional<Expression> last() {
        return Optional.ofNullable(last);
    }

    @Override public void write(SwanWriter out) {
        if (clock) out.text("clock ");
        if (probe) out.text("probe ");
        out.text(identifier.render());
        if (type != null) out.text(": ").node(type);
        if (when != null) out.text(" when ").node(when);
        if (defaultValue != null) out.text(" default = ").node(defaultValue);
        if (last != null) out.text(" last = ").node(last);
    }
}
