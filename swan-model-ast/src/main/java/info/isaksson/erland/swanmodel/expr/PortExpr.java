package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** Diagram port reference: {@code #luid} or {@code self}. */
public final class PortExpr extends Expression {

    private final Luid luid;

    private PortExpr(SourceSpan span, Luid luid) {
        super(span);
        this.luid = luid;
    }

    public static PortExpr of(SourceSpan span, Luid luid) {
        if (luid == null) throw new IllegalArgumentException("luid is null");
        return new PortExpr(span, luid);
    }

    public static PortExpr self(SourceSpan span) {
        return new PortExpr(span, null);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.PORT;
    }

    public boolean isSelf() {
        return luid == null;
    }

    public Optional<Luid> luid() {
        return Optional.ofNullable(luid);
    }

    @Override public void write(SwanWriter out) {
        out.text(luid == null ? "self" : luid.toString());
    }
}
