package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.GroupAdaptation;
import info.isaksson.erland.swanmodel.expr.PortExpr;

import java.util.Optional;

/** Wire end: {@code #luid [.(adaptation)]}, {@code self [.(adaptation)]}, or {@code ()} when unconnected. */
public final class Connection extends SwanNode {

    private final PortExpr port;
    private final GroupAdaptation adaptation;

    private Connection(SourceSpan span, PortExpr port, GroupAdaptation adaptation) {
        super(span);
        this.port = adopt(port);
        this.adaptation = adopt(adaptation);
    }

    public static Connection of(SourceSpan span, PortExpr port, GroupAdaptation adaptation) {
        if (port == null) throw new IllegalArgumentException("port is null");
        return new Connection(span, port, adaptation);
    }

    public static Connection unconnected(SourceSpan span) {
        return new Connection(span, null, null);
    }

    public boolean isConnected() {
        return port != null;
    }

    public Optional<PortExpr> port() {
        return Optional.ofNullable(port);
    }

    public Optional<GroupAdaptation> adaptation() {
        return Optional.ofNullable(adaptation);
    }

    @Override public void write(SwanWriter out) {
        if (port == null) {
            out.text("()");
            return;
        }
        out.node(port);
        if (adaptation != null) out.text(" ").node(adaptation);
    }
}
