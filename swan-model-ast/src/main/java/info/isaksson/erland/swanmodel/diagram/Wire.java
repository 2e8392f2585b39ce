package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;
import java.util.Optional;

/** {@code (#w wire source => target, ...)} */
public final class Wire extends SwanNode {

    private final Luid luid;
    private final Connection source;
    private final List<Connection> targets;

    public Wire(SourceSpan span, Luid luid, Connection source, List<Connection> targets) {
        super(span);
        if (source == null) throw new IllegalArgumentException("source is null");
        this.luid = luid;
        this.source = adopt(source);
        this.targets = adoptAll(targets);
        if (this.targets.isEmpty()) throw new IllegalArgumentException("wire has no target");
    }

    public Optional<Luid> luid() {
        return Optional.ofNullable(luid);
    }

    public Connection source() {
        return source;
    }

    public List<Connection> targets() {
        return targets;
    }

    @Override public void write(SwanWriter out) {
        out.text("(");
        if (luid != null) out.text(luid.toString()).text(" ");
        out.text("wire ").node(source).text(" => ").join(targets, ", ").text(")");
    }
}
