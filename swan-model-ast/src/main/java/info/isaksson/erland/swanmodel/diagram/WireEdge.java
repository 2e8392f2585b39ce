package info.isaksson.erland.swanmodel.diagram;

/**
 * Edge of a {@link DiagramGraph}, one per pair of resolved endpoints of a wire. Equality is
 * identity, so parallel edges between the same objects stay distinct.
 */
public final class WireEdge {

    private final Wire wire;
    private final int ordinal;
    private final Endpoint source;
    private final Endpoint target;

    WireEdge(Wire wire, int ordinal, Endpoint source, Endpoint target) {
        this.wire = wire;
        this.ordinal = ordinal;
        this.source = source;
        this.target = target;
    }

    public Wire wire() {
        return wire;
    }

    /** Creation order in the graph: wire order, then target order. */
    public int ordinal() {
        return ordinal;
    }

    public Endpoint source() {
        return source;
    }

    public Endpoint target() {
        return target;
    }

    @Override public String toString() {
        return source.vertex() + "." + source.port() + " -> " + target.vertex() + "." + target.port();
    }
}
