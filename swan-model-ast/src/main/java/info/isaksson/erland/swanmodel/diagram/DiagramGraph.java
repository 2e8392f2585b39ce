package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.expr.GroupAdaptation;
import info.isaksson.erland.swanmodel.expr.GroupRenaming;
import info.isaksson.erland.swanmodel.expr.PortExpr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DirectedPseudograph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Connectivity of one diagram.
 *
 * <p>Objects are registered in an arena keyed by LUID, and wires become edges between
 * arena entries, so feedback loops are plain cycles of the underlying
 * {@link DirectedPseudograph}. Queries are one hop; multi hop walks live in
 * {@link DiagramTraversal} and take an explicit visited set.</p>
 *
 * <p>A wire end with a group adaptation yields one endpoint per renaming. When a wire has
 * as many source endpoints as target endpoints they are paired by position, otherwise every
 * source endpoint is connected to every target endpoint.</p>
 *
 * <p>{@link #sources} and {@link #targets} report the direct wire ends, a {@link Bar} included,
 * with its renamings applied. {@link #resolvedSources} and {@link #resolvedTargets} are the
 * one hop queries seen through bars: a bar port is replaced by the ends it regroups, matched by
 * the renamed value name, so a caller never stops on a bar.</p>
 */
public final class DiagramGraph {

    private static final Logger logger = LogManager.getLogger();

    /** Arena entry: the vertex a LUID designates, and the port LUID when it names a port. */
    private record Binding(DiagramVertex vertex, String port, Wire wire) {}

    /** A bar port already looked through. */
    private record Visit(DiagramVertex bar, String name) {}

    private final Diagram diagram;
    private final DiagramBoundary boundary;
    private final List<DiagramObject> objects;
    private final Map<String, Binding> arena = new LinkedHashMap<>();
    private final DirectedPseudograph<DiagramVertex, WireEdge> graph = new DirectedPseudograph<>(WireEdge.class);
    private final List<WireEdge> edges = new ArrayList<>();

    private DiagramGraph(Diagram diagram) {
        this.diagram = diagram;
        this.boundary = new DiagramBoundary(diagram);
        this.objects = List.copyOf(diagram.objects());
        graph.addVertex(boundary);
        for (DiagramObject o : objects) {
            graph.addVertex(o);
            o.luid().ifPresent(l -> register(l, new Binding(o, null, null), o));
            registerPorts(o, o);
        }
        List<Wire> wires = diagram.wires();
        for (Wire w : wires) {
            w.luid().ifPresent(l -> register(l, new Binding(null, null, w), w));
        }
        for (Wire w : wires) connect(w);
        logger.debug("Diagram graph: {} objects, {} wires, {} edges", objects.size(), wires.size(), edges.size());
    }

    /**
     * Builds the graph of a diagram.
     *
     * @throws StructuralInvariantException when a LUID is declared twice or a wire end names
     *                                      a LUID the diagram does not declare
     */
    public static DiagramGraph of(Diagram diagram) {
        if (diagram == null) throw new IllegalArgumentException("diagram is null");
        return new DiagramGraph(diagram);
    }

    private void register(Luid luid, Binding binding, SwanNode declaring) {
        Binding previous = arena.putIfAbsent(luid.value(), binding);
        if (previous != null) {
            throw new StructuralInvariantException("LUID " + luid + " is declared twice in the diagram at "
                    + diagram.span() + " (again at " + declaring.span() + ")");
        }
    }

    /** Port LUIDs used inside an object; nested objects and diagrams declare their own. */
    private void registerPorts(DiagramObject owner, SwanNode node) {
        for (SwanNode child : node.children()) {
            if (child instanceof DiagramObject || child instanceof Diagram || child instanceof Wire) continue;
            if (child instanceof PortExpr p && p.luid().isPresent()) {
                register(p.luid().get(), new Binding(owner, p.luid().get().value(), null), p);
            }
            registerPorts(owner, child);
        }
    }

    private void connect(Wire wire) {
        List<Endpoint> sources = endpoints(wire.source());
        if (sources.isEmpty()) return;
        for (Connection target : wire.targets()) {
            List<Endpoint> targets = endpoints(target);
            if (targets.isEmpty()) continue;
            if (sources.size() == targets.size()) {
                for (int i = 0; i < sources.size(); i++) addEdge(wire, sources.get(i), targets.get(i));
            } else {
                for (Endpoint s : sources) {
                    for (Endpoint t : targets) addEdge(wire, s, t);
                }
            }
        }
    }

    private void addEdge(Wire wire, Endpoint source, Endpoint target) {
        WireEdge e = new WireEdge(wire, edges.size(), source, target);
        graph.addEdge(source.vertex(), target.vertex(), e);
        edges.add(e);
    }

    private List<Endpoint> endpoints(Connection c) {
        if (!c.isConnected()) return List.of();
        PortExpr port = c.port().get();
        DiagramVertex vertex;
        String portLuid = null;
        if (port.isSelf()) {
            vertex = boundary;
        } else {
            Luid luid = port.luid().get();
            Binding b = arena.get(luid.value());
            if (b == null) {
                throw new StructuralInvariantException("wire at " + c.span() + " refers to " + luid
                        + ", which the diagram does not declare");
            }
            if (b.vertex() == null) {
                throw new StructuralInvariantException("wire at " + c.span() + " refers to " + luid
                        + ", which is a wire");
            }
            vertex = b.vertex();
            portLuid = b.port();
        }
        Optional<GroupAdaptation> adaptation = c.adaptation();
        if (adaptation.isEmpty()) return List.of(new Endpoint(vertex, portLuid, portLuid));
        List<Endpoint> out = new ArrayList<>();
        for (GroupRenaming r : adaptation.get().renamings()) {
            out.add(new Endpoint(vertex, r.source(), r.resultName()));
        }
        return out;
    }

    public Diagram diagram() {
        return diagram;
    }

    public DiagramBoundary boundary() {
        return boundary;
    }

    /** Objects in source order, {@code where} locals included. */
    public List<DiagramObject> objects() {
        return objects;
    }

    /** All edges in creation order. */
    public List<WireEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /** Read-only view of the underlying graph. */
    public Graph<DiagramVertex, WireEdge> graph() {
        return new AsUnmodifiableGraph<>(graph);
    }

    /** Object declared with the given LUID ({@code #} optional). */
    public Optional<DiagramObject> object(String luid) {
        Binding b = arena.get(new Luid(luid).value());
        if (b == null || b.port() != null || !(b.vertex() instanceof DiagramObject o)) return Optional.empty();
        return Optional.of(o);
    }

    /**
     * Endpoints wired to the inputs of a vertex: the producing ends, in wire order. Group
     * adaptations are applied, so an end reading a bar reports the bar port it renames.
     */
    public List<Endpoint> sources(DiagramVertex vertex) {
        List<Endpoint> out = new ArrayList<>();
        for (WireEdge e : incoming(vertex)) out.add(e.source());
        return out;
    }

    /** Endpoints wired to the outputs of a vertex: the consuming ends, in wire order. */
    public List<Endpoint> targets(DiagramVertex vertex) {
        List<Endpoint> out = new ArrayList<>();
        for (WireEdge e : outgoing(vertex)) out.add(e.target());
        return out;
    }

    /** Edges entering a vertex, in wire order. */
    public List<WireEdge> incoming(DiagramVertex vertex) {
        requireVertex(vertex);
        return inWireOrder(graph.incomingEdgesOf(vertex));
    }

    /** Edges leaving a vertex, in wire order. */
    public List<WireEdge> outgoing(DiagramVertex vertex) {
        requireVertex(vertex);
        return inWireOrder(graph.outgoingEdgesOf(vertex));
    }

    private static List<WireEdge> inWireOrder(Set<WireEdge> edges) {
        List<WireEdge> out = new ArrayList<>(edges);
        out.sort(Comparator.comparingInt(WireEdge::ordinal));
        return out;
    }

    /**
     * Like {@link #sources}, but a bar is looked through: the endpoint reading a bar port is
     * replaced by the ends feeding that port of the bar.
     */
    public List<Endpoint> resolvedSources(DiagramVertex vertex) {
        Set<Endpoint> out = new LinkedHashSet<>();
        Set<Visit> visited = new HashSet<>();
        for (Endpoint s : sources(vertex)) resolveUpstream(s, out, visited);
        return new ArrayList<>(out);
    }

    /**
     * Like {@link #targets}, but a bar is looked through: the endpoint entering a bar is
     * replaced by the ends the bar forwards that value to.
     */
    public List<Endpoint> resolvedTargets(DiagramVertex vertex) {
        Set<Endpoint> out = new LinkedHashSet<>();
        Set<Visit> visited = new HashSet<>();
        for (WireEdge e : outgoing(vertex)) resolveDownstream(e.target(), carriedName(e), out, visited);
        return new ArrayList<>(out);
    }

    private void resolveUpstream(Endpoint source, Set<Endpoint> out, Set<Visit> visited) {
        if (!(source.vertex() instanceof Bar bar)) {
            out.add(source);
            return;
        }
        if (!visited.add(new Visit(bar, source.port()))) return;
        for (WireEdge in : incoming(bar)) {
            if (source.port() == null || source.port().equals(carriedName(in))) {
                resolveUpstream(in.source(), out, visited);
            }
        }
    }

    private void resolveDownstream(Endpoint target, String name, Set<Endpoint> out, Set<Visit> visited) {
        if (!(target.vertex() instanceof Bar bar)) {
            out.add(target);
            return;
        }
        if (!visited.add(new Visit(bar, name))) return;
        for (WireEdge next : outgoing(bar)) {
            String port = next.source().port();
            if (port == null || port.equals(name)) {
                resolveDownstream(next.target(), name == null ? carriedName(next) : name, out, visited);
            }
        }
    }

    /** Name of the value on an edge: the target label when adapted, else the source label. */
    private static String carriedName(WireEdge e) {
        return e.target().label() != null ? e.target().label() : e.source().label();
    }

    /** True when some wires form a cycle; cycles are reported, never broken. */
    public boolean hasFeedback() {
        return new CycleDetector<>(graph).detectCycles();
    }

    /** Vertices taking part in a cycle. */
    public Set<DiagramVertex> feedbackVertices() {
        return Collections.unmodifiableSet(new CycleDetector<>(graph).findCycles());
    }

    private void requireVertex(DiagramVertex vertex) {
        if (vertex == null) throw new IllegalArgumentException("vertex is null");
        if (!graph.containsVertex(vertex)) {
            throw new IllegalArgumentException(vertex + " is not part of this diagram");
        }
    }
}
