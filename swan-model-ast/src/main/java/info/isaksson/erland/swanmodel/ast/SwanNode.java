package info.isaksson.erland.swanmodel.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Base of every node of the Swan object model.
 *
 * <p>A node is immutable once its parent is built: the parent adopts its children in source
 * order from its constructor, which sets their owner exactly once. Equality is identity.</p>
 */
public abstract class SwanNode {

    private final SourceSpan span;
    private final List<SwanNode> children = new ArrayList<>();
    private SwanNode owner;

    protected SwanNode(SourceSpan span) {
        this.span = span == null ? SourceSpan.NONE : span;
    }

    public final SourceSpan span() {
        return span;
    }

    /** Parent node, null for a module or a detached node. */
    public final SwanNode owner() {
        return owner;
    }

    /** Direct children in source order. */
    public final List<SwanNode> children() {
        return Collections.unmodifiableList(children);
    }

    protected final <T extends SwanNode> T adopt(T child) {
        if (child == null) return null;
        SwanNode node = child;
        if (node.owner != null) {
            throw new UsagePreconditionException(
                    node.getClass().getSimpleName() + " at " + node.span() + " already belongs to "
                            + node.owner.getClass().getSimpleName());
        }
        if (node == this) throw new UsagePreconditionException("a node cannot own itself");
        node.owner = this;
        children.add(node);
        return child;
    }

    protected final <T extends SwanNode> List<T> adoptAll(List<? extends T> nodes) {
        if (nodes == null) return List.of();
        List<T> copy = List.copyOf(nodes);
        for (T n : copy) adopt(n);
        return copy;
    }

    /** Writes the canonical text of this node. */
    public abstract void write(SwanWriter out);

    public final String render() {
        SwanWriter out = new SwanWriter();
        write(out);
        return out.toString();
    }

    public boolean isProtected() {
        return this instanceof ProtectedItem;
    }

    /** Nearest ancestor (or this node) of the given type. */
    public final <T> Optional<T> ancestor(Class<T> type) {
        for (SwanNode n = this; n != null; n = n.owner) {
            if (type.isInstance(n)) return Optional.of(type.cast(n));
        }
        return Optional.empty();
    }

    public final Optional<Module> module() {
        return ancestor(Module.class);
    }

    /** Exact source slice covered by this node, when the node was parsed from a source. */
    public Optional<String> sourceText() {
        if (!span.isKnown()) return Optional.empty();
        return module().flatMap(Module::text).map(t -> t.substring(span.start(), Math.min(span.end(), t.length())));
    }

    /**
     * Path of this node: the module name followed by the identifiers of the named
     * declarations enclosing it, joined with {@code ::}.
     *
     * @throws UsagePreconditionException when the node has no enclosing module
     */
    public String fullPath() {
        Deque<String> parts = new ArrayDeque<>();
        for (SwanNode n = this; n != null; n = n.owner) {
            if (n instanceof Module m) {
                StringBuilder sb = new StringBuilder(m.name().toString());
                for (String p : parts) sb.append("::").append(p);
                return sb.toString();
            }
            if (n instanceof Declaration d && d.identifier() != null && !isSignatureOfOperator(n)) {
                parts.addFirst(d.identifier().value());
            }
        }
        throw new UsagePreconditionException(
                getClass().getSimpleName() + " at " + span + " has no enclosing module");
    }

    private static boolean isSignatureOfOperator(SwanNode n) {
        return n instanceof Signature && n.owner instanceof Operator;
    }

    @Override public String toString() {
        return getClass().getSimpleName() + "[" + span + "]";
    }
}
