package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Object of a diagram: {@code ([#luid] content [where locals])}. The locals are objects and
 * wires scoped to this object.
 */
public abstract class DiagramObject extends SwanNode implements DiagramVertex {

    private final Luid luid;
    private final List<SwanNode> locals;

    protected DiagramObject(SourceSpan span, Luid luid, List<? extends SwanNode> locals) {
        super(span);
        this.luid = luid;
        this.locals = locals == null ? List.of() : List.copyOf(locals);
        for (SwanNode n : this.locals) {
            if (!(n instanceof DiagramObject) && !(n instanceof Wire)) {
                throw new IllegalArgumentException("a where local is an object or a wire, not "
                        + n.getClass().getSimpleName());
            }
        }
    }

    public abstract DiagramObjectKind kind();

    @Override public Optional<Luid> luid() {
        return Optional.ofNullable(luid);
    }

    /** Objects and wires of the {@code where} clause, in source order. */
    public List<SwanNode> locals() {
        return locals;
    }

    public List<DiagramObject> localObjects() {
        List<DiagramObject> out = new ArrayList<>();
        for (SwanNode n : locals) {
            if (n instanceof DiagramObject o) out.add(o);
        }
        return out;
    }

    public List<Wire> localWires() {
        List<Wire> out = new ArrayList<>();
        for (SwanNode n : locals) {
            if (n instanceof Wire w) out.add(w);
        }
        return out;
    }

    /** Called by subclasses once the content is adopted, so children stay in source order. */
    protected final void adoptLocals() {
        adoptAll(locals);
    }

    protected abstract void writeContent(SwanWriter out);

    @Override public void write(SwanWriter out) {
        out.text("(");
        if (luid != null) out.text(luid.toString()).text(" ");
        writeContent(out);
        if (!locals.isEmpty()) out.text(" where ").join(locals, " ");
        out.text(")");
    }
}
