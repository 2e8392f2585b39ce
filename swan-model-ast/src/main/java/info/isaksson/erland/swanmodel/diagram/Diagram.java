package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.ScopeSectionKind;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.ArrayList;
import java.util.List;

/** {@code diagram} section: objects and wires in source order. */
public final class Diagram extends ScopeSection {

    private final List<SwanNode> items;

    public Diagram(SourceSpan span, List<? extends SwanNode> items) {
        super(span);
        this.items = adoptAll(items);
        for (SwanNode n : this.items) {
            if (!(n instanceof DiagramObject) && !(n instanceof Wire)) {
                throw new IllegalArgumentException("a diagram item is an object or a wire, not "
                        + n.getClass().getSimpleName());
            }
        }
    }

    @Override public ScopeSectionKind kind() {
        return ScopeSectionKind.DIAGRAM;
    }

    public List<SwanNode> items() {
        return items;
    }

    /** Objects in source order, {@code where} locals following the object that declares them. */
    public List<DiagramObject> objects() {
        List<DiagramObject> out = new ArrayList<>();
        collect(items, out, new ArrayList<>());
        return out;
    }

    /** Wires in source order, {@code where} locals included. */
    public List<Wire> wires() {
        List<Wire> out = new ArrayList<>();
        collect(items, new ArrayList<>(), out);
        return out;
    }

    private static void collect(List<SwanNode> nodes, List<DiagramObject> objects, List<Wire> wires) {
        for (SwanNode n : nodes) {
            if (n instanceof DiagramObject o) {
                objects.add(o);
                collect(o.locals(), objects, wires);
            } else if (n instanceof Wire w) {
                wires.add(w);
            }
        }
    }

    @Override public void write(SwanWriter out) {
        writeItems(out, "diagram", items, "");
    }
}
