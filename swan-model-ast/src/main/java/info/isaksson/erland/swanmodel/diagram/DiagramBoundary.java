package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;

import java.util.Optional;

/** The enclosing operator seen from inside its diagram, written {@code self}. */
public final class DiagramBoundary implements DiagramVertex {

    private final Diagram diagram;

    DiagramBoundary(Diagram diagram) {
        this.diagram = diagram;
    }

    public Diagram diagram() {
        return diagram;
    }

    @Override public Optional<Luid> luid() {
        return Optional.empty();
    }

    @Override public boolean isBoundary() {
        return true;
    }

    @Override public String toString() {
        return "self";
    }
}
