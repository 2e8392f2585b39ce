package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;

import java.util.Optional;

/** Vertex of a {@link DiagramGraph}: a diagram object, or the diagram boundary ({@code self}). */
public interface DiagramVertex {

    Optional<Luid> luid();

    default boolean isBoundary() {
        return false;
    }
}
