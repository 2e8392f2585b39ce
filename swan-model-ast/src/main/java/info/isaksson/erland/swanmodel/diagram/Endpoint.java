package info.isaksson.erland.swanmodel.diagram;

/**
 * One end of a resolved wire.
 *
 * @param vertex object or boundary at this end
 * @param port   port selected on the vertex: a renaming selector or a port LUID, null when the
 *               whole output (or input) is connected
 * @param label  name the value carries on the wire after adaptation, null when unnamed
 */
public record Endpoint(DiagramVertex vertex, String port, String label) {

    public Endpoint {
        if (vertex == null) throw new IllegalArgumentException("vertex is null");
    }
}
