package info.isaksson.erland.swanmodel.ast;

/**
 * The model is malformed: a wire endpoint outside its diagram, a duplicate LUID,
 * a state machine without exactly one initial state, a namespace clash.
 */
public class StructuralInvariantException extends SwanModelException {

    public StructuralInvariantException(String message) {
        super(message);
    }
}
