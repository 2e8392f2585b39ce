package info.isaksson.erland.swanmodel.ast;

/** An operation was called on a node that cannot support it. */
public class UsagePreconditionException extends SwanModelException {

    public UsagePreconditionException(String message) {
        super(message);
    }
}
