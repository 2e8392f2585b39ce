package info.isaksson.erland.swanmodel.ast;

/** Base class of the unchecked errors surfaced by the Swan model. */
public class SwanModelException extends RuntimeException {

    public SwanModelException(String message) {
        super(message);
    }

    public SwanModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
