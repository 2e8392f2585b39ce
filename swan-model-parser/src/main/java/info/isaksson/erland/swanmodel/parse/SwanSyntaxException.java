package info.isaksson.erland.swanmodel.parse;

/**
 * Text that cannot be structured. Raised inside the parser only: every occurrence ends up
 * as a protected node.
 */
public class SwanSyntaxException extends Exception {

    private final int offset;

    public SwanSyntaxException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /** Absolute offset in the unit text where the problem was found. */
    public int offset() {
        return offset;
    }
}
