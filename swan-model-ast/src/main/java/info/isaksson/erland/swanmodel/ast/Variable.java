package info.isaksson.erland.swanmodel.ast;

/** Entry of a {@code var} section or of an operator input/output list. */
public abstract class Variable extends SwanNode {

    protected Variable(SourceSpan span) {
        super(span);
    }
}
