package info.isaksson.erland.swanmodel.ast;

/** Equation of a {@code let} section or an operator body. */
public abstract class Equation extends SwanNode {

    protected Equation(SourceSpan span) {
        super(span);
    }

    public abstract EquationKind kind();
}
