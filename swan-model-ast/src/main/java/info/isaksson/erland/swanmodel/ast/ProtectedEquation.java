package info.isaksson.erland.swanmodel.ast;

/** Equation text, terminating semicolon included when the source had one. */
public final class ProtectedEquation extends Equation implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedEquation(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public EquationKind kind() {
        return EquationKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
