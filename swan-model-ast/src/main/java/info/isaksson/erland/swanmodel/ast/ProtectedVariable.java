package info.isaksson.erland.swanmodel.ast;

/** {@code {var%...%var}} in a variable list. */
public final class ProtectedVariable extends Variable implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedVariable(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
