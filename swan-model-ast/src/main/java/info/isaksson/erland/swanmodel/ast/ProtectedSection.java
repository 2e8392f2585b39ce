package info.isaksson.erland.swanmodel.ast;

public final class ProtectedSection extends ScopeSection implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedSection(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public ScopeSectionKind kind() {
        return ScopeSectionKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
