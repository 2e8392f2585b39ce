package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

/** Module-level text that was protected by markup or could not be structured. */
public final class ProtectedDecl extends GlobalDeclaration implements ProtectedItem {

    public static final String PATH_SEGMENT = "<protected>";

    private final ProtectedText text;

    public ProtectedDecl(SourceSpan span, ProtectedText text) {
        super(span);
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    /** Markup of the kind of declaration this stands for, when the author wrote one. */
    public Optional<GlobalDeclarationKind> declaredKind() {
        return switch (text.markup()) {
            case TYPE -> Optional.of(GlobalDeclarationKind.TYPES);
            case CONST -> Optional.of(GlobalDeclarationKind.CONSTANTS);
            case SENSOR -> Optional.of(GlobalDeclarationKind.SENSORS);
            case GROUP -> Optional.of(GlobalDeclarationKind.GROUPS);
            case USE -> Optional.of(GlobalDeclarationKind.USE);
            case SIGNATURE -> Optional.of(GlobalDeclarationKind.SIGNATURE);
            case TEXT, SYNTAX_TEXT -> Optional.of(GlobalDeclarationKind.OPERATOR);
            default -> Optional.empty();
        };
    }

    @Override public String fullPath() {
        return module()
                .map(m -> m.name() + PathIdentifier.SEPARATOR + PATH_SEGMENT)
                .orElseThrow(() -> new UsagePreconditionException("protected declaration has no enclosing module"));
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
