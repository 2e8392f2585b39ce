package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

/** A defined name, or {@code _} for an ignored output. */
public final class LhsItem extends SwanNode {

    private final Identifier identifier;

    public LhsItem(SourceSpan span, Identifier identifier) {
        super(span);
        this.identifier = identifier;
    }

    public static LhsItem underscore(SourceSpan span) {
        return new LhsItem(span, null);
    }

    public Optional<Identifier> identifier() {
        return Optional.ofNullable(identifier);
    }

    public boolean isUnderscore() {
        return identifier == null;
    }

    @Override public void write(SwanWriter out) {
        out.text(identifier == null ? "_" : identifier.render());
    }
}
