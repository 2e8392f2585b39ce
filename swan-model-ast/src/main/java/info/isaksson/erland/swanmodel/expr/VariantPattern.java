package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code Tag _}, {@code Tag {}} or {@code Tag {x}}. */
public final class VariantPattern extends Pattern {

    public enum Form { UNDERSCORE, EMPTY, CAPTURE }

    private final PathIdentifier tag;
    private final Form form;
    private final Identifier captured;

    public VariantPattern(SourceSpan span, PathIdentifier tag, Form form, Identifier captured) {
        super(span);
        if (tag == null) throw new IllegalArgumentException("tag is null");
        if (form == null) throw new IllegalArgumentException("form is null");
        if ((form == Form.CAPTURE) != (captured != null)) {
            throw new IllegalArgumentException("a captured name goes with the capture form only");
        }
        this.tag = tag;
        this.form = form;
        this.captured = captured;
    }

    @Override public PatternKind kind() {
        return PatternKind.VARIANT;
    }

    public PathIdentifier tag() {
        return tag;
    }

    public Form form() {
        return form;
    }

    public Optional<Identifier> captured() {
        return Optional.ofNullable(captured);
    }

    @Override public void write(SwanWriter out) {
        out.text(tag.toString());
        switch (form) {
            case UNDERSCORE -> out.text(" _");
            case EMPTY -> out.text(" {}");
            case CAPTURE -> out.text(" {").text(captured.render()).text("}");
        }
    }
}
