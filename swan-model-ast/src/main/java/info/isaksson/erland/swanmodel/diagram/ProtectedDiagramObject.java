package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.ProtectedItem;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/**
 * Object text, parentheses included. The LUID is kept when the text starts with one,
 * so that wires still reach the object.
 */
public final class ProtectedDiagramObject extends DiagramObject implements ProtectedItem {

    private final ProtectedText text;

    public ProtectedDiagramObject(SourceSpan span, Luid luid, ProtectedText text) {
        super(span, luid, List.of());
        if (text == null) throw new IllegalArgumentException("text is null");
        this.text = text;
    }

    @Override public DiagramObjectKind kind() {
        return DiagramObjectKind.PROTECTED;
    }

    @Override public ProtectedText protectedText() {
        return text;
    }

    @Override protected void writeContent(SwanWriter out) {
        out.raw(text.rawText());
    }

    @Override public void write(SwanWriter out) {
        out.raw(text.rawText());
    }
}
