package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** Textual section inside a diagram: {@code (#5 let x = 1;)}. */
public final class SectionBlock extends DiagramObject {

    private final ScopeSection section;

    public SectionBlock(SourceSpan span, Luid luid, ScopeSection section, List<? extends SwanNode> locals) {
        super(span, luid, locals);
        if (section == null) throw new IllegalArgumentException("section is null");
        this.section = adopt(section);
        adoptLocals();
    }

    @Override public DiagramObjectKind kind() {
        return DiagramObjectKind.SECTION_BLOCK;
    }

    public ScopeSection section() {
        return section;
    }

    @Override protected void writeContent(SwanWriter out) {
        out.node(section);
    }
}
