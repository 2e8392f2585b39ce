package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.EquationLhs;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code (#2 def x, y)} */
public final class DefBlock extends DiagramObject {

    private final EquationLhs lhs;

    public DefBlock(SourceSpan span, Luid luid, EquationLhs lhs, List<? extends SwanNode> locals) {
        super(span, luid, locals);
        if (lhs == null) throw new IllegalArgumentException("lhs is null");
        this.lhs = adopt(lhs);
        adoptLocals();
    }

    @Override public DiagramObjectKind kind() {
        return DiagramObjectKind.DEF_BLOCK;
    }

    public EquationLhs lhs() {
        return lhs;
    }

    @Override protected void writeContent(SwanWriter out) {
        out.text("def ").node(lhs);
    }
}
