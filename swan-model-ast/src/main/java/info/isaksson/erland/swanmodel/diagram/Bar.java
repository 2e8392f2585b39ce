package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/**
 * Group bar {@code (#4 group [byname|bypos|()])}: gathers incoming wires into one bundle
 * and splits it again for outgoing wires.
 */
public final class Bar extends DiagramObject {

    private final GroupOperation operation;

    public Bar(SourceSpan span, Luid luid, GroupOperation operation, List<? extends SwanNode> locals) {
        super(span, luid, locals);
        this.operation = operation == null ? GroupOperation.NONE : operation;
        adoptLocals();
    }

    @Override public DiagramObjectKind kind() {
        return DiagramObjectKind.BAR;
    }

    public GroupOperation operation() {
        return operation;
    }

    @Override protected void writeContent(SwanWriter out) {
        out.text("group");
        if (operation != GroupOperation.NONE) out.text(" ").text(operation.keyword());
    }
}
