package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code .(renamings)} */
public final class GroupAdaptation extends SwanNode {

    private final List<GroupRenaming> renamings;

    public GroupAdaptation(SourceSpan span, List<GroupRenaming> renamings) {
        super(span);
        this.renamings = adoptAll(renamings);
    }

    public List<GroupRenaming> renamings() {
        return renamings;
    }

    @Override public void write(SwanWriter out) {
        out.text(".(").join(renamings, ", ").text(")");
    }
}
