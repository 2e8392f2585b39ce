package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code if c then b {elsif c then b} else b}: at least two branches, only the last without condition. */
public final class IfActivation extends SwanNode {

    private final List<IfActivationBranch> branches;

    public IfActivation(SourceSpan span, List<IfActivationBranch> branches) {
        super(span);
        this.branches = adoptAll(branches);
        if (this.branches.size() < 2) throw new IllegalArgumentException("if activation needs an if and an else branch");
        for (int i = 0; i < this.branches.size(); i++) {
            boolean last = i == this.branches.size() - 1;
            if (this.branches.get(i).condition().isPresent() == last) {
                throw new IllegalArgumentException("only the last if activation branch has no condition");
            }
        }
    }

    public List<IfActivationBranch> branches() {
        return branches;
    }

    @Override public void write(SwanWriter out) {
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) out.line();
            if (i == 0) out.text("if ");
            else if (i < branches.size() - 1) out.text("elsif ");
            else out.text("else ");
            out.node(branches.get(i));
        }
    }
}
