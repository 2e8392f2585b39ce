package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Expression;

import java.util.Optional;

/** One branch of an if activation; the condition is absent for {@code else}. */
public final class IfActivationBranch extends SwanNode {

    private final Expression condition;
    private final IfteBranch branch;

    public IfActivationBranch(SourceSpan span, Expression condition, IfteBranch branch) {
        super(span);
        if (branch == null) throw new IllegalArgumentException("branch is null");
        this.condition = adopt(condition);
        this.branch = adopt(branch);
    }

    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    public IfteBranch branch() {
        return branch;
    }

    @Override public void write(SwanWriter out) {
        if (condition != null) out.node(condition).text(" then ");
        out.node(branch);
    }
}
