package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.DefByCase;
import info.isaksson.erland.swanmodel.ast.EquationKind;
import info.isaksson.erland.swanmodel.ast.EquationLhs;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Expression;

import java.util.List;

/** {@code [lhs :] activate [#name] when e match | p : def ...;} */
public final class ActivateWhen extends DefByCase {

    private final Expression condition;
    private final List<ActivateWhenBranch> branches;

    public ActivateWhen(SourceSpan span, EquationLhs lhs, Luid name, Expression condition,
                        List<ActivateWhenBranch> branches) {
        super(span, lhs, name);
        if (condition == null) throw new IllegalArgumentException("condition is null");
        this.condition = adopt(condition);
        this.branches = adoptAll(branches);
        if (this.branches.isEmpty()) throw new IllegalArgumentException("activate when has no branch");
    }

    @Override public EquationKind kind() {
        return EquationKind.ACTIVATE_WHEN;
    }

    public Expression condition() {
        return condition;
    }

    public List<ActivateWhenBranch> branches() {
        return branches;
    }

    @Override public void write(SwanWriter out) {
        writePrefix(out, "activate");
        out.text(" when ").node(condition).text(" match").indent();
        for (ActivateWhenBranch b : branches) out.line().node(b);
        out.dedent().line().text(";");
    }
}
