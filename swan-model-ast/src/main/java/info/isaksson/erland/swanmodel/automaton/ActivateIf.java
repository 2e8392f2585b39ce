package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.DefByCase;
import info.isaksson.erland.swanmodel.ast.EquationKind;
import info.isaksson.erland.swanmodel.ast.EquationLhs;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code [lhs :] activate [#name] if c then ... else ...;} */
public final class ActivateIf extends DefByCase {

    private final IfActivation activation;

    public ActivateIf(SourceSpan span, EquationLhs lhs, Luid name, IfActivation activation) {
        super(span, lhs, name);
        if (activation == null) throw new IllegalArgumentException("activation is null");
        this.activation = adopt(activation);
    }

    @Override public EquationKind kind() {
        return EquationKind.ACTIVATE_IF;
    }

    public IfActivation activation() {
        return activation;
    }

    @Override public void write(SwanWriter out) {
        writePrefix(out, "activate");
        out.indent().line().node(activation).dedent().line().text(";");
    }
}
