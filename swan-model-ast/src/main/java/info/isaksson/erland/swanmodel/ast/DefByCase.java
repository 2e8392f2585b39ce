package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

/** State machines and activations: {@code [lhs :] automaton|activate [#name] ...}. */
public abstract class DefByCase extends Equation {

    private final EquationLhs lhs;
    private final Luid name;

    protected DefByCase(SourceSpan span, EquationLhs lhs, Luid name) {
        super(span);
        this.lhs = adopt(lhs);
        this.name = name;
    }

    public Optional<EquationLhs> lhs() {
        return Optional.ofNullable(lhs);
    }

    public Optional<Luid> name() {
        return Optional.ofNullable(name);
    }

    /** Writes {@code lhs : keyword #name}. */
    protected final void writePrefix(SwanWriter out, String keyword) {
        if (lhs != null) out.node(lhs).text(" : ");
        out.text(keyword);
        if (name != null) out.text(" ").text(name.toString());
    }
}
