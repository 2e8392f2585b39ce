package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class VarSection extends ScopeSection {

    private final List<Variable> variables;

    public VarSection(SourceSpan span, List<Variable> variables) {
        super(span);
        this.variables = adoptAll(variables);
    }

    @Override public ScopeSectionKind kind() {
        return ScopeSectionKind.VAR;
    }

    public List<Variable> variables() {
        return variables;
    }

    @Override public void write(SwanWriter out) {
        writeItems(out, "var", variables, ";");
    }
}
