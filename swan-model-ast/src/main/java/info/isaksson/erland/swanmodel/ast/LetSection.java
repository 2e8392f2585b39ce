package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class LetSection extends ScopeSection {

    private final List<Equation> equations;

    public LetSection(SourceSpan span, List<Equation> equations) {
        super(span);
        this.equations = adoptAll(equations);
    }

    @Override public ScopeSectionKind kind() {
        return ScopeSectionKind.LET;
    }

    public List<Equation> equations() {
        return equations;
    }

    @Override public void write(SwanWriter out) {
        writeItems(out, "let", equations, "");
    }
}
