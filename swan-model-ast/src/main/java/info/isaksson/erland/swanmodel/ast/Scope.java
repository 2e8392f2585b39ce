package info.isaksson.erland.swanmodel.ast;

import java.util.ArrayList;
import java.util.List;

/** {@code { sections }} */
public final class Scope extends SwanNode {

    private final List<ScopeSection> sections;

    public Scope(SourceSpan span, List<ScopeSection> sections) {
        super(span);
        this.sections = adoptAll(sections);
    }

    public List<ScopeSection> sections() {
        return sections;
    }

    public <T extends ScopeSection> List<T> sectionsOf(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (ScopeSection s : sections) {
            if (type.isInstance(s)) out.add(type.cast(s));
        }
        return out;
    }

    @Override public void write(SwanWriter out) {
        out.text("{").indent();
        for (ScopeSection s : sections) out.line().node(s);
        out.dedent().line().text("}");
    }
}
