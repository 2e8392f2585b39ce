package info.isaksson.erland.swanmodel.ast;

import java.util.List;

/** Section of a scope, an operator body or a state body. */
public abstract class ScopeSection extends SwanNode {

    protected ScopeSection(SourceSpan span) {
        super(span);
    }

    public abstract ScopeSectionKind kind();

    /** Keyword line followed by one indented line per item. */
    protected final void writeItems(SwanWriter out, String keyword, List<? extends SwanNode> items, String terminator) {
        out.text(keyword).indent();
        for (SwanNode item : items) {
            out.line().node(item).text(terminator);
        }
        out.dedent();
    }
}
