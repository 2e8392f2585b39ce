package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Pattern;

import java.util.Optional;

/** {@code | pattern : data_def} */
public final class ActivateWhenBranch extends SwanNode {

    private final Pattern pattern;
    private final SwanNode dataDef;

    public ActivateWhenBranch(SourceSpan span, Pattern pattern, Equation equation) {
        this(span, pattern, (SwanNode) equation);
    }

    public ActivateWhenBranch(SourceSpan span, Pattern pattern, Scope scope) {
        this(span, pattern, (SwanNode) scope);
    }

    private ActivateWhenBranch(SourceSpan span, Pattern pattern, SwanNode dataDef) {
        super(span);
        if (pattern == null) throw new IllegalArgumentException("pattern is null");
        if (dataDef == null) throw new IllegalArgumentException("data definition is null");
        this.pattern = adopt(pattern);
        this.dataDef = adopt(dataDef);
    }

    public Pattern pattern() {
        return pattern;
    }

    public SwanNode dataDef() {
        return dataDef;
    }

    public Optional<Equation> equation() {
        return dataDef instanceof Equation e ? Optional.of(e) : Optional.empty();
    }

    public Optional<Scope> scope() {
        return dataDef instanceof Scope s ? Optional.of(s) : Optional.empty();
    }

    @Override public void write(SwanWriter out) {
        out.text("| ").node(pattern).text(" : ").node(dataDef);
    }
}
