package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

public final class IfteDataDef extends IfteBranch {

    private final SwanNode dataDef;

    public IfteDataDef(SourceSpan span, Equation equation) {
        this(span, (SwanNode) equation);
    }

    public IfteDataDef(SourceSpan span, Scope scope) {
        this(span, (SwanNode) scope);
    }

    private IfteDataDef(SourceSpan span, SwanNode dataDef) {
        super(span);
        if (dataDef == null) throw new IllegalArgumentException("data definition is null");
        this.dataDef = adopt(dataDef);
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
        out.node(dataDef);
    }
}
