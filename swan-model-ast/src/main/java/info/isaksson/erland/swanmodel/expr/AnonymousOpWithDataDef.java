package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.ast.Variable;

import java.util.List;
import java.util.Optional;

/** {@code function|node (inputs) returns (outputs) data_def} */
public final class AnonymousOpWithDataDef extends OperatorExpression {

    private final boolean node;
    private final List<Variable> inputs;
    private final List<Variable> outputs;
    private final SwanNode body;

    public AnonymousOpWithDataDef(SourceSpan span, boolean node, List<Variable> inputs,
                                  List<Variable> outputs, Scope body) {
        this(span, node, inputs, outputs, (SwanNode) body);
    }

    public AnonymousOpWithDataDef(SourceSpan span, boolean node, List<Variable> inputs,
                                  List<Variable> outputs, Equation body) {
        this(span, node, inputs, outputs, (SwanNode) body);
    }

    private AnonymousOpWithDataDef(SourceSpan span, boolean node, List<Variable> inputs,
                                   List<Variable> outputs, SwanNode body) {
        super(span);
        if (body == null) throw new IllegalArgumentException("body is null");
        this.node = node;
        this.inputs = adoptAll(inputs);
        this.outputs = adoptAll(outputs);
        this.body = adopt(body);
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.ANONYMOUS_WITH_DATA_DEFINITION;
    }

    public boolean isNode() {
        return node;
    }

    public List<Variable> inputs() {
        return inputs;
    }

    public List<Variable> outputs() {
        return outputs;
    }

    public Optional<Scope> scopeBody() {
        return body instanceof Scope s ? Optional.of(s) : Optional.empty();
    }

    public Optional<Equation> equationBody() {
        return body instanceof Equation e ? Optional.of(e) : Optional.empty();
    }

    @Override public void write(SwanWriter out) {
        out.text(node ? "node " : "function ");
        writeVariables(out, inputs);
        out.text(" returns ");
        writeVariables(out, outputs);
        if (body instanceof Scope) out.line().node(body);
        else out.text(" ").node(body);
    }

    private static void writeVariables(SwanWriter out, List<Variable> vars) {
        out.text("(");
        for (int i = 0; i < vars.size(); i++) {
            if (i > 0) out.text(" ");
            out.node(vars.get(i)).text(";");
        }
        out.text(")");
    }
}
