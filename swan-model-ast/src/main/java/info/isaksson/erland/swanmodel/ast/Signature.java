package info.isaksson.erland.swanmodel.ast;

import java.util.List;
import java.util.Optional;

/**
 * Operator interface: {@code [inline] node|function Name [<<sizes>>] (inputs) returns (outputs)
 * [where ...] [specialize P]}. On its own it is a declaration ending with {@code ;}.
 */
public final class Signature extends GlobalDeclaration implements Declaration {

    private final Identifier identifier;
    private final boolean node;
    private final boolean inline;
    private final List<Identifier> sizes;
    private final List<Variable> inputs;
    private final List<Variable> outputs;
    private final List<TypeConstraint> constraints;
    private final PathIdentifier specialization;

    public Signature(SourceSpan span, Identifier identifier, boolean node, boolean inline,
                     List<Identifier> sizes, List<Variable> inputs, List<Variable> outputs,
                     List<TypeConstraint> constraints, PathIdentifier specialization) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        this.identifier = identifier;
        this.node = node;
        this.inline = inline;
        this.sizes = sizes == null ? List.of() : List.copyOf(sizes);
        this.inputs = adoptAll(inputs);
        this.outputs = adoptAll(outputs);
        this.constraints = adoptAll(constraints);
        this.specialization = specialization;
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.SIGNATURE;
    }

    @Override public Identifier identifier() {
        return identifier;
    }

    /** True for {@code node}, false for {@code function}. */
    public boolean isNode() {
        return node;
    }

    public boolean isInline() {
        return inline;
    }

    public List<Identifier> sizes() {
        return sizes;
    }

    public List<Variable> inputs() {
        return inputs;
    }

    public List<Variable> outputs() {
        return outputs;
    }

    public List<TypeConstraint> constraints() {
        return constraints;
    }

    public Optional<PathIdentifier> specialization() {
        return Optional.ofNullable(specialization);
    }

    public List<Pragma> pragmas() {
        return identifier.pragmas();
    }

    /** Header without the terminating semicolon. */
    public void writeHeader(SwanWriter out) {
        if (inline) out.text("inline ");
        out.text(node ? "node " : "function ").text(identifier.render());
        if (!sizes.isEmpty()) {
            out.text(" <<");
            for (int i = 0; i < sizes.size(); i++) {
                if (i > 0) out.text(", ");
                out.text(sizes.get(i).render());
            }
            out.text(">>");
        }
        out.text(" ");
        writeVariables(out, inputs);
        out.text(" returns ");
        writeVariables(out, outputs);
        for (TypeConstraint c : constraints) out.text(" ").node(c);
        if (specialization != null) out.text(" specialize ").text(specialization.toString());
    }

    private static void writeVariables(SwanWriter out, List<Variable> vars) {
        out.text("(");
        for (int i = 0; i < vars.size(); i++) {
            if (i > 0) out.text(" ");
            out.node(vars.get(i)).text(";");
        }
        out.text(")");
    }

    @Override public void write(SwanWriter out) {
        writeHeader(out);
        out.text(";");
    }
}
