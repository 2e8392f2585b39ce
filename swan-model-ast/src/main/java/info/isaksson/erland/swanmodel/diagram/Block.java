package info.isaksson.erland.swanmodel.diagram;

import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.OperatorCall;
import info.isaksson.erland.swanmodel.expr.PathOperatorCall;
import info.isaksson.erland.swanmodel.expr.PrimitiveOperatorCall;

import java.util.List;
import java.util.Optional;

/** Operator block {@code (#3 block Op)}, or a protected instance {@code block {syntax%...%syntax}}. */
public final class Block extends DiagramObject {

    private final OperatorCall operator;
    private final ProtectedText protectedInstance;

    public Block(SourceSpan span, Luid luid, OperatorCall operator, List<? extends SwanNode> locals) {
        this(span, luid, operator, null, locals);
    }

    public Block(SourceSpan span, Luid luid, ProtectedText protectedInstance, List<? extends SwanNode> locals) {
        this(span, luid, null, protectedInstance, locals);
    }

    private Block(SourceSpan span, Luid luid, OperatorCall operator, ProtectedText protectedInstance,
                  List<? extends SwanNode> locals) {
        super(span, luid, locals);
        if ((operator == null) == (protectedInstance == null)) {
            throw new IllegalArgumentException("a block has either an operator or a protected instance");
        }
        this.operator = adopt(operator);
        this.protectedInstance = protectedInstance;
        adoptLocals();
    }

    @Override public DiagramObjectKind kind() {
        return DiagramObjectKind.BLOCK;
    }

    public Optional<OperatorCall> operator() {
        return Optional.ofNullable(operator);
    }

    public Optional<ProtectedText> protectedInstance() {
        return Optional.ofNullable(protectedInstance);
    }

    /** Simple name of the called operator; empty for operator expressions and protected instances. */
    public Optional<String> operatorName() {
        if (operator instanceof PathOperatorCall p && !p.path().isProtected()) {
            return Optional.of(p.path().last().value());
        }
        if (operator instanceof PrimitiveOperatorCall p) return Optional.of(p.operator().keyword());
        return Optional.empty();
    }

    @Override protected void writeContent(SwanWriter out) {
        out.text("block ");
        if (operator != null) out.node(operator);
        else out.raw(protectedInstance.rawText());
    }
}
