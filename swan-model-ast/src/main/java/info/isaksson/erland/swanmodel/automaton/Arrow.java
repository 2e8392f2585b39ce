package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.expr.Expression;

import java.util.Optional;

/** {@code [(guard)] [scope] target|fork} */
public final class Arrow extends SwanNode {

    private final Expression guard;
    private final Scope action;
    private final SwanNode target;

    public Arrow(SourceSpan span, Expression guard, Scope action, Target target) {
        this(span, guard, action, (SwanNode) target);
    }

    public Arrow(SourceSpan span, Expression guard, Scope action, Fork fork) {
        this(span, guard, action, (SwanNode) fork);
    }

    private Arrow(SourceSpan span, Expression guard, Scope action, SwanNode target) {
        super(span);
        if (target == null) throw new IllegalArgumentException("arrow has no target");
        this.guard = adopt(guard);
        this.action = adopt(action);
        this.target = adopt(target);
    }

    public Optional<Expression> guard() {
        return Optional.ofNullable(guard);
    }

    public Optional<Scope> action() {
        return Optional.ofNullable(action);
    }

    public Optional<Target> target() {
        return target instanceof Target t ? Optional.of(t) : Optional.empty();
    }

    public Optional<Fork> fork() {
        return target instanceof Fork f ? Optional.of(f) : Optional.empty();
    }

    @Override public void write(SwanWriter out) {
        if (guard != null) out.text("(").node(guard).text(") ");
        if (action != null) out.node(action).text(" ");
        out.node(target);
    }
}
