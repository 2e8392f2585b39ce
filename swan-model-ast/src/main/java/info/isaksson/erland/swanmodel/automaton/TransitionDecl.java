package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/**
 * Transition declared at machine level: {@code :p: [source] unless|until transition}.
 * The identification names the source state.
 */
public final class TransitionDecl extends StateMachineItem {

    private final Integer priority;
    private final Identification source;
    private final TransitionKind kind;
    private final Transition transition;

    public TransitionDecl(SourceSpan span, Integer priority, Identification source, TransitionKind kind,
                          Transition transition) {
        super(span);
        if (kind == null) throw new IllegalArgumentException("kind is null");
        if (transition == null) throw new IllegalArgumentException("transition is null");
        this.priority = priority;
        this.source = source == null ? Identification.UNDEFINED : source;
        this.kind = kind;
        this.transition = adopt(transition);
    }

    @Override public StateMachineItemKind kind() {
        return StateMachineItemKind.TRANSITION_DECL;
    }

    public Optional<Integer> priority() {
        return Optional.ofNullable(priority);
    }

    public Identification source() {
        return source;
    }

    public TransitionKind transitionKind() {
        return kind;
    }

    public boolean isStrong() {
        return kind == TransitionKind.STRONG;
    }

    public Transition transition() {
        return transition;
    }

    @Override public void write(SwanWriter out) {
        out.text(":").text(priority == null ? "" : priority.toString()).text(":");
        if (!source.isUndefined()) out.text(" ").text(source.render());
        out.text(" ").text(kind.keyword()).text(" ").node(transition);
    }
}
