package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.DefByCase;
import info.isaksson.erland.swanmodel.ast.EquationKind;
import info.isaksson.erland.swanmodel.ast.EquationLhs;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@code [lhs :] automaton [#name]} followed by states and transition declarations.
 *
 * <p>Exactly one state is initial; the constructor rejects any other count.</p>
 */
public final class StateMachine extends DefByCase {

    private static final Comparator<TransitionDecl> BY_PRIORITY = Comparator.comparing(
            (TransitionDecl d) -> d.priority().orElse(null), Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<StateMachineItem> items;
    private final State initialState;

    public StateMachine(SourceSpan span, EquationLhs lhs, Luid name, List<StateMachineItem> items) {
        super(span, lhs, name);
        this.items = adoptAll(items);
        State initial = null;
        int count = 0;
        for (StateMachineItem item : this.items) {
            if (item instanceof State s && s.isInitial()) {
                count++;
                if (initial == null) initial = s;
            }
        }
        if (count != 1) {
            throw new StructuralInvariantException("state machine at " + span() + " has " + count
                    + " initial states, expected exactly one");
        }
        this.initialState = initial;
    }

    @Override public EquationKind kind() {
        return EquationKind.STATE_MACHINE;
    }

    public List<StateMachineItem> items() {
        return items;
    }

    public List<State> states() {
        List<State> out = new ArrayList<>();
        for (StateMachineItem item : items) {
            if (item instanceof State s) out.add(s);
        }
        return out;
    }

    public List<TransitionDecl> transitionDecls() {
        List<TransitionDecl> out = new ArrayList<>();
        for (StateMachineItem item : items) {
            if (item instanceof TransitionDecl d) out.add(d);
        }
        return out;
    }

    public State initialState() {
        return initialState;
    }

    /** State with the given name or LUID ({@code #2}). */
    public Optional<State> state(String nameOrLuid) {
        if (nameOrLuid == null) return Optional.empty();
        for (State s : states()) {
            Identification id = s.identification();
            if (nameOrLuid.startsWith("#")) {
                if (id.luid() != null && id.luid().toString().equals(nameOrLuid)) return Optional.of(s);
            } else if (id.id() != null && id.id().value().equals(nameOrLuid)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /** State a target designates. */
    public Optional<State> resolve(Target target) {
        if (target == null) return Optional.empty();
        for (State s : states()) {
            if (s.identification().designates(target.state())) return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Transitions leaving a state: those written in the state (strong ones first, then weak
     * ones) followed by the machine level declarations naming the state as source, strong
     * before weak, each ordered by priority then source order.
     */
    public List<OutgoingTransition> outgoing(State state) {
        if (state == null || state.owner() != this) {
            throw new IllegalArgumentException("state does not belong to this state machine");
        }
        List<TransitionDecl> declared = new ArrayList<>();
        for (TransitionDecl d : transitionDecls()) {
            if (state.identification().designates(d.source())) declared.add(d);
        }
        declared.sort(BY_PRIORITY);
        List<OutgoingTransition> out = new ArrayList<>();
        List<OutgoingTransition> own = state.outgoing();
        for (OutgoingTransition o : own) {
            if (o.kind() == TransitionKind.STRONG) out.add(o);
        }
        for (TransitionDecl d : declared) {
            if (d.isStrong()) out.add(new OutgoingTransition(TransitionKind.STRONG, d.transition()));
        }
        for (OutgoingTransition o : own) {
            if (o.kind() == TransitionKind.WEAK) out.add(o);
        }
        for (TransitionDecl d : declared) {
            if (!d.isStrong()) out.add(new OutgoingTransition(TransitionKind.WEAK, d.transition()));
        }
        return out;
    }

    @Override public void write(SwanWriter out) {
        writePrefix(out, "automaton");
        out.indent();
        for (StateMachineItem item : items) out.line().node(item);
        out.dedent().line().text(";");
    }
}
