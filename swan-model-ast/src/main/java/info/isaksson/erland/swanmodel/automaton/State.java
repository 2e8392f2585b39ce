package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [initial] state [#luid] [id]:} followed by strong transitions ({@code unless}),
 * body sections and weak transitions ({@code until}).
 */
public final class State extends StateMachineItem {

    private final Identification identification;
    private final List<Transition> strongTransitions;
    private final List<ScopeSection> sections;
    private final List<Transition> weakTransitions;
    private final boolean initial;

    public State(SourceSpan span, Identification identification, List<Transition> strongTransitions,
                 List<ScopeSection> sections, List<Transition> weakTransitions, boolean initial) {
        super(span);
        this.identification = identification == null ? Identification.UNDEFINED : identification;
        this.strongTransitions = adoptAll(strongTransitions);
        this.sections = adoptAll(sections);
        this.weakTransitions = adoptAll(weakTransitions);
        this.initial = initial;
    }

    @Override public StateMachineItemKind kind() {
        return StateMachineItemKind.STATE;
    }

    public Identification identification() {
        return identification;
    }

    public List<Transition> strongTransitions() {
        return strongTransitions;
    }

    public List<ScopeSection> sections() {
        return sections;
    }

    public List<Transition> weakTransitions() {
        return weakTransitions;
    }

    public boolean isInitial() {
        return initial;
    }

    /** Transitions declared in the state: strong ones first, then weak ones, each in source order. */
    public List<OutgoingTransition> outgoing() {
        List<OutgoingTransition> out = new ArrayList<>();
        for (Transition t : strongTransitions) out.add(new OutgoingTransition(TransitionKind.STRONG, t));
        for (Transition t : weakTransitions) out.add(new OutgoingTransition(TransitionKind.WEAK, t));
        return out;
    }

    @Override public void write(SwanWriter out) {
        if (initial) out.text("initial ");
        out.text("state");
        if (!identification.isUndefined()) out.text(" ").text(identification.render());
        out.text(":").indent();
        writeTransitions(out, TransitionKind.STRONG, strongTransitions);
        for (ScopeSection s : sections) out.line().node(s);
        writeTransitions(out, TransitionKind.WEAK, weakTransitions);
        out.dedent();
    }

    private static void writeTransitions(SwanWriter out, TransitionKind kind, List<Transition> transitions) {
        if (transitions.isEmpty()) return;
        out.line().text(kind.keyword()).indent();
        for (Transition t : transitions) out.line().node(t);
        out.dedent();
    }
}
