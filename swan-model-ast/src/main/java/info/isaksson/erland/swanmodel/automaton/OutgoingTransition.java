package info.isaksson.erland.swanmodel.automaton;

/** A transition leaving a state, with whether it is checked before or after the state body. */
public record OutgoingTransition(TransitionKind kind, Transition transition) {

    public OutgoingTransition {
        if (kind == null || transition == null) throw new IllegalArgumentException("null component");
    }
}
