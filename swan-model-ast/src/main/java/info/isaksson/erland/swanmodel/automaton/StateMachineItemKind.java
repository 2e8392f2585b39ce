package info.isaksson.erland.swanmodel.automaton;

public enum StateMachineItemKind {
    STATE,
    TRANSITION_DECL
}
