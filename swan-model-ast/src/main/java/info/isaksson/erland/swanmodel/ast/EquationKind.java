package info.isaksson.erland.swanmodel.ast;

public enum EquationKind {
    EXPR,
    STATE_MACHINE,
    ACTIVATE_IF,
    ACTIVATE_WHEN,
    PROTECTED
}
