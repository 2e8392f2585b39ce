package info.isaksson.erland.swanmodel.expr;

public enum OperatorExpressionKind {
    ITERATOR,
    ACTIVATE_CLOCK,
    ACTIVATE_EVERY,
    RESTART,
    PARTIAL,
    NARY,
    ANONYMOUS_WITH_EXPRESSION,
    ANONYMOUS_WITH_DATA_DEFINITION,
    PROTECTED
}
