package info.isaksson.erland.swanmodel.expr;

public enum OperatorCallKind {
    PATH,
    PRIMITIVE,
    OPERATOR_EXPRESSION
}
