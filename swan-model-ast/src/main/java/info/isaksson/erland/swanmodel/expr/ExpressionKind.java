package info.isaksson.erland.swanmodel.expr;

public enum ExpressionKind {
    PATH_ID,
    LAST,
    LITERAL,
    PORT,
    UNARY,
    BINARY,
    CAST,
    WHEN_CLOCK,
    WHEN_MATCH,
    GROUP,
    GROUP_ADAPTATION,
    STRUCT_PROJECTION,
    ARRAY_PROJECTION,
    SLICE,
    DYNAMIC_PROJECTION,
    MAKE_ARRAY,
    ARRAY_GROUP,
    MAKE_STRUCT,
    VARIANT,
    FUNCTIONAL_UPDATE,
    IF_THEN_ELSE,
    CASE,
    OPERATOR_INSTANCE,
    WINDOW,
    MERGE,
    FORWARD,
    PROTECTED
}
