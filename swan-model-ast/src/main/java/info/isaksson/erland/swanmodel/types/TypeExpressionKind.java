package info.isaksson.erland.swanmodel.types;

public enum TypeExpressionKind {
    PREDEFINED,
    SIZED,
    ALIAS,
    VARIABLE,
    STRUCT,
    ARRAY,
    PROTECTED
}
