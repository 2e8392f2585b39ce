package info.isaksson.erland.swanmodel.ast;

public enum GlobalDeclarationKind {
    TYPES,
    CONSTANTS,
    SENSORS,
    GROUPS,
    OPERATOR,
    SIGNATURE,
    USE,
    PROTECTED
}
