package info.isaksson.erland.swanmodel.expr;

public enum PatternKind {
    PATH_ID,
    VARIANT,
    CHAR,
    INTEGER,
    BOOL,
    UNDERSCORE,
    DEFAULT,
    PROTECTED
}
