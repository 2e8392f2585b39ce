package info.isaksson.erland.swanmodel.expr;

public enum LiteralKind {
    BOOL,
    CHAR,
    INTEGER,
    FLOAT
}
