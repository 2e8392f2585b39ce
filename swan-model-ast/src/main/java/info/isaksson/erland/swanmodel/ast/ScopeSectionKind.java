package info.isaksson.erland.swanmodel.ast;

public enum ScopeSectionKind {
    VAR,
    LET,
    EMIT,
    ASSUME,
    GUARANTEE,
    DIAGRAM,
    PROTECTED
}
