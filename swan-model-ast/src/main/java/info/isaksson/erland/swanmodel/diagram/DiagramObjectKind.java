package info.isaksson.erland.swanmodel.diagram;

public enum DiagramObjectKind {
    EXPR_BLOCK,
    DEF_BLOCK,
    BLOCK,
    BAR,
    SECTION_BLOCK,
    PROTECTED
}
