package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

/**
 * Markups delimiting protected source regions: {@code {markup% ... %markup}}.
 * {@link #NONE} marks a region the parser could not structure.
 */
public enum Markup {
    SYNTAX("syntax"),
    VAR("var"),
    GROUP("group"),
    SENSOR("sensor"),
    CONST("const"),
    TYPE("type"),
    USE("use"),
    SIGNATURE("signature"),
    TEXT("text"),
    SYNTAX_TEXT("syntax_text"),
    EMPTY(""),
    INST("inst"),
    OP_EXPR("op_expr"),
    DIM("dim"),
    NONE(null);

    private final String keyword;

    Markup(String keyword) {
        this.keyword = keyword;
    }

    /** Keyword written between the brace and the percent sign; null for {@link #NONE}. */
    public String keyword() {
        return keyword;
    }

    public String open() {
        if (keyword == null) return "";
        return "{" + keyword + "%";
    }

    public String close() {
        if (keyword == null) return "";
        return "%" + keyword + "}";
    }

    public static Optional<Markup> fromKeyword(String keyword) {
        if (keyword == null) return Optional.empty();
        for (Markup m : values()) {
            if (keyword.equals(m.keyword)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
