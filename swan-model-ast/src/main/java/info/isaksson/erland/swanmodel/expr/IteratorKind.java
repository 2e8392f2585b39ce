package info.isaksson.erland.swanmodel.expr;

import java.util.Optional;

public enum IteratorKind {
    MAP("map"),
    FOLD("fold"),
    MAPFOLD("mapfold"),
    MAPI("mapi"),
    FOLDI("foldi"),
    MAPFOLDI("mapfoldi");

    private final String keyword;

    IteratorKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /** True for the variants passing the iteration index. */
    public boolean isIndexed() {
        return keyword.endsWith("i");
    }

    public static Optional<IteratorKind> fromKeyword(String keyword) {
        for (IteratorKind k : values()) {
            if (k.keyword.equals(keyword)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
