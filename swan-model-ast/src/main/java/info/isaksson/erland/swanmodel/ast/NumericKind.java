package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

public enum NumericKind {
    NUMERIC("numeric"),
    INTEGER("integer"),
    SIGNED("signed"),
    UNSIGNED("unsigned"),
    FLOAT("float");

    private final String keyword;

    NumericKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<NumericKind> fromKeyword(String text) {
        for (NumericKind k : values()) {
            if (k.keyword.equals(text)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
