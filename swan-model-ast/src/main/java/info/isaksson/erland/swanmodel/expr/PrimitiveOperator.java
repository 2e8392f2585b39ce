package info.isaksson.erland.swanmodel.expr;

import java.util.Optional;

public enum PrimitiveOperator {
    REVERSE("reverse"),
    TRANSPOSE("transpose"),
    PACK("pack"),
    FLATTEN("flatten");

    private final String keyword;

    PrimitiveOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<PrimitiveOperator> fromKeyword(String keyword) {
        for (PrimitiveOperator p : values()) {
            if (p.keyword.equals(keyword)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
