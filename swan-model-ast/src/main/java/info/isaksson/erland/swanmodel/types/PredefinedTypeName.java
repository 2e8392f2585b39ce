package info.isaksson.erland.swanmodel.types;

import java.util.Optional;

public enum PredefinedTypeName {
    BOOL("bool"),
    CHAR("char"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64"),
    FLOAT32("float32"),
    FLOAT64("float64");

    private final String keyword;

    PredefinedTypeName(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isNumeric() {
        return this != BOOL && this != CHAR;
    }

    public static Optional<PredefinedTypeName> fromKeyword(String text) {
        for (PredefinedTypeName n : values()) {
            if (n.keyword.equals(text)) return Optional.of(n);
        }
        return Optional.empty();
    }
}
