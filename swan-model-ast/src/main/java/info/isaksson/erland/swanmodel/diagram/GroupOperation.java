package info.isaksson.erland.swanmodel.diagram;

/** Regrouping done by a bar: none, by name, by position, or normalization {@code ()}. */
public enum GroupOperation {
    NONE(""),
    BY_NAME("byname"),
    BY_POSITION("bypos"),
    NORMALIZE("()");

    private final String keyword;

    GroupOperation(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
