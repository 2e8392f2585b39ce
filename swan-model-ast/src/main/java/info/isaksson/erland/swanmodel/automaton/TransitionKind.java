package info.isaksson.erland.swanmodel.automaton;

/** Strong transitions ({@code unless}) are checked before the state body, weak ones ({@code until}) after. */
public enum TransitionKind {
    STRONG("unless"),
    WEAK("until");

    private final String keyword;

    TransitionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
