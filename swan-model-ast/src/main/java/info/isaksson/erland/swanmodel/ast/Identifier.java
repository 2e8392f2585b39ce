package info.isaksson.erland.swanmodel.ast;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A Swan identifier with the pragmas written in front of it. Name identifiers such as
 * {@code 'T} keep their leading quote.
 */
public record Identifier(String value, List<Pragma> pragmas) {

    private static final Pattern ID = Pattern.compile("^[a-zA-Z]\\w*$");
    private static final Pattern NAME = Pattern.compile("^'[a-zA-Z]\\w*$");

    public Identifier {
        if (value == null || value.isEmpty()) throw new IllegalArgumentException("identifier value is empty");
        pragmas = pragmas == null ? List.of() : List.copyOf(pragmas);
    }

    public static Identifier of(String value) {
        return new Identifier(value, List.of());
    }

    public boolean isName() {
        return value.startsWith("'");
    }

    public boolean isValid() {
        return isValid(value);
    }

    public static boolean isValid(String text) {
        return text != null && (ID.matcher(text).matches() || NAME.matcher(text).matches());
    }

    /** Pragmas followed by the value. */
    public String render() {
        if (pragmas.isEmpty()) return value;
        StringBuilder sb = new StringBuilder();
        for (Pragma p : pragmas) sb.append(p.text()).append(' ');
        return sb.append(value).toString();
    }

    @Override public String toString() {
        return value;
    }
}
