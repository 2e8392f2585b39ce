package info.isaksson.erland.swanmodel.ast;

import java.util.regex.Pattern;

/** Locally unique identifier, written {@code #value}. The value is stored without the hash. */
public record Luid(String value) {

    private static final Pattern LUID = Pattern.compile("^#?\\w+$");

    public Luid {
        if (value == null) throw new IllegalArgumentException("luid is null");
        if (value.startsWith("#")) value = value.substring(1);
        if (value.isEmpty()) throw new IllegalArgumentException("luid is empty");
    }

    public static Luid of(String text) {
        return new Luid(text);
    }

    public static boolean isValid(String text) {
        return text != null && LUID.matcher(text).matches();
    }

    @Override public String toString() {
        return "#" + value;
    }
}
