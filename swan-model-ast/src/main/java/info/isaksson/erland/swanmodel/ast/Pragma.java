package info.isaksson.erland.swanmodel.ast;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A {@code #pragma ... #end} annotation, kept verbatim. */
public record Pragma(String text) {

    private static final Pattern KEY_VALUE = Pattern.compile("^#pragma\\s+(\\S+)\\s*(.*?)\\s*#end$", Pattern.DOTALL);

    public Pragma {
        if (text == null) throw new IllegalArgumentException("text is null");
    }

    /** Splits {@code #pragma key value#end} into key and value (the value may be empty). */
    public Optional<Map.Entry<String, String>> keyValue() {
        Matcher m = KEY_VALUE.matcher(text);
        if (!m.matches()) return Optional.empty();
        return Optional.of(Map.entry(m.group(1), m.group(2)));
    }

    @Override public String toString() {
        return text;
    }
}
