package info.isaksson.erland.swanmodel.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A {@code ::} separated path such as {@code P::Q::T}, or a protected path
 * ({@code {syntax%...%syntax}}). Equality is by text.
 */
public final class PathIdentifier {

    public static final String SEPARATOR = "::";

    private static final Pattern PATH = Pattern.compile("^[a-zA-Z]\\w*(::[a-zA-Z]\\w*)*$");
    private static final Pattern FILE_PATH = Pattern.compile("^[a-zA-Z]\\w*(-[a-zA-Z]\\w*)*$");

    private final List<Identifier> segments;
    private final ProtectedText protectedText;

    private PathIdentifier(List<Identifier> segments, ProtectedText protectedText) {
        this.segments = segments;
        this.protectedText = protectedText;
    }

    public static PathIdentifier of(List<Identifier> segments) {
        if (segments == null || segments.isEmpty()) throw new IllegalArgumentException("path has no segment");
        return new PathIdentifier(List.copyOf(segments), null);
    }

    public static PathIdentifier of(Identifier... segments) {
        return of(List.of(segments));
    }

    public static PathIdentifier protectedPath(ProtectedText text) {
        if (text == null) throw new IllegalArgumentException("text is null");
        return new PathIdentifier(List.of(), text);
    }

    /** Parses {@code A::B::c}; no validation beyond splitting. */
    public static PathIdentifier parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("path is blank");
        List<Identifier> ids = new ArrayList<>();
        for (String s : text.split(SEPARATOR, -1)) ids.add(Identifier.of(s.trim()));
        return of(ids);
    }

    /** Module path from a file name: {@code P-Q.swan} gives {@code P::Q}. */
    public static PathIdentifier fromFileName(String fileName) {
        String base = fileName;
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        return parse(base.replace("-", SEPARATOR));
    }

    public static boolean isValidPath(String text) {
        return text != null && PATH.matcher(text).matches();
    }

    /** Module file base names use {@code -} where paths use {@code ::}. */
    public static boolean isValidFilePath(String text) {
        return text != null && FILE_PATH.matcher(text).matches();
    }

    public List<Identifier> segments() {
        return segments;
    }

    public boolean isProtected() {
        return protectedText != null;
    }

    public ProtectedText protectedText() {
        return protectedText;
    }

    public Identifier last() {
        if (isProtected()) throw new UsagePreconditionException("protected path has no segments");
        return segments.get(segments.size() - 1);
    }

    /** Path without its last segment; empty string for a simple name. */
    public String qualifier() {
        if (isProtected() || segments.size() < 2) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size() - 1; i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(segments.get(i).value());
        }
        return sb.toString();
    }

    public boolean isSimple() {
        return !isProtected() && segments.size() == 1;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathIdentifier)) return false;
        return toString().equals(o.toString());
    }

    @Override public int hashCode() {
        return Objects.hash(toString());
    }

    @Override public String toString() {
        if (isProtected()) return protectedText.rawText();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(segments.get(i).render());
        }
        return sb.toString();
    }
}
