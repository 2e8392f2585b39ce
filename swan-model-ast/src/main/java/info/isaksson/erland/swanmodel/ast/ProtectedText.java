package info.isaksson.erland.swanmodel.ast;

/**
 * Verbatim source fragment held by every protected node.
 *
 * @param rawText exact source slice, markup delimiters included
 * @param markup  markup of the region, {@link Markup#NONE} for parser fallbacks
 * @param isText  true when the author delimited the region explicitly
 */
public record ProtectedText(String rawText, Markup markup, boolean isText) {

    public ProtectedText {
        if (rawText == null) throw new IllegalArgumentException("rawText is null");
        if (markup == null) markup = Markup.NONE;
    }

    /** Region the parser gave up on. */
    public static ProtectedText fallback(String rawText) {
        return new ProtectedText(rawText, Markup.NONE, false);
    }

    /** Builds {@code {markup%data%markup}}. */
    public static ProtectedText markedUp(Markup markup, String data) {
        if (markup == null || markup == Markup.NONE) {
            throw new IllegalArgumentException("a markup is required");
        }
        return new ProtectedText(markup.open() + data + markup.close(), markup, true);
    }

    /**
     * Content between the markup delimiters. A trailing text after the closing
     * delimiter (such as the equation semicolon) is not part of the data.
     */
    public String data() {
        if (markup == Markup.NONE) return rawText;
        String open = markup.open();
        String close = markup.close();
        int end = rawText.lastIndexOf(close);
        if (!rawText.startsWith(open) || end < open.length()) return rawText;
        return rawText.substring(open.length(), end);
    }
}
