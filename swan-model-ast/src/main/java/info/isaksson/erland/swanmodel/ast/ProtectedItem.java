package info.isaksson.erland.swanmodel.ast;

/**
 * Implemented by the protected variant of every grammar category. A protected item is a
 * leaf: it has no children and renders as its raw text, byte for byte.
 */
public interface ProtectedItem {

    ProtectedText protectedText();

    default String rawText() {
        return protectedText().rawText();
    }

    default Markup markup() {
        return protectedText().markup();
    }

    default boolean isText() {
        return protectedText().isText();
    }

    default String data() {
        return protectedText().data();
    }
}
