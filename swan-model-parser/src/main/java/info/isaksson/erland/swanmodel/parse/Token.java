package info.isaksson.erland.swanmodel.parse;

/** Lexed token; offsets are absolute in the unit text, line and column are 1-based. */
record Token(TokenKind kind, String text, int start, int end, int line, int column) {

    boolean is(TokenKind k) {
        return kind == k;
    }

    boolean isSymbol(String s) {
        return kind == TokenKind.SYMBOL && text.equals(s);
    }

    /** Identifier spelled {@code word}; keywords are identifiers to the lexer. */
    boolean isWord(String word) {
        return kind == TokenKind.IDENT && text.equals(word);
    }

    @Override public String toString() {
        return kind == TokenKind.EOF ? "end of text" : "'" + text + "'";
    }
}
