package info.isaksson.erland.swanmodel.parse;

enum TokenKind {
    /** Identifier or keyword, {@code _} included. */
    IDENT,
    /** {@code 'T} */
    NAME,
    /** {@code #id} */
    LUID,
    INTEGER,
    FLOAT,
    CHAR,
    /** {@code #pragma ... #end} */
    PRAGMA,
    /** {@code {kw% ... %kw}} */
    MARKUP,
    SYMBOL,
    /** Character the lexer does not know. */
    ERROR,
    EOF
}
