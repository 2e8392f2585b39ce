package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.Markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a region of a unit text into tokens. Comments and white space are dropped;
 * markup regions and pragmas are single tokens.
 */
final class SwanLexer {

    private static final String[] SYMBOLS = {
            "::", "..", "<<", ">>", "<=", ">=", "<>", "->", "=>", ":>",
            ";", ":", ",", ".", "(", ")", "[", "]", "{", "}", "=", "<", ">",
            "+", "-", "*", "/", "^", "@", "|", "\\"
    };

    private final String text;
    private final int to;
    private final LineMap lines;
    private int pos;

    SwanLexer(String text, int from, int to, LineMap lines) {
        if (from < 0 || to > text.length() || from > to) {
            throw new IllegalArgumentException("invalid region [" + from + ", " + to + ")");
        }
        this.text = text;
        this.pos = from;
        this.to = to;
        this.lines = lines;
    }

    /**
     * Tokens of the region, ending with an EOF token.
     *
     * @throws SwanSyntaxException for an unterminated comment, character literal or markup
     */
    List<Token> tokenize() throws SwanSyntaxException {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipBlanks();
            if (pos >= to) {
                out.add(token(TokenKind.EOF, to, to));
                return out;
            }
            out.add(next());
        }
    }

    private void skipBlanks() throws SwanSyntaxException {
        while (pos < to) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (startsWith("--")) {
                while (pos < to && text.charAt(pos) != '\n') pos++;
            } else if (startsWith("/*")) {
                int end = text.indexOf("*/", pos + 2);
                if (end < 0 || end + 2 > to) throw new SwanSyntaxException("unterminated comment", pos);
                pos = end + 2;
            } else {
                return;
            }
        }
    }

    private Token next() throws SwanSyntaxException {
        int start = pos;
        char c = text.charAt(pos);
        if (c == '{') {
            Optional<Markup> markup = markupAt(pos);
            if (markup.isPresent()) return markupToken(start, markup.get());
        }
        if (startsWith("#pragma")) {
            int end = text.indexOf("#end", pos);
            if (end < 0 || end + 4 > to) throw new SwanSyntaxException("unterminated pragma", pos);
            pos = end + 4;
            return token(TokenKind.PRAGMA, start, pos);
        }
        if (c == '#') {
            pos++;
            while (pos < to && isWordChar(text.charAt(pos))) pos++;
            if (pos == start + 1) return token(TokenKind.ERROR, start, pos);
            return token(TokenKind.LUID, start, pos);
        }
        if (c == '\'') return quoted(start);
        if (Character.isDigit(c)) return number(start);
        if (Character.isLetter(c) || c == '_') {
            while (pos < to && isWordChar(text.charAt(pos))) pos++;
            return token(TokenKind.IDENT, start, pos);
        }
        for (String s : SYMBOLS) {
            if (startsWith(s)) {
                pos += s.length();
                return token(TokenKind.SYMBOL, start, pos);
            }
        }
        pos++;
        return token(TokenKind.ERROR, start, pos);
    }

    /** {@code {kw%} where kw is a known markup keyword, or {@code {%} for the empty markup. */
    private Optional<Markup> markupAt(int at) {
        int i = at + 1;
        while (i < to && isWordChar(text.charAt(i))) i++;
        if (i >= to || text.charAt(i) != '%') return Optional.empty();
        return Markup.fromKeyword(text.substring(at + 1, i));
    }

    private Token markupToken(int start, Markup markup) throws SwanSyntaxException {
        String close = markup.close();
        int end = text.indexOf(close, start + markup.open().length());
        if (end < 0 || end + close.length() > to) {
            throw new SwanSyntaxException("unterminated " + markup.open() + " markup", start);
        }
        pos = end + close.length();
        return token(TokenKind.MARKUP, start, pos);
    }

    /** Character literal {@code 'a'}, {@code '\n'}, {@code '\x41'}, or name {@code 'T}. */
    private Token quoted(int start) throws SwanSyntaxException {
        if (pos + 1 < to && text.charAt(pos + 1) == '\\') {
            int end = text.indexOf('\'', pos + 2);
            if (end < 0 || end >= to) throw new SwanSyntaxException("unterminated character literal", start);
            pos = end + 1;
            return token(TokenKind.CHAR, start, pos);
        }
        if (pos + 2 < to && text.charAt(pos + 2) == '\'') {
            pos += 3;
            return token(TokenKind.CHAR, start, pos);
        }
        pos++;
        while (pos < to && isWordChar(text.charAt(pos))) pos++;
        if (pos == start + 1) return token(TokenKind.ERROR, start, pos);
        return token(TokenKind.NAME, start, pos);
    }

    private Token number(int start) {
        boolean isFloat = false;
        if (text.charAt(pos) == '0' && pos + 1 < to && "box".indexOf(text.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < to && Character.isLetterOrDigit(text.charAt(pos))) pos++;
        } else {
            while (pos < to && Character.isDigit(text.charAt(pos))) pos++;
            if (pos + 1 < to && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
                isFloat = true;
                pos++;
                while (pos < to && Character.isDigit(text.charAt(pos))) pos++;
            }
            if (pos < to && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < to && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) pos++;
                if (pos < to && Character.isDigit(text.charAt(pos))) {
                    isFloat = true;
                    while (pos < to && Character.isDigit(text.charAt(pos))) pos++;
                } else {
                    pos = save;
                }
            }
        }
        if (pos + 1 < to && text.charAt(pos) == '_' && "iuf".indexOf(text.charAt(pos + 1)) >= 0) {
            pos++;
            while (pos < to && isWordChar(text.charAt(pos))) pos++;
        }
        return token(isFloat ? TokenKind.FLOAT : TokenKind.INTEGER, start, pos);
    }

    private boolean startsWith(String s) {
        return pos + s.length() <= to && text.startsWith(s, pos);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Token token(TokenKind kind, int start, int end) {
        return new Token(kind, text.substring(start, end), start, end, lines.line(start), lines.column(start));
    }
}
