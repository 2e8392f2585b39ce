package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.Markup;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.Pragma;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Token cursor over one region of a unit text. Positions can be saved and restored, which
 * the parsers use for lookahead and for recovering from errors.
 */
final class ParseContext {

    static final int MAX_NESTING = 200;

    private final String text;
    private final String sourceName;
    private final LineMap lines;
    private final List<Token> tokens;
    private int pos;
    private int depth;

    ParseContext(String text, String sourceName, LineMap lines, List<Token> tokens) {
        this.text = text;
        this.sourceName = sourceName;
        this.lines = lines;
        this.tokens = tokens;
    }

    /** Context over the region {@code [from, to)} of the same text. */
    ParseContext region(int from, int to) throws SwanSyntaxException {
        return new ParseContext(text, sourceName, lines, new SwanLexer(text, from, to, lines).tokenize());
    }

    String text() {
        return text;
    }

    int mark() {
        return pos;
    }

    void reset(int mark) {
        pos = mark;
    }

    Token peek() {
        return tokens.get(pos);
    }

    Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != TokenKind.EOF) pos++;
        return t;
    }

    boolean atEnd() {
        return peek().is(TokenKind.EOF);
    }

    boolean at(TokenKind kind) {
        return peek().is(kind);
    }

    boolean atSymbol(String s) {
        return peek().isSymbol(s);
    }

    boolean atWord(String w) {
        return peek().isWord(w);
    }

    boolean acceptSymbol(String s) {
        if (!atSymbol(s)) return false;
        next();
        return true;
    }

    boolean acceptWord(String w) {
        if (!atWord(w)) return false;
        next();
        return true;
    }

    Token expectSymbol(String s) throws SwanSyntaxException {
        if (!atSymbol(s)) throw error("expected '" + s + "'");
        return next();
    }

    Token expectWord(String w) throws SwanSyntaxException {
        if (!atWord(w)) throw error("expected '" + w + "'");
        return next();
    }

    Token expect(TokenKind kind) throws SwanSyntaxException {
        if (!at(kind)) throw error("expected " + kind.name().toLowerCase());
        return next();
    }

    /** True at a non reserved identifier, possibly preceded by pragmas. */
    boolean atIdentifier() {
        int i = 0;
        while (peek(i).is(TokenKind.PRAGMA)) i++;
        Token t = peek(i);
        return t.is(TokenKind.IDENT) && !SwanKeywords.isReserved(t.text()) && !t.text().equals("_");
    }

    /** Identifier with the pragmas written in front of it. */
    Identifier identifier() throws SwanSyntaxException {
        List<Pragma> pragmas = new ArrayList<>();
        while (at(TokenKind.PRAGMA)) pragmas.add(new Pragma(next().text()));
        if (!atIdentifier()) throw error("expected an identifier");
        return new Identifier(next().text(), pragmas);
    }

    PathIdentifier path() throws SwanSyntaxException {
        List<Identifier> segments = new ArrayList<>();
        segments.add(identifier());
        while (atSymbol("::") && peek(1).is(TokenKind.IDENT)) {
            next();
            segments.add(identifier());
        }
        return PathIdentifier.of(segments);
    }

    Luid luid() throws SwanSyntaxException {
        return Luid.of(expect(TokenKind.LUID).text());
    }

    /** Protected text of a markup token. */
    ProtectedText markup(Token token) {
        return new ProtectedText(token.text(), markupOf(token), true);
    }

    /** Protected text of a markup token followed by an optional {@code ;}, which is kept in the raw text. */
    ProtectedText markupWithTerminator(Token token) {
        int end = token.end();
        if (atSymbol(";")) end = next().end();
        return new ProtectedText(text.substring(token.start(), end), markupOf(token), true);
    }

    static Markup markupOf(Token token) {
        String t = token.text();
        String keyword = t.substring(1, t.indexOf('%'));
        return Markup.fromKeyword(keyword).orElse(Markup.NONE);
    }

    boolean atMarkup(Markup markup) {
        return at(TokenKind.MARKUP) && markupOf(peek()) == markup;
    }

    /** Offset just after the last consumed token. */
    int lastEnd() {
        return pos == 0 ? peek().start() : tokens.get(pos - 1).end();
    }

    SourceSpan span(int start) {
        return span(start, Math.max(start, lastEnd()));
    }

    SourceSpan span(int start, int end) {
        return new SourceSpan(sourceName, start, end,
                lines.line(start), lines.column(start), lines.line(end), lines.column(end));
    }

    String raw(int start, int end) {
        return text.substring(start, end);
    }

    /**
     * Enters one level of bracket, operator or scope nesting. Past {@link #MAX_NESTING} levels the
     * text is reported as a syntax error, so that it ends up protected instead of exhausting the stack.
     * Each call is paired with {@link #leave()} in a {@code finally} block.
     */
    void enter() throws SwanSyntaxException {
        if (depth >= MAX_NESTING) throw error("nesting deeper than " + MAX_NESTING + " levels");
        depth++;
    }

    void leave() {
        depth--;
    }

    SwanSyntaxException error(String message) {
        Token t = peek();
        return new SwanSyntaxException(sourceName + ":" + t.line() + ":" + t.column() + ": " + message
                + ", found " + t, t.start());
    }

    /**
     * Skips a balanced run of tokens: stops before a closing bracket that has no opening
     * partner, or before a token accepted by {@code stop} at nesting depth zero.
     */
    void skipBalanced(Predicate<Token> stop) {
        int depth = 0;
        while (!atEnd()) {
            Token t = peek();
            if (depth == 0 && stop.test(t)) return;
            if (t.isSymbol("(") || t.isSymbol("[") || t.isSymbol("{")) {
                depth++;
            } else if (t.isSymbol(")") || t.isSymbol("]") || t.isSymbol("}")) {
                if (depth == 0) return;
                depth--;
            }
            next();
        }
    }
}
