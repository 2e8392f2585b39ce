package info.isaksson.erland.swanmodel.parse;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SwanLexerTest {

    private static List<Token> lex(String text) throws SwanSyntaxException {
        return new SwanLexer(text, 0, text.length(), new LineMap(text)).tokenize();
    }

    private static String kinds(List<Token> tokens) {
        return tokens.stream().map(t -> t.kind().name()).collect(Collectors.joining(" "));
    }

    @Test
    void dropsCommentsAndKeepsOffsets() throws Exception {
        List<Token> tokens = lex("x -- trailing\n/* block */ y");

        assertEquals("IDENT IDENT EOF", kinds(tokens));
        assertEquals("y", tokens.get(1).text());
        assertEquals(26, tokens.get(1).start());
        assertEquals(2, tokens.get(1).line());
        assertEquals(13, tokens.get(1).column());
    }

    @Test
    void lexesLiteralsNamesAndLuids() throws Exception {
        List<Token> tokens = lex("0x1F 3.5e2_f32 12_u8 'a' '\\n' 'T #12 #pragma cg name#end");

        assertEquals("INTEGER FLOAT INTEGER CHAR CHAR NAME LUID PRAGMA EOF", kinds(tokens));
        assertEquals("3.5e2_f32", tokens.get(1).text());
        assertEquals("'T", tokens.get(5).text());
        assertEquals("#pragma cg name#end", tokens.get(7).text());
    }

    @Test
    void rangeIsNotAFloat() throws Exception {
        List<Token> tokens = lex("a[0..2]");

        assertEquals("IDENT SYMBOL INTEGER SYMBOL INTEGER SYMBOL EOF", kinds(tokens));
        assertEquals("..", tokens.get(3).text());
    }

    @Test
    void prefersLongestSymbols() throws Exception {
        List<Token> tokens = lex("A::B <<n>> :> -> =>");

        assertEquals(List.of("A", "::", "B", "<<", "n", ">>", ":>", "->", "=>", ""),
                tokens.stream().map(Token::text).collect(Collectors.toList()));
    }

    @Test
    void markupIsOneToken() throws Exception {
        List<Token> tokens = lex("{syntax%x = -- not a comment ;%syntax};");

        assertEquals("MARKUP SYMBOL EOF", kinds(tokens));
        assertEquals("{syntax%x = -- not a comment ;%syntax}", tokens.get(0).text());
        assertEquals("{%%}", lex("{%%}").get(0).text());
    }

    @Test
    void structBraceIsNotMarkup() throws Exception {
        assertEquals("SYMBOL IDENT SYMBOL INTEGER SYMBOL EOF", kinds(lex("{a: 1}")));
    }

    @Test
    void unterminatedMarkupIsAnError() {
        SwanSyntaxException e = assertThrows(SwanSyntaxException.class, () -> lex("x {text%node N"));
        assertEquals(2, e.offset());
    }

    @Test
    void unknownCharacterIsAnErrorToken() throws Exception {
        assertEquals("IDENT ERROR IDENT EOF", kinds(lex("a $ b")));
    }
}
