package info.isaksson.erland.swanmodel.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProtectedTextTest {

    @Test
    void markedUpTextKeepsDelimiters() {
        ProtectedText t = ProtectedText.markedUp(Markup.SYNTAX, "x = ;");

        assertEquals("{syntax%x = ;%syntax}", t.rawText());
        assertEquals("x = ;", t.data());
        assertTrue(t.isText());
    }

    @Test
    void dataIgnoresTrailingTerminator() {
        ProtectedText t = new ProtectedText("{var%a: T%var};", Markup.VAR, true);

        assertEquals("a: T", t.data());
    }

    @Test
    void fallbackIsItsOwnData() {
        ProtectedText t = ProtectedText.fallback("b = 1 + ;");

        assertEquals(Markup.NONE, t.markup());
        assertEquals("b = 1 + ;", t.data());
        assertFalse(t.isText());
    }

    @Test
    void markupIsRequiredForMarkedUpText() {
        assertThrows(IllegalArgumentException.class, () -> ProtectedText.markedUp(Markup.NONE, "x"));
    }

    @Test
    void markupsAreFoundByKeyword() {
        assertEquals(Markup.EMPTY, Markup.fromKeyword("").orElseThrow());
        assertEquals(Markup.OP_EXPR, Markup.fromKeyword("op_expr").orElseThrow());
        assertTrue(Markup.fromKeyword("nope").isEmpty());
        assertEquals("{%", Markup.EMPTY.open());
        assertEquals("%text}", Markup.TEXT.close());
    }

    @Test
    void protectedNodesRenderVerbatim() {
        ProtectedEquation eq = new ProtectedEquation(SourceSpan.NONE, ProtectedText.fallback("b = 1 +  ;"));

        assertEquals("b = 1 +  ;", eq.render());
        assertTrue(eq.isProtected());
    }
}
