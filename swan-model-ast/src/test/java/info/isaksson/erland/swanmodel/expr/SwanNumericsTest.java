package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SwanNumericsTest {

    @Test
    void decodesIntegerRadixesAndSuffixes() {
        assertEquals(BigInteger.valueOf(5), SwanNumerics.parseInteger("0b101", false).value());
        assertEquals(BigInteger.valueOf(15), SwanNumerics.parseInteger("0o17", false).value());
        assertEquals(BigInteger.valueOf(-31), SwanNumerics.parseInteger("0x1F", true).value());

        SwanNumerics.IntegerValue v = SwanNumerics.parseInteger("200_ui8", false);
        assertEquals("ui8", v.suffix().orElseThrow());
        assertTrue(v.isUnsigned());
        assertFalse(SwanNumerics.parseInteger("3_i64", false).isUnsigned());
    }

    @Test
    void decodesFloats() {
        SwanNumerics.FloatValue f = SwanNumerics.parseFloat("1.5e3_f32", false);
        assertEquals(1500.0, f.value());
        assertEquals("f32", f.suffix().orElseThrow());
        assertEquals(-2.0, SwanNumerics.parseFloat("2.", true).value());
    }

    @Test
    void classifiesLiterals() {
        assertTrue(SwanNumerics.isInteger("42"));
        assertFalse(SwanNumerics.isInteger("4.2"));
        assertTrue(SwanNumerics.isFloat("4.2"));
        assertFalse(SwanNumerics.isFloat("42_i8"));
        assertThrows(NumberFormatException.class, () -> SwanNumerics.parseInteger("0b2", false));
    }

    @Test
    void literalExpressionExposesItsValue() {
        LiteralExpr e = new LiteralExpr(SourceSpan.NONE, LiteralKind.INTEGER, "0x10");
        assertEquals(BigInteger.valueOf(16), e.integerValue().value());
        assertEquals("0x10", e.render());
    }
}
