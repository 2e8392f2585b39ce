package info.isaksson.erland.swanmodel.expr;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Decodes Swan numeric literals: {@code 0b101}, {@code 0o17}, {@code 0x1F_ui8}, {@code 1.5e3_f32}. */
public final class SwanNumerics {

    private static final Pattern INTEGER = Pattern.compile(
            "^(0b[01]+|0o[0-7]+|0x[0-9a-fA-F]+|[0-9]+)(?:_(i8|i16|i32|i64|ui8|ui16|ui32|ui64))?$");
    private static final Pattern FLOAT = Pattern.compile(
            "^([0-9]+\\.[0-9]*(?:[eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+)(?:_(f32|f64))?$");

    private SwanNumerics() {}

    public record IntegerValue(BigInteger value, Optional<String> suffix) {
        public boolean isUnsigned() {
            return suffix.map(s -> s.startsWith("u")).orElse(false);
        }
    }

    public record FloatValue(double value, Optional<String> suffix) {}

    public static boolean isInteger(String text) {
        return text != null && INTEGER.matcher(text).matches();
    }

    public static boolean isFloat(String text) {
        return text != null && FLOAT.matcher(text).matches();
    }

    public static IntegerValue parseInteger(String text, boolean negative) {
        Matcher m = text == null ? null : INTEGER.matcher(text);
        if (m == null || !m.matches()) throw new NumberFormatException("not a Swan integer: " + text);
        String digits = m.group(1);
        BigInteger v;
        if (digits.startsWith("0b")) v = new BigInteger(digits.substring(2), 2);
        else if (digits.startsWith("0o")) v = new BigInteger(digits.substring(2), 8);
        else if (digits.startsWith("0x")) v = new BigInteger(digits.substring(2), 16);
        else v = new BigInteger(digits);
        return new IntegerValue(negative ? v.negate() : v, Optional.ofNullable(m.group(2)));
    }

    public static FloatValue parseFloat(String text, boolean negative) {
        Matcher m = text == null ? null : FLOAT.matcher(text);
        if (m == null || !m.matches()) throw new NumberFormatException("not a Swan float: " + text);
        double v = Double.parseDouble(m.group(1));
        return new FloatValue(negative ? -v : v, Optional.ofNullable(m.group(2)));
    }
}
