package info.isaksson.erland.swanmodel.expr;

import java.util.Optional;

public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    SLASH("/"),
    MOD("mod"),
    LAND("land"),
    LOR("lor"),
    LXOR("lxor"),
    LSL("lsl"),
    LSR("lsr"),
    EQUAL("="),
    DIFF("<>"),
    LT("<"),
    GT(">"),
    LEQ("<="),
    GEQ(">="),
    AND("and"),
    OR("or"),
    XOR("xor"),
    ARROW("->"),
    CONCAT("@");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<BinaryOperator> fromSymbol(String text) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(text)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
