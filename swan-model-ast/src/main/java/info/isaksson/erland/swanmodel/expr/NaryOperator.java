package info.isaksson.erland.swanmodel.expr;

import java.util.Optional;

public enum NaryOperator {
    PLUS("+"),
    MULT("*"),
    LAND("land"),
    LOR("lor"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    CONCAT("@");

    private final String symbol;

    NaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<NaryOperator> fromSymbol(String symbol) {
        for (NaryOperator o : values()) {
            if (o.symbol.equals(symbol)) return Optional.of(o);
        }
        return Optional.empty();
    }
}
