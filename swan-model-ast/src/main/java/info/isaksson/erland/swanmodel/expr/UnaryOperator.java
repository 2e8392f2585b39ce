package info.isaksson.erland.swanmodel.expr;

import java.util.Optional;

public enum UnaryOperator {
    MINUS("-"),
    PLUS("+"),
    LNOT("lnot"),
    NOT("not"),
    PRE("pre");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Keyword operators are separated from their operand by a space. */
    public boolean isKeyword() {
        return Character.isLetter(symbol.charAt(0));
    }

    public static Optional<UnaryOperator> fromSymbol(String text) {
        for (UnaryOperator op : values()) {
            if (op.symbol.equals(text)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
