package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code c}, {@code not c} or {@code (c match pattern)}. */
public final class ClockExpr extends SwanNode {

    public enum Form { ID, NOT, MATCH }

    private final Form form;
    private final Identifier clock;
    private final Pattern pattern;

    private ClockExpr(SourceSpan span, Form form, Identifier clock, Pattern pattern) {
        super(span);
        if (clock == null) throw new IllegalArgumentException("clock is null");
        this.form = form;
        this.clock = clock;
        this.pattern = adopt(pattern);
    }

    public static ClockExpr id(SourceSpan span, Identifier clock) {
        return new ClockExpr(span, Form.ID, clock, null);
    }

    public static ClockExpr not(SourceSpan span, Identifier clock) {
        return new ClockExpr(span, Form.NOT, clock, null);
    }

    public static ClockExpr match(SourceSpan span, Identifier clock, Pattern pattern) {
        if (pattern == null) throw new IllegalArgumentException("pattern is null");
        return new ClockExpr(span, Form.MATCH, clock, pattern);
    }

    public Form form() {
        return form;
    }

    public Identifier clock() {
        return clock;
    }

    public Optional<Pattern> pattern() {
        return Optional.ofNullable(pattern);
    }

    @Override public void write(SwanWriter out) {
        switch (form) {
            case ID -> out.text(clock.render());
            case NOT -> out.text("not ").text(clock.render());
            case MATCH -> out.text("(").text(clock.render()).text(" match ").node(pattern).text(")");
        }
    }
}
