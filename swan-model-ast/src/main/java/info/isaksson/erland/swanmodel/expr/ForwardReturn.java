package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/**
 * Item of a {@code forward} returns clause: {@code id [: [last = e] [default = e]]}, or
 * {@code [item]} collecting the values of every iteration into an array.
 */
public final class ForwardReturn extends SwanNode {

    private final Identifier identifier;
    private final Expression last;
    private final Expression defaultValue;
    private final ForwardReturn element;

    private ForwardReturn(SourceSpan span, Identifier identifier, Expression last, Expression defaultValue,
                          ForwardReturn element) {
        super(span);
        this.identifier = identifier;
        this.last = adopt(last);
        this.defaultValue = adopt(defaultValue);
        this.element = adopt(element);
    }

    public static ForwardReturn item(SourceSpan span, Identifier identifier, Expression last, Expression defaultValue) {
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        return new ForwardReturn(span, identifier, last, defaultValue, null);
    }

    public static ForwardReturn array(SourceSpan span, ForwardReturn element) {
        if (element == null) throw new IllegalArgumentException("element is null");
        return new ForwardReturn(span, null, null, null, element);
    }

    public boolean isArray() {
        return element != null;
    }

    public Optional<Identifier> identifier() {
        return Optional.ofNullable(identifier);
    }

    public Optional<Expression> last() {
        return Optional.ofNullable(last);
    }

    public Optional<Expression> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public Optional<ForwardReturn> element() {
        return Optional.ofNullable(element);
    }

    @Override public void write(SwanWriter out) {
        if (element != null) {
            out.text("[").node(element).text("]");
            return;
        }
        out.text(identifier.render());
        if (last == null && defaultValue == null) return;
        out.text(":");
        if (last != null) out.text(" last = ").node(last);
        if (defaultValue != null) out.text(" default = ").node(defaultValue);
    }
}
