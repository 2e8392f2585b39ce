package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

/**
 * User operator: a signature with a scope body, a single equation body, or no body.
 * An operator written as {@code {text%...%text}} keeps that text and renders it unchanged.
 */
public final class Operator extends GlobalDeclaration implements Declaration {

    private final Signature signature;
    private final SwanNode body;
    private final ProtectedText textMarkup;

    public Operator(SourceSpan span, Signature signature, Scope body) {
        this(span, signature, (SwanNode) body, null);
    }

    public Operator(SourceSpan span, Signature signature, Equation body) {
        this(span, signature, (SwanNode) body, null);
    }

    /** Operator structured from a {@code {text%...%text}} region. */
    public static Operator fromText(SourceSpan span, Signature signature, SwanNode body, ProtectedText textMarkup) {
        if (textMarkup == null) throw new IllegalArgumentException("textMarkup is null");
        return new Operator(span, signature, body, textMarkup);
    }

    private Operator(SourceSpan span, Signature signature, SwanNode body, ProtectedText textMarkup) {
        super(span);
        if (signature == null) throw new IllegalArgumentException("signature is null");
        if (body != null && !(body instanceof Scope) && !(body instanceof Equation)) {
            throw new IllegalArgumentException("operator body must be a scope or an equation");
        }
        this.signature = adopt(signature);
        this.body = adopt(body);
        this.textMarkup = textMarkup;
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.OPERATOR;
    }

    @Override public Identifier identifier() {
        return signature.identifier();
    }

    public Signature signature() {
        return signature;
    }

    public Optional<Scope> scopeBody() {
        return body instanceof Scope s ? Optional.of(s) : Optional.empty();
    }

    public Optional<Equation> equationBody() {
        return body instanceof Equation e ? Optional.of(e) : Optional.empty();
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isText() {
        return textMarkup != null;
    }

    public Optional<ProtectedText> textMarkup() {
        return Optional.ofNullable(textMarkup);
    }

    @Override public void write(SwanWriter out) {
        if (textMarkup != null) {
            out.raw(textMarkup.rawText());
            return;
        }
        signature.writeHeader(out);
        if (body == null) {
            out.text(";");
        } else if (body instanceof Scope) {
            out.line().node(body);
        } else {
            out.indent().line().node(body).dedent();
        }
    }
}
