package info.isaksson.erland.swanmodel.parse;

/** Ties the parsers of one token region together. */
final class UnitParser {

    private final ParseContext ctx;
    private final boolean interfaceUnit;
    private final ExpressionParser expressions;
    private final TypeParser types;
    private final ScopeParser scopes;
    private final DeclarationParser declarations;

    UnitParser(ParseContext ctx, boolean interfaceUnit) {
        this.ctx = ctx;
        this.interfaceUnit = interfaceUnit;
        this.expressions = new ExpressionParser(this);
        this.types = new TypeParser(this);
        this.scopes = new ScopeParser(this);
        this.declarations = new DeclarationParser(this);
    }

    ParseContext context() {
        return ctx;
    }

    /** Body-less operators of an interface are signatures. */
    boolean isInterface() {
        return interfaceUnit;
    }

    ExpressionParser expressions() {
        return expressions;
    }

    TypeParser types() {
        return types;
    }

    ScopeParser scopes() {
        return scopes;
    }

    DeclarationParser declarations() {
        return declarations;
    }
}
