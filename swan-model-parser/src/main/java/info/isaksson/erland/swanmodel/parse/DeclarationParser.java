package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.ConstDecl;
import info.isaksson.erland.swanmodel.ast.ConstDeclarations;
import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.GroupDecl;
import info.isaksson.erland.swanmodel.ast.GroupDeclarations;
import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Markup;
import info.isaksson.erland.swanmodel.ast.NumericKind;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.ProtectedDecl;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.ProtectedVariable;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.SensorDecl;
import info.isaksson.erland.swanmodel.ast.SensorDeclarations;
import info.isaksson.erland.swanmodel.ast.Signature;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanModelException;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.TypeConstraint;
import info.isaksson.erland.swanmodel.ast.TypeDecl;
import info.isaksson.erland.swanmodel.ast.TypeDeclarations;
import info.isaksson.erland.swanmodel.ast.UseDirective;
import info.isaksson.erland.swanmodel.ast.VarDecl;
import info.isaksson.erland.swanmodel.ast.Variable;
import info.isaksson.erland.swanmodel.expr.ClockExpr;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.types.GroupTypeExpression;
import info.isaksson.erland.swanmodel.types.TypeDefinition;
import info.isaksson.erland.swanmodel.types.TypeExpression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Global declarations and variable declarations. A declaration that cannot be structured
 * becomes a {@link ProtectedDecl} and parsing resumes at the next declaration keyword.
 */
final class DeclarationParser {

    private static final Logger logger = LogManager.getLogger();

    private final UnitParser unit;
    private final ParseContext ctx;

    DeclarationParser(UnitParser unit) {
        this.unit = unit;
        this.ctx = unit.context();
    }

    /** Declarations up to the end of the region. */
    List<GlobalDeclaration> declarations() {
        List<GlobalDeclaration> decls = new ArrayList<>();
        while (!ctx.atEnd()) decls.add(recoveringDeclaration());
        return decls;
    }

    private GlobalDeclaration recoveringDeclaration() {
        int mark = ctx.mark();
        int s = ctx.peek().start();
        try {
            return declaration();
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            ctx.reset(mark);
            ctx.next();
            ctx.skipBalanced(t -> t.is(TokenKind.IDENT) && SwanKeywords.DECLARATIONS.contains(t.text()));
            SourceSpan span = ctx.span(s);
            logger.debug("Protected declaration at {}: {}", span, e.getMessage());
            return new ProtectedDecl(span, ProtectedText.fallback(ctx.raw(s, ctx.lastEnd())));
        }
    }

    GlobalDeclaration declaration() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        if (t.is(TokenKind.MARKUP)) {
            ctx.next();
            if (ParseContext.markupOf(t) == Markup.TEXT) return textOperator(s, t);
            return new ProtectedDecl(ctx.span(s), ctx.markupWithTerminator(t));
        }
        if (!t.is(TokenKind.IDENT)) throw ctx.error("expected a declaration");
        switch (t.text()) {
            case "use": {
                ctx.next();
                PathIdentifier path = ctx.path();
                Identifier alias = ctx.acceptWord("as") ? ctx.identifier() : null;
                ctx.expectSymbol(";");
                return new UseDirective(ctx.span(s), path, alias);
            }
            case "type": {
                ctx.next();
                List<TypeDecl> items = new ArrayList<>();
                do {
                    int is = ctx.peek().start();
                    Identifier id = ctx.identifier();
                    TypeDefinition def = ctx.acceptSymbol("=") ? unit.types().typeDefinition() : null;
                    items.add(new TypeDecl(ctx.span(is), id, def));
                    ctx.expectSymbol(";");
                } while (ctx.atIdentifier());
                return new TypeDeclarations(ctx.span(s), items);
            }
            case "const": {
                ctx.next();
                List<ConstDecl> items = new ArrayList<>();
                do {
                    int is = ctx.peek().start();
                    Identifier id = ctx.identifier();
                    TypeExpression type = ctx.acceptSymbol(":") ? unit.types().typeExpression() : null;
                    Expression value = ctx.acceptSymbol("=") ? unit.expressions().expression() : null;
                    items.add(new ConstDecl(ctx.span(is), id, type, value));
                    ctx.expectSymbol(";");
                } while (ctx.atIdentifier());
                return new ConstDeclarations(ctx.span(s), items);
            }
            case "sensor": {
                ctx.next();
                List<SensorDecl> items = new ArrayList<>();
                do {
                    int is = ctx.peek().start();
                    Identifier id = ctx.identifier();
                    ctx.expectSymbol(":");
                    TypeExpression type = unit.types().typeExpression();
                    items.add(new SensorDecl(ctx.span(is), id, type));
                    ctx.expectSymbol(";");
                } while (ctx.atIdentifier());
                return new SensorDeclarations(ctx.span(s), items);
            }
            case "group": {
                ctx.next();
                List<GroupDecl> items = new ArrayList<>();
                do {
                    int is = ctx.peek().start();
                    Identifier id = ctx.identifier();
                    ctx.expectSymbol("=");
                    GroupTypeExpression type = unit.types().groupType();
                    items.add(new GroupDecl(ctx.span(is), id, type));
                    ctx.expectSymbol(";");
                } while (ctx.atIdentifier());
                return new GroupDeclarations(ctx.span(s), items);
            }
            case "inline":
            case "node":
            case "function":
                return operator(s);
            default:
                throw ctx.error("expected a declaration");
        }
    }

    private GlobalDeclaration operator(int s) throws SwanSyntaxException {
        OperatorParts parts = operatorParts(s);
        if (parts.body() == null && unit.isInterface()) return parts.signature();
        if (parts.body() instanceof Scope scope) return new Operator(ctx.span(s), parts.signature(), scope);
        if (parts.body() instanceof Equation eq) return new Operator(ctx.span(s), parts.signature(), eq);
        return new Operator(ctx.span(s), parts.signature(), (Scope) null);
    }

    /** A signature and what follows it: a scope, an equation or a {@code ;}. */
    private record OperatorParts(Signature signature, SwanNode body) {}

    private OperatorParts operatorParts(int s) throws SwanSyntaxException {
        boolean inline = ctx.acceptWord("inline");
        boolean node;
        if (ctx.acceptWord("node")) node = true;
        else if (ctx.acceptWord("function")) node = false;
        else throw ctx.error("expected 'node' or 'function'");
        Identifier id = ctx.identifier();
        List<Identifier> sizes = new ArrayList<>();
        if (ctx.acceptSymbol("<<")) {
            do {
                sizes.add(ctx.identifier());
            } while (ctx.acceptSymbol(","));
            ctx.expectSymbol(">>");
        }
        List<Variable> inputs = variables();
        ctx.expectWord("returns");
        List<Variable> outputs = variables();
        List<TypeConstraint> constraints = new ArrayList<>();
        while (ctx.atWord("where")) constraints.add(constraint());
        PathIdentifier specialization = ctx.acceptWord("specialize") ? ctx.path() : null;
        int headerEnd = ctx.lastEnd();
        SwanNode body = null;
        if (ctx.atSymbol("{")) {
            body = unit.scopes().scope();
        } else if (!ctx.atSymbol(";")) {
            body = unit.scopes().equation();
        }
        if (body == null) {
            ctx.expectSymbol(";");
            if (unit.isInterface()) headerEnd = ctx.lastEnd();
        }
        Signature signature = new Signature(ctx.span(s, headerEnd), id, node, inline, sizes, inputs, outputs,
                constraints, specialization);
        return new OperatorParts(signature, body);
    }

    private TypeConstraint constraint() throws SwanSyntaxException {
        int s = ctx.expectWord("where").start();
        if (ctx.at(TokenKind.MARKUP)) {
            ProtectedText vars = ctx.markup(ctx.next());
            NumericKind kind = numericKind();
            return new TypeConstraint(ctx.span(s), vars, kind);
        }
        List<Identifier> vars = new ArrayList<>();
        do {
            vars.add(Identifier.of(ctx.expect(TokenKind.NAME).text()));
        } while (ctx.acceptSymbol(","));
        NumericKind kind = numericKind();
        return new TypeConstraint(ctx.span(s), vars, kind);
    }

    private NumericKind numericKind() throws SwanSyntaxException {
        Token t = ctx.peek();
        NumericKind kind = NumericKind.fromKeyword(t.text()).orElseThrow(() -> ctx.error("expected a numeric kind"));
        ctx.next();
        return kind;
    }

    /**
     * A {@code {text%...%text}} region holding an operator. Its content is parsed on its own;
     * when that fails the region is kept as a protected declaration.
     */
    private GlobalDeclaration textOperator(int s, Token t) {
        ProtectedText text = ctx.markup(t);
        int from = t.start() + Markup.TEXT.open().length();
        int to = t.end() - Markup.TEXT.close().length();
        try {
            ParseContext inner = ctx.region(from, to);
            UnitParser innerUnit = new UnitParser(inner, unit.isInterface());
            OperatorParts parts = innerUnit.declarations().operatorParts(inner.peek().start());
            if (!inner.atEnd()) throw inner.error("unexpected text after the operator");
            return Operator.fromText(ctx.span(s), parts.signature(), parts.body(), text);
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            logger.debug("Operator text at {} kept unstructured: {}", ctx.span(s), e.getMessage());
            return new ProtectedDecl(ctx.span(s), text);
        }
    }

    // variables

    /** {@code ( v; ... )} */
    List<Variable> variables() throws SwanSyntaxException {
        ctx.expectSymbol("(");
        List<Variable> vars = new ArrayList<>();
        while (!ctx.atSymbol(")")) {
            vars.add(variable());
            ctx.expectSymbol(";");
        }
        ctx.expectSymbol(")");
        return vars;
    }

    boolean atVariable() {
        return ctx.atIdentifier() || ctx.atWord("clock") || ctx.atWord("probe") || ctx.at(TokenKind.MARKUP);
    }

    /** A variable declaration without its terminating {@code ;}. */
    Variable variable() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.at(TokenKind.MARKUP)) {
            Token t = ctx.next();
            return new ProtectedVariable(ctx.span(s), ctx.markup(t));
        }
        boolean clock = ctx.acceptWord("clock");
        boolean probe = ctx.acceptWord("probe");
        Identifier id = ctx.identifier();
        TypeExpression type = ctx.acceptSymbol(":") ? unit.types().typeExpression() : null;
        ClockExpr when = ctx.acceptWord("when") ? unit.expressions().clock() : null;
        Expression dflt = null;
        if (ctx.acceptWord("default")) {
            ctx.expectSymbol("=");
            dflt = unit.expressions().expression();
        }
        Expression last = null;
        if (ctx.acceptWord("last")) {
            ctx.expectSymbol("=");
            last = unit.expressions().expression();
        }
        return new VarDecl(ctx.span(s), id, clock, probe, type, when, dflt, last);
    }
}
