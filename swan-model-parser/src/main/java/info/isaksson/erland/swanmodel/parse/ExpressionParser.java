package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.Markup;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.Variable;
import info.isaksson.erland.swanmodel.expr.ActivateClockOpExpr;
import info.isaksson.erland.swanmodel.expr.ActivateEveryOpExpr;
import info.isaksson.erland.swanmodel.expr.AnonymousOpWithDataDef;
import info.isaksson.erland.swanmodel.expr.AnonymousOpWithExpression;
import info.isaksson.erland.swanmodel.expr.ArrayGroupExpr;
import info.isaksson.erland.swanmodel.expr.ArrayProjection;
import info.isaksson.erland.swanmodel.expr.BinaryExpr;
import info.isaksson.erland.swanmodel.expr.BinaryOperator;
import info.isaksson.erland.swanmodel.expr.BoolPattern;
import info.isaksson.erland.swanmodel.expr.CaseBranch;
import info.isaksson.erland.swanmodel.expr.CaseExpr;
import info.isaksson.erland.swanmodel.expr.CastExpr;
import info.isaksson.erland.swanmodel.expr.CharPattern;
import info.isaksson.erland.swanmodel.expr.ClockExpr;
import info.isaksson.erland.swanmodel.expr.DefaultPattern;
import info.isaksson.erland.swanmodel.expr.DynamicProjection;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.expr.ForwardDim;
import info.isaksson.erland.swanmodel.expr.ForwardExpr;
import info.isaksson.erland.swanmodel.expr.ForwardReturn;
import info.isaksson.erland.swanmodel.expr.FunctionalUpdate;
import info.isaksson.erland.swanmodel.expr.Group;
import info.isaksson.erland.swanmodel.expr.GroupAdaptation;
import info.isaksson.erland.swanmodel.expr.GroupExpr;
import info.isaksson.erland.swanmodel.expr.GroupItem;
import info.isaksson.erland.swanmodel.expr.GroupProjection;
import info.isaksson.erland.swanmodel.expr.GroupRenaming;
import info.isaksson.erland.swanmodel.expr.IfThenElse;
import info.isaksson.erland.swanmodel.expr.IntPattern;
import info.isaksson.erland.swanmodel.expr.IteratorKind;
import info.isaksson.erland.swanmodel.expr.IteratorOpExpr;
import info.isaksson.erland.swanmodel.expr.LabelOrIndex;
import info.isaksson.erland.swanmodel.expr.LastExpr;
import info.isaksson.erland.swanmodel.expr.LiteralExpr;
import info.isaksson.erland.swanmodel.expr.LiteralKind;
import info.isaksson.erland.swanmodel.expr.MakeArray;
import info.isaksson.erland.swanmodel.expr.MakeStruct;
import info.isaksson.erland.swanmodel.expr.MergeExpr;
import info.isaksson.erland.swanmodel.expr.Modifier;
import info.isaksson.erland.swanmodel.expr.NaryOpExpr;
import info.isaksson.erland.swanmodel.expr.NaryOperator;
import info.isaksson.erland.swanmodel.expr.OperatorCall;
import info.isaksson.erland.swanmodel.expr.OperatorExpression;
import info.isaksson.erland.swanmodel.expr.OperatorExpressionCall;
import info.isaksson.erland.swanmodel.expr.OperatorInstance;
import info.isaksson.erland.swanmodel.expr.PartialArgument;
import info.isaksson.erland.swanmodel.expr.PartialOpExpr;
import info.isaksson.erland.swanmodel.expr.PathIdExpr;
import info.isaksson.erland.swanmodel.expr.PathIdPattern;
import info.isaksson.erland.swanmodel.expr.PathOperatorCall;
import info.isaksson.erland.swanmodel.expr.Pattern;
import info.isaksson.erland.swanmodel.expr.PortExpr;
import info.isaksson.erland.swanmodel.expr.PrimitiveOperator;
import info.isaksson.erland.swanmodel.expr.PrimitiveOperatorCall;
import info.isaksson.erland.swanmodel.expr.ProtectedExpr;
import info.isaksson.erland.swanmodel.expr.ProtectedOpExpr;
import info.isaksson.erland.swanmodel.expr.ProtectedPattern;
import info.isaksson.erland.swanmodel.expr.RestartOpExpr;
import info.isaksson.erland.swanmodel.expr.Slice;
import info.isaksson.erland.swanmodel.expr.StructProjection;
import info.isaksson.erland.swanmodel.expr.UnaryExpr;
import info.isaksson.erland.swanmodel.expr.UnaryOperator;
import info.isaksson.erland.swanmodel.expr.UnderscorePattern;
import info.isaksson.erland.swanmodel.expr.VariantExpr;
import info.isaksson.erland.swanmodel.expr.VariantPattern;
import info.isaksson.erland.swanmodel.expr.WhenClockExpr;
import info.isaksson.erland.swanmodel.expr.WhenMatchExpr;
import info.isaksson.erland.swanmodel.expr.WindowExpr;
import info.isaksson.erland.swanmodel.types.TypeExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Expressions, patterns, clocks, operator calls and operator expressions.
 *
 * <p>Precedence, lowest first: {@code ->} (right associative), {@code when}, {@code or xor},
 * {@code and}, {@code not}, relations, {@code lor lxor}, {@code land}, {@code lsl lsr},
 * {@code + - @}, {@code * / mod}, prefix operators, then postfix projections and {@code ^}.</p>
 */
final class ExpressionParser {

    private static final Set<String> RELATIONS = Set.of("=", "<>", "<", ">", "<=", ">=");

    private final UnitParser unit;
    private final ParseContext ctx;

    ExpressionParser(UnitParser unit) {
        this.unit = unit;
        this.ctx = unit.context();
    }

    Expression expression() throws SwanSyntaxException {
        ctx.enter();
        try {
            return arrowExpression();
        } finally {
            ctx.leave();
        }
    }

    private Expression arrowExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression left = whenExpression();
        if (ctx.acceptSymbol("->")) {
            Expression right = expression();
            return new BinaryExpr(ctx.span(s), BinaryOperator.ARROW, left, right);
        }
        return left;
    }

    private Expression whenExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = orExpression();
        while (ctx.atWord("when")) {
            ctx.next();
            if (ctx.acceptWord("match")) {
                PathIdentifier tag = ctx.path();
                e = new WhenMatchExpr(ctx.span(s), e, tag);
            } else {
                ClockExpr clock = clock();
                e = new WhenClockExpr(ctx.span(s), e, clock);
            }
        }
        return e;
    }

    private Expression orExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = andExpression();
        while (ctx.atWord("or") || ctx.atWord("xor")) {
            BinaryOperator op = binary(ctx.next());
            Expression right = andExpression();
            e = new BinaryExpr(ctx.span(s), op, e, right);
        }
        return e;
    }

    private Expression andExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = notExpression();
        while (ctx.atWord("and")) {
            ctx.next();
            Expression right = notExpression();
            e = new BinaryExpr(ctx.span(s), BinaryOperator.AND, e, right);
        }
        return e;
    }

    private Expression notExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptWord("not")) {
            ctx.enter();
            try {
                Expression operand = notExpression();
                return new UnaryExpr(ctx.span(s), UnaryOperator.NOT, operand);
            } finally {
                ctx.leave();
            }
        }
        return relation();
    }

    private Expression relation() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = logicalOr();
        while (ctx.at(TokenKind.SYMBOL) && RELATIONS.contains(ctx.peek().text())) {
            BinaryOperator op = binary(ctx.next());
            Expression right = logicalOr();
            e = new BinaryExpr(ctx.span(s), op, e, right);
        }
        return e;
    }

    private Expression logicalOr() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = logicalAnd();
        while (ctx.atWord("lor") || ctx.atWord("lxor")) {
            BinaryOperator op = binary(ctx.next());
            Expression right = logicalAnd();
            e = new BinaryExpr(ctx.span(s), op, e, right);
        }
        return e;
    }

    private Expression logicalAnd() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = shift();
        while (ctx.atWord("land")) {
            ctx.next();
            Expression right = shift();
            e = new BinaryExpr(ctx.span(s), BinaryOperator.LAND, e, right);
        }
        return e;
    }

    private Expression shift() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = additive();
        while (ctx.atWord("lsl") || ctx.atWord("lsr")) {
            BinaryOperator op = binary(ctx.next());
            Expression right = additive();
            e = new BinaryExpr(ctx.span(s), op, e, right);
        }
        return e;
    }

    private Expression additive() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = multiplicative();
        while (ctx.atSymbol("+") || ctx.atSymbol("-") || ctx.atSymbol("@")) {
            BinaryOperator op = binary(ctx.next());
            Expression right = multiplicative();
            e = new BinaryExpr(ctx.span(s), op, e, right);
        }
        return e;
    }

    private Expression multiplicative() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = unary();
        while (ctx.atSymbol("*") || ctx.atSymbol("/") || ctx.atWord("mod")) {
            BinaryOperator op = binary(ctx.next());
            Expression right = unary();
            e = new BinaryExpr(ctx.span(s), op, e, right);
        }
        return e;
    }

    private Expression unary() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        boolean prefix = t.isSymbol("-") || t.isSymbol("+") || t.isWord("lnot") || t.isWord("pre");
        if (prefix) {
            UnaryOperator op = UnaryOperator.fromSymbol(ctx.next().text()).orElseThrow();
            ctx.enter();
            try {
                Expression operand = unary();
                return new UnaryExpr(ctx.span(s), op, operand);
            } finally {
                ctx.leave();
            }
        }
        return postfix(true);
    }

    private static BinaryOperator binary(Token t) throws SwanSyntaxException {
        return BinaryOperator.fromSymbol(t.text())
                .orElseThrow(() -> new SwanSyntaxException("not a binary operator: " + t, t.start()));
    }

    private Expression postfix(boolean allowCaret) throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression e = primary();
        while (true) {
            if (ctx.atSymbol(".") && ctx.peek(1).is(TokenKind.IDENT)) {
                ctx.next();
                Identifier label = ctx.identifier();
                e = new StructProjection(ctx.span(s), e, label);
            } else if (ctx.atSymbol(".") && ctx.peek(1).isSymbol("(")) {
                int as = ctx.next().start();
                GroupAdaptation adaptation = adaptation(as);
                e = new GroupProjection(ctx.span(s), e, adaptation);
            } else if (ctx.atSymbol("[")) {
                ctx.next();
                Expression index = expression();
                if (ctx.acceptSymbol("..")) {
                    Expression to = expression();
                    ctx.expectSymbol("]");
                    e = new Slice(ctx.span(s), e, index, to);
                } else {
                    ctx.expectSymbol("]");
                    e = new ArrayProjection(ctx.span(s), e, index);
                }
            } else if (allowCaret && ctx.atSymbol("^")) {
                ctx.next();
                Expression size = postfix(false);
                e = new MakeArray(ctx.span(s), e, size);
            } else {
                return e;
            }
        }
    }

    /** Size of an array type or constructor: a postfix expression without {@code ^}. */
    Expression size() throws SwanSyntaxException {
        return postfix(false);
    }

    /** {@code .( renamings )}, positioned at the opening parenthesis. */
    GroupAdaptation adaptation(int start) throws SwanSyntaxException {
        ctx.expectSymbol("(");
        List<GroupRenaming> renamings = new ArrayList<>();
        if (!ctx.atSymbol(")")) {
            do {
                renamings.add(renaming());
            } while (ctx.acceptSymbol(","));
        }
        ctx.expectSymbol(")");
        return new GroupAdaptation(ctx.span(start), renamings);
    }

    private GroupRenaming renaming() throws SwanSyntaxException {
        int s = ctx.peek().start();
        boolean index = ctx.at(TokenKind.INTEGER);
        String source = index ? ctx.next().text() : ctx.identifier().value();
        Identifier renaming = null;
        boolean shortcut = false;
        if (ctx.acceptSymbol(":")) {
            if (ctx.atIdentifier()) renaming = ctx.identifier();
            else shortcut = true;
        }
        return new GroupRenaming(ctx.span(s), source, index, renaming, shortcut);
    }

    private Expression primary() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        switch (t.kind()) {
            case INTEGER:
                ctx.next();
                return new LiteralExpr(ctx.span(s), LiteralKind.INTEGER, t.text());
            case FLOAT:
                ctx.next();
                return new LiteralExpr(ctx.span(s), LiteralKind.FLOAT, t.text());
            case CHAR:
                ctx.next();
                return new LiteralExpr(ctx.span(s), LiteralKind.CHAR, t.text());
            case LUID:
                ctx.next();
                return PortExpr.of(ctx.span(s), Luid.of(t.text()));
            case MARKUP:
                ctx.next();
                return new ProtectedExpr(ctx.span(s), ctx.markup(t));
            case SYMBOL:
                return symbolPrimary(s);
            case IDENT:
            case PRAGMA:
                return wordPrimary(s);
            default:
                throw ctx.error("expected an expression");
        }
    }

    private Expression symbolPrimary(int s) throws SwanSyntaxException {
        if (ctx.acceptSymbol("[")) {
            Group g = group("]");
            ctx.expectSymbol("]");
            return new ArrayGroupExpr(ctx.span(s), g);
        }
        if (ctx.acceptSymbol("{")) {
            Group g = group("}");
            ctx.expectSymbol("}");
            PathIdentifier type = null;
            if (ctx.atSymbol(":") && ctx.peek(1).is(TokenKind.IDENT)) {
                ctx.next();
                type = ctx.path();
            }
            return new MakeStruct(ctx.span(s), g, type);
        }
        if (ctx.atSymbol("(")) return parenthesized(s);
        throw ctx.error("expected an expression");
    }

    private Expression wordPrimary(int s) throws SwanSyntaxException {
        Token t = ctx.peek();
        if (t.is(TokenKind.IDENT)) {
            switch (t.text()) {
                case "true":
                case "false":
                    ctx.next();
                    return new LiteralExpr(ctx.span(s), LiteralKind.BOOL, t.text());
                case "self":
                    ctx.next();
                    return PortExpr.self(ctx.span(s));
                case "last": {
                    ctx.next();
                    Token name = ctx.expect(TokenKind.NAME);
                    return new LastExpr(ctx.span(s), Identifier.of(name.text()));
                }
                case "if": {
                    ctx.next();
                    Expression c = expression();
                    ctx.expectWord("then");
                    Expression a = expression();
                    ctx.expectWord("else");
                    Expression b = expression();
                    return new IfThenElse(ctx.span(s), c, a, b);
                }
                case "window":
                    return window(s);
                case "merge":
                    return merge(s);
                case "forward":
                    return forward(s);
                default:
                    break;
            }
            Optional<PrimitiveOperator> primitive = PrimitiveOperator.fromKeyword(t.text());
            if (primitive.isPresent()) {
                ctx.next();
                List<Expression> sizes = sizes();
                OperatorCall call = new PrimitiveOperatorCall(ctx.span(s), primitive.get(), sizes);
                return instance(s, call);
            }
        }
        PathIdentifier path = ctx.path();
        if (ctx.atSymbol("{")) {
            ctx.next();
            Group g = group("}");
            ctx.expectSymbol("}");
            return new VariantExpr(ctx.span(s), path, g);
        }
        if (ctx.atSymbol("<<") || ctx.at(TokenKind.LUID) || ctx.atSymbol("(")) {
            List<Expression> sizes = sizes();
            return instance(s, new PathOperatorCall(ctx.span(s), path, sizes));
        }
        return new PathIdExpr(ctx.span(s), path);
    }

    /** {@code [#luid] (arguments)} after an operator call. */
    private OperatorInstance instance(int s, OperatorCall call) throws SwanSyntaxException {
        Luid luid = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
        ctx.expectSymbol("(");
        Group args = group(")");
        ctx.expectSymbol(")");
        return new OperatorInstance(ctx.span(s), call, luid, args);
    }

    /** {@code <<e, ...>>}, or nothing. */
    List<Expression> sizes() throws SwanSyntaxException {
        List<Expression> sizes = new ArrayList<>();
        if (ctx.acceptSymbol("<<")) {
            do {
                sizes.add(expression());
            } while (ctx.acceptSymbol(","));
            ctx.expectSymbol(">>");
        }
        return sizes;
    }

    /** Items up to, not including, {@code closer}. */
    Group group(String closer) throws SwanSyntaxException {
        int s = ctx.peek().start();
        List<GroupItem> items = new ArrayList<>();
        if (!ctx.atSymbol(closer)) {
            do {
                items.add(groupItem());
            } while (ctx.acceptSymbol(","));
        }
        return new Group(ctx.span(s), items);
    }

    private GroupItem groupItem() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Identifier label = null;
        if (ctx.atIdentifier() && ctx.peek(1).isSymbol(":")) {
            label = ctx.identifier();
            ctx.next();
        }
        Expression e = expression();
        return new GroupItem(ctx.span(s), label, e);
    }

    private Expression parenthesized(int s) throws SwanSyntaxException {
        ctx.expectSymbol("(");
        if (atOperatorExpression()) {
            OperatorExpression opExpr = operatorExpression();
            ctx.expectSymbol(")");
            List<Expression> sizes = sizes();
            OperatorCall call = new OperatorExpressionCall(ctx.span(s), opExpr, sizes);
            return instance(s, call);
        }
        if (ctx.acceptWord("case")) {
            Expression e = expression();
            ctx.expectWord("of");
            List<CaseBranch> branches = new ArrayList<>();
            while (ctx.atSymbol("|")) {
                int bs = ctx.next().start();
                Pattern p = pattern();
                ctx.expectSymbol(":");
                Expression value = expression();
                branches.add(new CaseBranch(ctx.span(bs), p, value));
            }
            ctx.expectSymbol(")");
            return new CaseExpr(ctx.span(s), e, branches);
        }
        if (ctx.atSymbol(")") || ctx.atIdentifier() && ctx.peek(1).isSymbol(":")) {
            Group g = group(")");
            ctx.expectSymbol(")");
            return new GroupExpr(ctx.span(s), g);
        }
        int itemStart = ctx.peek().start();
        Expression first = expression();
        if (ctx.acceptSymbol(":>")) {
            TypeExpression type = unit.types().typeExpression();
            ctx.expectSymbol(")");
            return new CastExpr(ctx.span(s), first, type);
        }
        if (ctx.acceptWord("with")) {
            List<Modifier> modifiers = new ArrayList<>();
            do {
                modifiers.add(modifier());
            } while (ctx.acceptSymbol(";"));
            ctx.expectSymbol(")");
            return new FunctionalUpdate(ctx.span(s), first, modifiers);
        }
        if (ctx.acceptSymbol(".")) {
            List<LabelOrIndex> steps = new ArrayList<>();
            do {
                steps.add(labelOrIndex());
            } while (ctx.atSymbol(".") || ctx.atSymbol("["));
            ctx.expectWord("default");
            Expression dflt = expression();
            ctx.expectSymbol(")");
            return new DynamicProjection(ctx.span(s), first, steps, dflt);
        }
        List<GroupItem> items = new ArrayList<>();
        items.add(new GroupItem(ctx.span(itemStart), null, first));
        while (ctx.acceptSymbol(",")) items.add(groupItem());
        Group g = new Group(ctx.span(itemStart), items);
        ctx.expectSymbol(")");
        return new GroupExpr(ctx.span(s), g);
    }

    private Modifier modifier() throws SwanSyntaxException {
        int s = ctx.peek().start();
        List<LabelOrIndex> path = new ArrayList<>();
        do {
            path.add(labelOrIndex());
        } while (ctx.atSymbol(".") || ctx.atSymbol("["));
        ctx.expectSymbol("=");
        Expression value = expression();
        return new Modifier(ctx.span(s), path, value);
    }

    private LabelOrIndex labelOrIndex() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptSymbol(".")) {
            Identifier label = ctx.identifier();
            return LabelOrIndex.label(ctx.span(s), label);
        }
        ctx.expectSymbol("[");
        Expression index = expression();
        ctx.expectSymbol("]");
        return LabelOrIndex.index(ctx.span(s), index);
    }

    private Expression window(int s) throws SwanSyntaxException {
        ctx.expectWord("window");
        ctx.expectSymbol("<<");
        Expression size = expression();
        ctx.expectSymbol(">>");
        ctx.expectSymbol("(");
        Group init = group(")");
        ctx.expectSymbol(")");
        ctx.expectSymbol("(");
        Group params = group(")");
        ctx.expectSymbol(")");
        return new WindowExpr(ctx.span(s), size, init, params);
    }

    private Expression merge(int s) throws SwanSyntaxException {
        ctx.expectWord("merge");
        List<Group> groups = new ArrayList<>();
        while (ctx.acceptSymbol("(")) {
            groups.add(group(")"));
            ctx.expectSymbol(")");
        }
        if (groups.isEmpty()) throw ctx.error("merge needs at least one group");
        return new MergeExpr(ctx.span(s), groups);
    }

    private Expression forward(int s) throws SwanSyntaxException {
        ctx.expectWord("forward");
        Luid luid = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
        ForwardExpr.State state = ForwardExpr.State.NONE;
        if (ctx.acceptWord("restart")) state = ForwardExpr.State.RESTART;
        else if (ctx.acceptWord("resume")) state = ForwardExpr.State.RESUME;
        List<ForwardDim> dims = new ArrayList<>();
        while (ctx.atSymbol("<<")) {
            int ds = ctx.next().start();
            Expression size = expression();
            ctx.expectSymbol(">>");
            Identifier index = null;
            if (ctx.acceptWord("with")) {
                ctx.expectSymbol("<<");
                index = ctx.identifier();
                ctx.expectSymbol(">>");
            }
            dims.add(new ForwardDim(ctx.span(ds), size, index));
        }
        Expression unless = ctx.acceptWord("unless") ? expression() : null;
        List<ScopeSection> sections = unit.scopes().sectionsWhile(
                () -> !ctx.atWord("until") && !ctx.atWord("returns"));
        Expression until = ctx.acceptWord("until") ? expression() : null;
        ctx.expectWord("returns");
        ctx.expectSymbol("(");
        List<ForwardReturn> returns = new ArrayList<>();
        if (!ctx.atSymbol(")")) {
            do {
                returns.add(forwardReturn());
            } while (ctx.acceptSymbol(","));
        }
        ctx.expectSymbol(")");
        return new ForwardExpr(ctx.span(s), luid, state, dims, unless, sections, until, returns);
    }

    private ForwardReturn forwardReturn() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptSymbol("[")) {
            ForwardReturn element = forwardReturn();
            ctx.expectSymbol("]");
            return ForwardReturn.array(ctx.span(s), element);
        }
        Identifier id = ctx.identifier();
        Expression last = null;
        Expression dflt = null;
        if (ctx.acceptSymbol(":")) {
            if (ctx.acceptWord("last")) {
                ctx.expectSymbol("=");
                last = expression();
            }
            if (ctx.acceptWord("default")) {
                ctx.expectSymbol("=");
                dflt = expression();
            }
        }
        return ForwardReturn.item(ctx.span(s), id, last, dflt);
    }

    // operator calls and operator expressions

    /**
     * After an opening parenthesis: does an operator expression follow? Iterators,
     * activations, restarts, anonymous operators, n-ary operators, partial applications and
     * {@code {op_expr%...%op_expr}} markups are operator expressions.
     */
    private boolean atOperatorExpression() {
        Token t = ctx.peek();
        if (t.is(TokenKind.MARKUP)) return ctx.atMarkup(Markup.OP_EXPR);
        if (IteratorKind.fromKeyword(t.text()).isPresent() && t.is(TokenKind.IDENT)) return true;
        if (t.isWord("activate") || t.isWord("restart") || t.isWord("node") || t.isWord("function")) return true;
        if ((t.is(TokenKind.SYMBOL) || t.is(TokenKind.IDENT)) && NaryOperator.fromSymbol(t.text()).isPresent()
                && ctx.peek(1).isSymbol(")")) {
            return true;
        }
        return atPartialApplication();
    }

    private boolean atPartialApplication() {
        int i = 0;
        while (ctx.peek(i).is(TokenKind.PRAGMA)) i++;
        if (!ctx.peek(i).is(TokenKind.IDENT)) return false;
        i++;
        while (ctx.peek(i).isSymbol("::") && ctx.peek(i + 1).is(TokenKind.IDENT)) i += 2;
        if (ctx.peek(i).isSymbol("<<")) {
            int depth = 0;
            while (!ctx.peek(i).is(TokenKind.EOF)) {
                Token t = ctx.peek(i++);
                if (t.isSymbol("<<")) depth++;
                else if (t.isSymbol(">>") && --depth == 0) break;
            }
        }
        return ctx.peek(i).isSymbol("\\");
    }

    OperatorExpression operatorExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        if (t.is(TokenKind.MARKUP)) {
            ctx.next();
            return new ProtectedOpExpr(ctx.span(s), ctx.markup(t));
        }
        Optional<IteratorKind> iterator = t.is(TokenKind.IDENT) ? IteratorKind.fromKeyword(t.text()) : Optional.empty();
        if (iterator.isPresent()) {
            ctx.next();
            OperatorCall op = operatorCall();
            return new IteratorOpExpr(ctx.span(s), iterator.get(), op);
        }
        if (ctx.acceptWord("activate")) {
            OperatorCall op = operatorCall();
            ctx.expectWord("every");
            if (atClockOnly()) {
                ClockExpr clock = clock();
                return new ActivateClockOpExpr(ctx.span(s), op, clock);
            }
            Expression condition = expression();
            boolean last;
            if (ctx.acceptWord("last")) last = true;
            else if (ctx.acceptWord("default")) last = false;
            else throw ctx.error("expected 'last' or 'default'");
            Expression initial = expression();
            return new ActivateEveryOpExpr(ctx.span(s), op, condition, last, initial);
        }
        if (ctx.acceptWord("restart")) {
            OperatorCall op = operatorCall();
            ctx.expectWord("every");
            Expression condition = expression();
            return new RestartOpExpr(ctx.span(s), op, condition);
        }
        if (ctx.atWord("node") || ctx.atWord("function")) return anonymousOperator(s);
        Optional<NaryOperator> nary = NaryOperator.fromSymbol(t.text());
        if (nary.isPresent() && ctx.peek(1).isSymbol(")")) {
            ctx.next();
            return new NaryOpExpr(ctx.span(s), nary.get());
        }
        OperatorCall op = operatorCall();
        ctx.expectSymbol("\\");
        List<PartialArgument> args = new ArrayList<>();
        do {
            int as = ctx.peek().start();
            if (ctx.atWord("_")) {
                ctx.next();
                args.add(new PartialArgument(ctx.span(as), null));
            } else {
                Expression e = expression();
                args.add(new PartialArgument(ctx.span(as), e));
            }
        } while (ctx.acceptSymbol(","));
        return new PartialOpExpr(ctx.span(s), op, args);
    }

    /** A clock closing the operator expression: {@code c)}, {@code not c)} or {@code (c match p))}. */
    private boolean atClockOnly() {
        if (ctx.atWord("not")) return ctx.peek(1).is(TokenKind.IDENT) && ctx.peek(2).isSymbol(")");
        if (ctx.atSymbol("(")) return ctx.peek(1).is(TokenKind.IDENT) && ctx.peek(2).isWord("match");
        return ctx.atIdentifier() && ctx.peek(1).isSymbol(")");
    }

    private OperatorExpression anonymousOperator(int s) throws SwanSyntaxException {
        boolean node = ctx.next().isWord("node");
        if (ctx.atSymbol("(")) {
            List<Variable> inputs = unit.declarations().variables();
            ctx.expectWord("returns");
            List<Variable> outputs = unit.declarations().variables();
            if (ctx.atSymbol("{")) {
                Scope body = unit.scopes().scope();
                return new AnonymousOpWithDataDef(ctx.span(s), node, inputs, outputs, body);
            }
            Equation body = unit.scopes().equation();
            return new AnonymousOpWithDataDef(ctx.span(s), node, inputs, outputs, body);
        }
        List<Identifier> params = new ArrayList<>();
        if (!ctx.atSymbol("=>")) {
            do {
                params.add(ctx.identifier());
            } while (ctx.acceptSymbol(","));
        }
        List<ScopeSection> sections = unit.scopes().sectionsWhile(() -> !ctx.atSymbol("=>"));
        ctx.expectSymbol("=>");
        Expression e = expression();
        return new AnonymousOpWithExpression(ctx.span(s), node, params, sections, e);
    }

    /** {@code Path [<<sizes>>]}, {@code prim [<<sizes>>]} or {@code (opexpr) [<<sizes>>]}. */
    OperatorCall operatorCall() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptSymbol("(")) {
            OperatorExpression opExpr = operatorExpression();
            ctx.expectSymbol(")");
            List<Expression> sizes = sizes();
            return new OperatorExpressionCall(ctx.span(s), opExpr, sizes);
        }
        Token t = ctx.peek();
        Optional<PrimitiveOperator> primitive = t.is(TokenKind.IDENT)
                ? PrimitiveOperator.fromKeyword(t.text()) : Optional.empty();
        if (primitive.isPresent()) {
            ctx.next();
            List<Expression> sizes = sizes();
            return new PrimitiveOperatorCall(ctx.span(s), primitive.get(), sizes);
        }
        PathIdentifier path = ctx.path();
        List<Expression> sizes = sizes();
        return new PathOperatorCall(ctx.span(s), path, sizes);
    }

    // clocks and patterns

    ClockExpr clock() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptWord("not")) {
            Identifier id = ctx.identifier();
            return ClockExpr.not(ctx.span(s), id);
        }
        if (ctx.acceptSymbol("(")) {
            Identifier id = ctx.identifier();
            ctx.expectWord("match");
            Pattern p = pattern();
            ctx.expectSymbol(")");
            return ClockExpr.match(ctx.span(s), id, p);
        }
        Identifier id = ctx.identifier();
        return ClockExpr.id(ctx.span(s), id);
    }

    Pattern pattern() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        if (t.is(TokenKind.MARKUP)) {
            ctx.next();
            return new ProtectedPattern(ctx.span(s), ctx.markup(t));
        }
        if (t.is(TokenKind.CHAR)) {
            ctx.next();
            return new CharPattern(ctx.span(s), t.text());
        }
        if (t.is(TokenKind.INTEGER)) {
            ctx.next();
            return new IntPattern(ctx.span(s), t.text(), false);
        }
        if (t.isSymbol("-") && ctx.peek(1).is(TokenKind.INTEGER)) {
            ctx.next();
            Token n = ctx.next();
            return new IntPattern(ctx.span(s), n.text(), true);
        }
        if (t.isWord("true") || t.isWord("false")) {
            ctx.next();
            return new BoolPattern(ctx.span(s), t.text().equals("true"));
        }
        if (t.isWord("_")) {
            ctx.next();
            return new UnderscorePattern(ctx.span(s));
        }
        if (t.isWord("default")) {
            ctx.next();
            return new DefaultPattern(ctx.span(s));
        }
        PathIdentifier path = ctx.path();
        if (ctx.atWord("_")) {
            ctx.next();
            return new VariantPattern(ctx.span(s), path, VariantPattern.Form.UNDERSCORE, null);
        }
        if (ctx.acceptSymbol("{")) {
            if (ctx.acceptSymbol("}")) {
                return new VariantPattern(ctx.span(s), path, VariantPattern.Form.EMPTY, null);
            }
            Identifier captured = ctx.identifier();
            ctx.expectSymbol("}");
            return new VariantPattern(ctx.span(s), path, VariantPattern.Form.CAPTURE, captured);
        }
        return new PathIdPattern(ctx.span(s), path);
    }
}
