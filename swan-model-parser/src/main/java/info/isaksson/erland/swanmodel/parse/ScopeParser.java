package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.AssumeSection;
import info.isaksson.erland.swanmodel.ast.EmissionBody;
import info.isaksson.erland.swanmodel.ast.EmitSection;
import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.EquationLhs;
import info.isaksson.erland.swanmodel.ast.ExprEquation;
import info.isaksson.erland.swanmodel.ast.FormalProperty;
import info.isaksson.erland.swanmodel.ast.GuaranteeSection;
import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.LetSection;
import info.isaksson.erland.swanmodel.ast.LhsItem;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.Markup;
import info.isaksson.erland.swanmodel.ast.ProtectedEquation;
import info.isaksson.erland.swanmodel.ast.ProtectedSection;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.ast.SwanModelException;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.VarSection;
import info.isaksson.erland.swanmodel.ast.Variable;
import info.isaksson.erland.swanmodel.automaton.ActivateIf;
import info.isaksson.erland.swanmodel.automaton.ActivateWhen;
import info.isaksson.erland.swanmodel.automaton.ActivateWhenBranch;
import info.isaksson.erland.swanmodel.automaton.Arrow;
import info.isaksson.erland.swanmodel.automaton.ForkPriorityList;
import info.isaksson.erland.swanmodel.automaton.ForkTree;
import info.isaksson.erland.swanmodel.automaton.ForkWithPriority;
import info.isaksson.erland.swanmodel.automaton.Identification;
import info.isaksson.erland.swanmodel.automaton.IfActivation;
import info.isaksson.erland.swanmodel.automaton.IfActivationBranch;
import info.isaksson.erland.swanmodel.automaton.IfteBranch;
import info.isaksson.erland.swanmodel.automaton.IfteDataDef;
import info.isaksson.erland.swanmodel.automaton.IfteIfActivation;
import info.isaksson.erland.swanmodel.automaton.State;
import info.isaksson.erland.swanmodel.automaton.StateMachine;
import info.isaksson.erland.swanmodel.automaton.StateMachineItem;
import info.isaksson.erland.swanmodel.automaton.Target;
import info.isaksson.erland.swanmodel.automaton.Transition;
import info.isaksson.erland.swanmodel.automaton.TransitionDecl;
import info.isaksson.erland.swanmodel.automaton.TransitionKind;
import info.isaksson.erland.swanmodel.diagram.Bar;
import info.isaksson.erland.swanmodel.diagram.Block;
import info.isaksson.erland.swanmodel.diagram.Connection;
import info.isaksson.erland.swanmodel.diagram.DefBlock;
import info.isaksson.erland.swanmodel.diagram.Diagram;
import info.isaksson.erland.swanmodel.diagram.ExprBlock;
import info.isaksson.erland.swanmodel.diagram.GroupOperation;
import info.isaksson.erland.swanmodel.diagram.ProtectedDiagramObject;
import info.isaksson.erland.swanmodel.diagram.SectionBlock;
import info.isaksson.erland.swanmodel.diagram.Wire;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.expr.GroupAdaptation;
import info.isaksson.erland.swanmodel.expr.OperatorCall;
import info.isaksson.erland.swanmodel.expr.Pattern;
import info.isaksson.erland.swanmodel.expr.PortExpr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Scopes and what they contain: sections, equations, state machines, activations and
 * diagrams. An equation, section or diagram object that cannot be structured becomes a
 * protected node and parsing goes on after it.
 */
final class ScopeParser {

    private static final Logger logger = LogManager.getLogger();

    /** Words that end a run of equations. */
    private static final Set<String> EQUATION_STOP_WORDS = Set.of(
            "var", "let", "emit", "assume", "guarantee", "diagram", "until", "unless", "state",
            "initial", "returns", "else", "elsif", "end", "where");

    private static final Set<String> EQUATION_STOP_SYMBOLS = Set.of("}", ")", ";", ":", "::", "=>", "|");

    /** Words after which a broken section is not skipped. */
    private static final Set<String> SECTION_STOP_WORDS = Set.of(
            "var", "let", "emit", "assume", "guarantee", "diagram", "until", "unless", "state",
            "initial", "returns");

    private final UnitParser unit;
    private final ParseContext ctx;

    ScopeParser(UnitParser unit) {
        this.unit = unit;
        this.ctx = unit.context();
    }

    Scope scope() throws SwanSyntaxException {
        int s = ctx.expectSymbol("{").start();
        ctx.enter();
        try {
            List<ScopeSection> sections = sectionsWhile(() -> !ctx.atSymbol("}"));
            ctx.expectSymbol("}");
            return new Scope(ctx.span(s), sections);
        } finally {
            ctx.leave();
        }
    }

    /** Sections as long as {@code more} holds and a section starts. */
    List<ScopeSection> sectionsWhile(BooleanSupplier more) {
        List<ScopeSection> sections = new ArrayList<>();
        while (more.getAsBoolean() && atSection()) sections.add(recoveringSection());
        return sections;
    }

    boolean atSection() {
        Token t = ctx.peek();
        return t.is(TokenKind.MARKUP) || t.is(TokenKind.IDENT) && SwanKeywords.SECTIONS.contains(t.text());
    }

    private ScopeSection recoveringSection() {
        int mark = ctx.mark();
        int s = ctx.peek().start();
        try {
            return section();
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            ctx.reset(mark);
            ctx.next();
            ctx.skipBalanced(t -> t.is(TokenKind.IDENT) && SECTION_STOP_WORDS.contains(t.text()));
            logger.debug("Protected section at {}: {}", ctx.span(s), e.getMessage());
            return new ProtectedSection(ctx.span(s), ProtectedText.fallback(ctx.raw(s, ctx.lastEnd())));
        }
    }

    ScopeSection section() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.next();
        if (t.is(TokenKind.MARKUP)) {
            return new ProtectedSection(ctx.span(s), ctx.markup(t));
        }
        switch (t.text()) {
            case "var": {
                List<Variable> vars = new ArrayList<>();
                while (unit.declarations().atVariable()) {
                    vars.add(unit.declarations().variable());
                    ctx.expectSymbol(";");
                }
                return new VarSection(ctx.span(s), vars);
            }
            case "let": {
                List<Equation> equations = new ArrayList<>();
                while (!atEquationStop()) equations.add(recoveringEquation());
                return new LetSection(ctx.span(s), equations);
            }
            case "emit": {
                List<EmissionBody> emissions = new ArrayList<>();
                while (ctx.at(TokenKind.LUID) || ctx.atIdentifier()) {
                    emissions.add(emission());
                    ctx.expectSymbol(";");
                }
                return new EmitSection(ctx.span(s), emissions);
            }
            case "assume":
                return new AssumeSection(ctx.span(s), properties());
            case "guarantee":
                return new GuaranteeSection(ctx.span(s), properties());
            case "diagram": {
                List<SwanNode> items = new ArrayList<>();
                while (ctx.atSymbol("(") || ctx.at(TokenKind.MARKUP)) items.add(diagramItem());
                return new Diagram(ctx.span(s), items);
            }
            default:
                throw new SwanSyntaxException("not a section: " + t, t.start());
        }
    }

    private EmissionBody emission() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Luid luid = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
        List<Identifier> flows = new ArrayList<>();
        do {
            flows.add(ctx.identifier());
        } while (ctx.acceptSymbol(","));
        Expression condition = ctx.acceptWord("if") ? unit.expressions().expression() : null;
        return new EmissionBody(ctx.span(s), luid, flows, condition);
    }

    private List<FormalProperty> properties() throws SwanSyntaxException {
        List<FormalProperty> properties = new ArrayList<>();
        while (ctx.at(TokenKind.LUID)) {
            int s = ctx.peek().start();
            Luid luid = ctx.luid();
            ctx.expectSymbol(":");
            Expression e = unit.expressions().expression();
            properties.add(new FormalProperty(ctx.span(s), luid, e));
            ctx.expectSymbol(";");
        }
        return properties;
    }

    // equations

    private boolean atEquationStop() {
        Token t = ctx.peek();
        if (t.is(TokenKind.EOF)) return true;
        if (t.is(TokenKind.SYMBOL)) return EQUATION_STOP_SYMBOLS.contains(t.text());
        return t.is(TokenKind.IDENT) && EQUATION_STOP_WORDS.contains(t.text());
    }

    /** An equation, or the protected text of one that cannot be structured. */
    Equation recoveringEquation() {
        int mark = ctx.mark();
        int s = ctx.peek().start();
        try {
            return equation();
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            ctx.reset(mark);
            ctx.skipBalanced(t -> t.isSymbol(";")
                    || t.is(TokenKind.IDENT) && SwanKeywords.SECTIONS.contains(t.text()));
            ctx.acceptSymbol(";");
            if (ctx.mark() == mark) ctx.next();
            logger.debug("Protected equation at {}: {}", ctx.span(s), e.getMessage());
            return new ProtectedEquation(ctx.span(s), ProtectedText.fallback(ctx.raw(s, ctx.lastEnd())));
        }
    }

    Equation equation() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        if (t.is(TokenKind.MARKUP)) {
            ctx.next();
            return new ProtectedEquation(ctx.span(s), ctx.markupWithTerminator(t));
        }
        if (t.isWord("automaton") || t.isWord("activate")) return defByCase(s, null);
        EquationLhs lhs = lhs();
        if (ctx.acceptSymbol("=")) {
            Expression e = unit.expressions().expression();
            ctx.expectSymbol(";");
            return new ExprEquation(ctx.span(s), lhs, e);
        }
        ctx.expectSymbol(":");
        return defByCase(s, lhs);
    }

    /** {@code ()}, or identifiers and {@code _} with an optional trailing {@code , ..}. */
    EquationLhs lhs() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.atSymbol("(") && ctx.peek(1).isSymbol(")")) {
            ctx.next();
            ctx.next();
            return new EquationLhs(ctx.span(s), List.of(), false);
        }
        List<LhsItem> items = new ArrayList<>();
        boolean partial = false;
        do {
            if (ctx.acceptSymbol("..")) {
                partial = true;
                break;
            }
            int is = ctx.peek().start();
            if (ctx.acceptWord("_")) {
                items.add(LhsItem.underscore(ctx.span(is)));
            } else {
                Identifier id = ctx.identifier();
                items.add(new LhsItem(ctx.span(is), id));
            }
        } while (ctx.acceptSymbol(","));
        return new EquationLhs(ctx.span(s), items, partial);
    }

    private Equation defByCase(int s, EquationLhs lhs) throws SwanSyntaxException {
        if (ctx.acceptWord("automaton")) {
            Luid name = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
            List<StateMachineItem> items = new ArrayList<>();
            while (!ctx.atSymbol(";")) items.add(stateMachineItem());
            ctx.expectSymbol(";");
            try {
                return new StateMachine(ctx.span(s), lhs, name, items);
            } catch (StructuralInvariantException e) {
                logger.warn("Protected state machine at {}: {}", ctx.span(s), e.getMessage());
                return new ProtectedEquation(ctx.span(s), ProtectedText.fallback(ctx.raw(s, ctx.lastEnd())));
            }
        }
        ctx.expectWord("activate");
        Luid name = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
        if (ctx.atWord("if")) {
            IfActivation activation = ifActivation();
            ctx.expectSymbol(";");
            return new ActivateIf(ctx.span(s), lhs, name, activation);
        }
        ctx.expectWord("when");
        Expression condition = unit.expressions().expression();
        ctx.expectWord("match");
        List<ActivateWhenBranch> branches = new ArrayList<>();
        while (ctx.atSymbol("|")) {
            int bs = ctx.next().start();
            Pattern pattern = unit.expressions().pattern();
            ctx.expectSymbol(":");
            if (ctx.atSymbol("{")) {
                Scope scope = scope();
                branches.add(new ActivateWhenBranch(ctx.span(bs), pattern, scope));
            } else {
                Equation equation = equation();
                branches.add(new ActivateWhenBranch(ctx.span(bs), pattern, equation));
            }
        }
        if (branches.isEmpty()) throw ctx.error("expected '|' starting a match branch");
        ctx.expectSymbol(";");
        return new ActivateWhen(ctx.span(s), lhs, name, condition, branches);
    }

    private IfActivation ifActivation() throws SwanSyntaxException {
        int s = ctx.peek().start();
        List<IfActivationBranch> branches = new ArrayList<>();
        ctx.expectWord("if");
        branches.add(ifActivationBranch(true));
        while (ctx.acceptWord("elsif")) branches.add(ifActivationBranch(true));
        ctx.expectWord("else");
        branches.add(ifActivationBranch(false));
        return new IfActivation(ctx.span(s), branches);
    }

    private IfActivationBranch ifActivationBranch(boolean conditional) throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression condition = null;
        if (conditional) {
            condition = unit.expressions().expression();
            ctx.expectWord("then");
        }
        int bs = ctx.peek().start();
        IfteBranch branch;
        if (ctx.atWord("if")) {
            IfActivation nested = ifActivation();
            branch = new IfteIfActivation(ctx.span(bs), nested);
        } else if (ctx.atSymbol("{")) {
            Scope scope = scope();
            branch = new IfteDataDef(ctx.span(bs), scope);
        } else {
            Equation equation = equation();
            branch = new IfteDataDef(ctx.span(bs), equation);
        }
        return new IfActivationBranch(ctx.span(s), condition, branch);
    }

    // state machines

    private StateMachineItem stateMachineItem() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.atSymbol(":") || ctx.atSymbol("::")) {
            Integer priority = priority();
            Identification source = identification();
            TransitionKind kind;
            if (ctx.acceptWord("unless")) kind = TransitionKind.STRONG;
            else if (ctx.acceptWord("until")) kind = TransitionKind.WEAK;
            else throw ctx.error("expected 'unless' or 'until'");
            Transition transition = transition();
            return new TransitionDecl(ctx.span(s), priority, source, kind, transition);
        }
        boolean initial = ctx.acceptWord("initial");
        ctx.expectWord("state");
        Identification id = identification();
        ctx.expectSymbol(":");
        List<Transition> strong = ctx.acceptWord("unless") ? transitions() : List.of();
        List<ScopeSection> sections = sectionsWhile(() -> true);
        List<Transition> weak = ctx.acceptWord("until") ? transitions() : List.of();
        return new State(ctx.span(s), id, strong, sections, weak, initial);
    }

    /** {@code :n:} or {@code ::}; the empty form lexes as a single symbol. */
    private Integer priority() throws SwanSyntaxException {
        if (ctx.acceptSymbol("::")) return null;
        ctx.expectSymbol(":");
        Integer priority = ctx.at(TokenKind.INTEGER) ? Integer.valueOf(ctx.next().text()) : null;
        ctx.expectSymbol(":");
        return priority;
    }

    private Identification identification() throws SwanSyntaxException {
        Luid luid = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
        Identifier id = ctx.atIdentifier() ? ctx.identifier() : null;
        if (luid == null && id == null) return Identification.UNDEFINED;
        return new Identification(luid, id);
    }

    private List<Transition> transitions() throws SwanSyntaxException {
        List<Transition> transitions = new ArrayList<>();
        while (ctx.atWord("if") || ctx.atWord("restart") || ctx.atWord("resume") || ctx.atSymbol("{")) {
            transitions.add(transition());
        }
        return transitions;
    }

    private Transition transition() throws SwanSyntaxException {
        int s = ctx.peek().start();
        ctx.acceptWord("if");
        Arrow arrow = arrow();
        ctx.expectSymbol(";");
        return new Transition(ctx.span(s), arrow);
    }

    private Arrow arrow() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Expression guard = null;
        if (ctx.acceptSymbol("(")) {
            guard = unit.expressions().expression();
            ctx.expectSymbol(")");
        }
        Scope action = ctx.atSymbol("{") ? scope() : null;
        if (ctx.atWord("restart") || ctx.atWord("resume")) {
            int ts = ctx.peek().start();
            boolean resume = ctx.next().isWord("resume");
            Identification state = identification();
            Target target = new Target(ctx.span(ts), state, resume);
            return new Arrow(ctx.span(s), guard, action, target);
        }
        int fs = ctx.peek().start();
        if (ctx.acceptWord("if")) {
            Arrow ifArrow = arrow();
            List<Arrow> elsifs = new ArrayList<>();
            while (ctx.acceptWord("elsif")) elsifs.add(arrow());
            Arrow elseArrow = ctx.acceptWord("else") ? arrow() : null;
            ctx.expectWord("end");
            return new Arrow(ctx.span(s), guard, action, new ForkTree(ctx.span(fs), ifArrow, elsifs, elseArrow));
        }
        if (ctx.atSymbol(":") || ctx.atSymbol("::")) {
            List<ForkWithPriority> forks = new ArrayList<>();
            while (ctx.atSymbol(":") || ctx.atSymbol("::")) {
                int ps = ctx.peek().start();
                Integer priority = priority();
                boolean ifArrow;
                if (ctx.acceptWord("if")) ifArrow = true;
                else if (ctx.acceptWord("else")) ifArrow = false;
                else throw ctx.error("expected 'if' or 'else'");
                Arrow a = arrow();
                forks.add(new ForkWithPriority(ctx.span(ps), priority, a, ifArrow));
            }
            ctx.expectWord("end");
            return new Arrow(ctx.span(s), guard, action, new ForkPriorityList(ctx.span(fs), forks));
        }
        throw ctx.error("expected a target or a fork");
    }

    // diagrams

    private SwanNode diagramItem() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.at(TokenKind.MARKUP)) {
            Token t = ctx.next();
            return new ProtectedDiagramObject(ctx.span(s), null, ctx.markup(t));
        }
        int mark = ctx.mark();
        Luid luid = ctx.peek(1).is(TokenKind.LUID) ? Luid.of(ctx.peek(1).text()) : null;
        try {
            return diagramObject(s);
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            ctx.reset(mark);
            ctx.expectSymbol("(");
            ctx.skipBalanced(t -> false);
            ctx.expectSymbol(")");
            logger.debug("Protected diagram object at {}: {}", ctx.span(s), e.getMessage());
            return new ProtectedDiagramObject(ctx.span(s), luid, ProtectedText.fallback(ctx.raw(s, ctx.lastEnd())));
        }
    }

    private SwanNode diagramObject(int s) throws SwanSyntaxException {
        ctx.expectSymbol("(");
        Luid luid = ctx.at(TokenKind.LUID) ? ctx.luid() : null;
        if (ctx.acceptWord("wire")) {
            Connection source = connection();
            ctx.expectSymbol("=>");
            List<Connection> targets = new ArrayList<>();
            do {
                targets.add(connection());
            } while (ctx.acceptSymbol(","));
            ctx.expectSymbol(")");
            return new Wire(ctx.span(s), luid, source, targets);
        }
        Token t = ctx.peek();
        if (t.isWord("expr")) {
            ctx.next();
            Expression e = unit.expressions().expression();
            List<SwanNode> locals = locals();
            ctx.expectSymbol(")");
            return new ExprBlock(ctx.span(s), luid, e, locals);
        }
        if (t.isWord("def")) {
            ctx.next();
            EquationLhs lhs = lhs();
            List<SwanNode> locals = locals();
            ctx.expectSymbol(")");
            return new DefBlock(ctx.span(s), luid, lhs, locals);
        }
        if (t.isWord("block")) {
            ctx.next();
            if (ctx.atMarkup(Markup.INST)) {
                ProtectedText instance = ctx.markup(ctx.next());
                List<SwanNode> locals = locals();
                ctx.expectSymbol(")");
                return new Block(ctx.span(s), luid, instance, locals);
            }
            OperatorCall op = unit.expressions().operatorCall();
            List<SwanNode> locals = locals();
            ctx.expectSymbol(")");
            return new Block(ctx.span(s), luid, op, locals);
        }
        if (t.isWord("group")) {
            ctx.next();
            GroupOperation operation = GroupOperation.NONE;
            if (ctx.acceptWord("byname")) {
                operation = GroupOperation.BY_NAME;
            } else if (ctx.acceptWord("bypos")) {
                operation = GroupOperation.BY_POSITION;
            } else if (ctx.atSymbol("(") && ctx.peek(1).isSymbol(")")) {
                ctx.next();
                ctx.next();
                operation = GroupOperation.NORMALIZE;
            }
            List<SwanNode> locals = locals();
            ctx.expectSymbol(")");
            return new Bar(ctx.span(s), luid, operation, locals);
        }
        if (atSection()) {
            ScopeSection section = section();
            List<SwanNode> locals = locals();
            ctx.expectSymbol(")");
            return new SectionBlock(ctx.span(s), luid, section, locals);
        }
        throw ctx.error("expected a diagram object");
    }

    private List<SwanNode> locals() throws SwanSyntaxException {
        List<SwanNode> locals = new ArrayList<>();
        if (ctx.acceptWord("where")) {
            while (ctx.atSymbol("(") || ctx.at(TokenKind.MARKUP)) locals.add(diagramItem());
        }
        return locals;
    }

    private Connection connection() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.atSymbol("(") && ctx.peek(1).isSymbol(")")) {
            ctx.next();
            ctx.next();
            return Connection.unconnected(ctx.span(s));
        }
        PortExpr port;
        if (ctx.acceptWord("self")) {
            port = PortExpr.self(ctx.span(s));
        } else {
            Luid luid = ctx.luid();
            port = PortExpr.of(ctx.span(s), luid);
        }
        GroupAdaptation adaptation = null;
        if (ctx.atSymbol(".") && ctx.peek(1).isSymbol("(")) {
            int as = ctx.next().start();
            adaptation = unit.expressions().adaptation(as);
        }
        return Connection.of(ctx.span(s), port, adaptation);
    }
}
