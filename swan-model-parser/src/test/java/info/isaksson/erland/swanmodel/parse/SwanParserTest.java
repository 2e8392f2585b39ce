package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.ExprEquation;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.LetSection;
import info.isaksson.erland.swanmodel.ast.Markup;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.ProtectedDecl;
import info.isaksson.erland.swanmodel.ast.ProtectedEquation;
import info.isaksson.erland.swanmodel.ast.Signature;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.UseDirective;
import info.isaksson.erland.swanmodel.automaton.ActivateIf;
import info.isaksson.erland.swanmodel.automaton.ActivateWhen;
import info.isaksson.erland.swanmodel.automaton.StateMachine;
import info.isaksson.erland.swanmodel.expr.BinaryExpr;
import info.isaksson.erland.swanmodel.expr.BinaryOperator;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.expr.GroupExpr;
import info.isaksson.erland.swanmodel.expr.OperatorInstance;
import info.isaksson.erland.swanmodel.expr.ProtectedExpr;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SwanParserTest {

    private final SwanParser parser = new SwanParser();

    private Module body(String text) {
        return parser.parseModule("M.swan", ModuleKind.BODY, PathIdentifier.parse("M"), text);
    }

    private static List<SwanNode> protectedNodes(SwanNode root) {
        List<SwanNode> out = new ArrayList<>();
        collectProtected(root, out);
        return out;
    }

    private static void collectProtected(SwanNode node, List<SwanNode> out) {
        if (node.isProtected()) out.add(node);
        for (SwanNode c : node.children()) collectProtected(c, out);
    }

    private static final String RICH = """
            node Machine (go: bool; sel: Choice;) returns (o: int32; m: int32; x: int32;)
            {
              var
                buf: int32 ^ 4;
              let
                o : automaton #sm
                  initial state #1 Idle:
                    unless
                      if (go) restart Run;
                  state #2 Run:
                    let
                      o = 1;
                    until
                      if (not go) resume Idle;
                  :1: Run unless if (o > 3) restart Idle;
                ;
                x : activate #a
                  if go then x = 1;
                  else x = 2;
                ;
                m : activate when sel match
                  | A : m = 1;
                  | B : m = 2;
                ;
            }

            function Exprs (a: int32; b: int32; c: bool;) returns (y: int32;)
            {
              let
                y = if c then a else b;
                z = (case a of | 1: 2 | default: 3);
                w = (map Add <<4>>) (a, b);
                s = {f: 1, g: 2} : P;
                q = (s with .f = 1; [0] = 2);
                r = a.f[1] @ b[0 .. 2];
                t = pre a -> 0;
                u = merge (a when c) (b when not c);
                p = window <<2>> (0) (a);
                v = (a :> int32) + -b;
                f = forward <<3>> with <<k>>
                  let
                    acc = k;
                  returns (acc);
            }
            """;

    @Test
    void parsesCanonicalTextAndRendersItUnchanged() {
        String text = "-- version swan: 2024.1\n"
                + "use Lib::Util as U;\n"
                + "type Speed = int32; Mode = enum {Off, On};\n"
                + "const Max: int32 = 10;\n"
                + "function Add (a: int32; b: int32;) returns (c: int32;)\n"
                + "  c = a + b;\n"
                + "node Ctl (i: int32;) returns (o: int32;)\n"
                + "{\n"
                + "  var\n"
                + "    x: int32;\n"
                + "  let\n"
                + "    x = Add (i, 1);\n"
                + "    o = x;\n"
                + "}\n";

        Module m = body(text);

        assertEquals(text, m.render());
        assertEquals("-- version swan: 2024.1", m.versionHeader().orElseThrow());
        assertEquals(5, m.declarations().size());
        assertTrue(protectedNodes(m).isEmpty(), "no protected nodes expected: " + protectedNodes(m));
        UseDirective use = m.useDirectives().get(0);
        assertEquals("U", use.visibleName());
    }

    @Test
    void renderingIsAFixedPointForRichConstructs() {
        Module first = body(RICH);
        assertTrue(protectedNodes(first).isEmpty(), "unexpected protected nodes: " + protectedNodes(first));

        String rendered = first.render();
        Module second = body(rendered);

        assertEquals(rendered, second.render());
    }

    @Test
    void richConstructsHaveTheirStructuredTypes() {
        Module m = body(RICH);
        Operator machine = (Operator) m.declarations().get(0);
        LetSection let = machine.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0);

        StateMachine sm = (StateMachine) let.equations().get(0);
        assertEquals(2, sm.states().size());
        assertEquals("Idle", sm.initialState().identification().id().value());
        assertEquals(1, sm.transitionDecls().size());
        assertInstanceOf(ActivateIf.class, let.equations().get(1));
        assertEquals(2, ((ActivateWhen) let.equations().get(2)).branches().size());
    }

    @Test
    void oneInvalidEquationAmongFourIsProtected() {
        Module m = body("""
                node N (i: int32;) returns (o: int32;)
                {
                  let
                    a = i;
                    b = 1 + ;
                    c = a * 2;
                    o = c;
                }
                """);

        Operator n = (Operator) m.declarations().get(0);
        List<Equation> equations = n.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0).equations();

        assertEquals(4, equations.size());
        assertEquals(3, equations.stream().filter(e -> e instanceof ExprEquation).count());
        ProtectedEquation broken = (ProtectedEquation) equations.get(1);
        assertEquals("b = 1 + ;", broken.protectedText().rawText());
        assertEquals(Markup.NONE, broken.protectedText().markup());
        assertEquals("c = a * 2;", equations.get(2).render());
    }

    @Test
    void brokenDeclarationIsProtectedAndParsingResumes() {
        Module m = body("""
                const = 3;
                const K: int32 = 1;
                """);

        assertEquals(2, m.declarations().size());
        assertInstanceOf(ProtectedDecl.class, m.declarations().get(0));
        assertEquals("const = 3;", ((ProtectedDecl) m.declarations().get(0)).protectedText().rawText());
        assertEquals("const K: int32 = 1;", m.declarations().get(1).render());
    }

    @Test
    void markedUpDeclarationKeepsItsText() {
        Module m = body("{syntax%type T = ??;%syntax};\nconst K: int32 = 1;\n");

        ProtectedDecl d = (ProtectedDecl) m.declarations().get(0);
        assertEquals(Markup.SYNTAX, d.protectedText().markup());
        assertEquals("{syntax%type T = ??;%syntax};", d.protectedText().rawText());
        assertEquals("type T = ??;", d.protectedText().data());
        assertTrue(d.protectedText().isText());
    }

    @Test
    void textOperatorIsStructuredButRenderedVerbatim() {
        String text = "{text%function   F (a: int32;) returns (b: int32;) b = a;%text}";
        Module m = body(text + "\n");

        Operator op = (Operator) m.declarations().get(0);
        assertTrue(op.isText());
        assertEquals("F", op.identifier().value());
        assertTrue(op.equationBody().isPresent());
        assertEquals(text + "\n", m.render());
    }

    @Test
    void unreadableTextOperatorIsProtected() {
        Module m = body("{text%function F (a: int32) b = a;%text}\n");

        ProtectedDecl d = (ProtectedDecl) m.declarations().get(0);
        assertEquals(Markup.TEXT, d.protectedText().markup());
    }

    @Test
    void unterminatedMarkupLeavesTheWholeUnitUnstructured() {
        String text = "const K: int32 = 1;\n{syntax%x = 1;\n";
        Module m = body(text);

        assertTrue(m.isUnstructured());
        assertEquals(1, m.declarations().size());
        assertEquals(text, m.render());
    }

    @Test
    void readsModuleInformationAfterEndMarker() {
        Module m = body("""
                const K: int32 = 1;
                __END__
                {"ModelTree": {"Properties": {"version": "1.2"}}}
                """);

        assertTrue(m.information().isPresent());
        assertEquals("1.2", m.information().modelTreeVersion().orElseThrow());
        assertEquals(1, m.declarations().size());
        assertTrue(m.render().endsWith("__END__\n{\"ModelTree\": {\"Properties\": {\"version\": \"1.2\"}}}\n"));
    }

    @Test
    void unreadableInformationIsKeptButEmpty() {
        Module m = body("const K: int32 = 1;\n__END__\nnot json\n");

        assertTrue(m.information().isPresent());
        assertTrue(m.information().isEmpty());
        assertEquals("not json\n", m.information().raw());
    }

    @Test
    void bodylessOperatorIsASignatureOnlyInInterfaces() {
        String decl = "function F (a: int32;) returns (b: int32;);\n";

        Module itf = parser.parseModule("M.swani", ModuleKind.INTERFACE, PathIdentifier.parse("M"), decl);
        Module bdy = body(decl);

        assertInstanceOf(Signature.class, itf.declarations().get(0));
        Operator op = (Operator) bdy.declarations().get(0);
        assertFalse(op.hasBody());
        assertEquals(decl, itf.render());
        assertEquals(decl, bdy.render());
    }

    @Test
    void parsesFromSource() throws Exception {
        Module m = parser.parse(SwanSource.ofText("P::Q", ModuleKind.BODY, "const K: int32 = 1;\n"));

        assertEquals("P::Q", m.name().toString());
        assertEquals("P::Q::K", m.member("K").map(d -> ((SwanNode) d).fullPath()).orElseThrow());
    }

    @Test
    void expressionPrecedence() {
        BinaryExpr e = (BinaryExpr) parser.parseExpression("a + b * c = d and e");

        assertEquals(BinaryOperator.AND, e.operator());
        BinaryExpr eq = (BinaryExpr) e.left();
        assertEquals(BinaryOperator.EQUAL, eq.operator());
        BinaryExpr plus = (BinaryExpr) eq.left();
        assertEquals(BinaryOperator.MULT, ((BinaryExpr) plus.right()).operator());
    }

    @Test
    void parenthesesAreKept() {
        Expression e = parser.parseExpression("(a + b) * c");

        assertInstanceOf(GroupExpr.class, ((BinaryExpr) e).left());
        assertEquals("(a + b) * c", e.render());
    }

    @Test
    void operatorInstanceWithLuid() {
        OperatorInstance i = (OperatorInstance) parser.parseExpression("Lib::Add #7 (x, 1)");

        assertEquals("7", i.luid().orElseThrow().value());
        assertEquals(2, i.arguments().items().size());
        assertEquals("Lib::Add #7 (x, 1)", i.render());
    }

    @Test
    void incompleteExpressionIsProtected() {
        Expression e = parser.parseExpression("1 +");

        assertInstanceOf(ProtectedExpr.class, e);
        assertEquals("1 +", e.render());
    }

    @Test
    void singleEquationAndDeclarationEntryPoints() {
        assertInstanceOf(ExprEquation.class, parser.parseEquation("x, _, .. = f (y);"));
        assertInstanceOf(ProtectedEquation.class, parser.parseEquation("x = ;"));
        GlobalDeclaration d = parser.parseDeclaration("group G = (bool, a: int32, b: (char, c: bool));");
        assertEquals("group G = (bool, a: int32, b: (char, c: bool));", d.render());
        GlobalDeclaration bad = parser.parseDeclaration("group G = (a: int32, (bool, b: char));");
        assertInstanceOf(ProtectedDecl.class, bad);
        assertEquals("group G = (a: int32, (bool, b: char));", bad.render());
    }

    @Test
    void positionalGroupItemAfterNamedOneProtectsOnlyItsDeclaration() {
        Module m = body("const K: int32 = 1;\ngroup G = (a: int32, bool);\nconst L: int32 = 2;\n");

        assertFalse(m.isUnstructured());
        assertEquals(3, m.declarations().size());
        assertFalse(m.declarations().get(0).isProtected());
        assertInstanceOf(ProtectedDecl.class, m.declarations().get(1));
        assertEquals("group G = (a: int32, bool);", m.declarations().get(1).render());
        assertFalse(m.declarations().get(2).isProtected());
        assertTrue(m.member("L").isPresent());
    }

    @Test
    void activateWhenWithoutBranchIsAProtectedEquation() {
        Module m = body("""
                node N (c: int32;) returns (x: int32; y: int32; z: int32;)
                {
                  let
                    x = 1;
                    y : activate when c match;
                    z = 2;
                }
                """);

        assertFalse(m.isUnstructured());
        Operator n = (Operator) m.declarations().get(0);
        List<Equation> eqs = n.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0).equations();
        assertEquals(3, eqs.size());
        assertInstanceOf(ExprEquation.class, eqs.get(0));
        assertInstanceOf(ProtectedEquation.class, eqs.get(1));
        assertEquals("y : activate when c match;", eqs.get(1).render());
        assertInstanceOf(ExprEquation.class, eqs.get(2));
        assertInstanceOf(ProtectedEquation.class, parser.parseEquation("y : activate when c match;"));
    }

    private static final String NO_INITIAL_STATE = """
            node N (go: bool;) returns (o: int32; p: int32;)
            {
              let
                p = 0;
                o : automaton #sm
                  state #1 A:
                    unless
                      if (go) restart B;
                  state #2 B:
                    unless
                      if (go) restart A;
                ;
                q = p;
            }
            """;

    @Test
    void automatonWithoutInitialStateIsProtectedWithItsSourceText() {
        assertStateMachineProtected(NO_INITIAL_STATE);
    }

    @Test
    void automatonWithTwoInitialStatesIsProtectedWithItsSourceText() {
        assertStateMachineProtected(NO_INITIAL_STATE.replace("state #", "initial state #"));
    }

    private void assertStateMachineProtected(String text) {
        Module m = body(text);

        assertFalse(m.isUnstructured());
        Operator n = (Operator) m.declarations().get(0);
        List<Equation> eqs = n.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0).equations();
        assertEquals(3, eqs.size());
        assertInstanceOf(ExprEquation.class, eqs.get(0));
        assertInstanceOf(ExprEquation.class, eqs.get(2));
        ProtectedEquation sm = assertInstanceOf(ProtectedEquation.class, eqs.get(1));
        int from = text.indexOf("o : automaton");
        int to = text.indexOf(';', text.indexOf("restart A;") + "restart A;".length()) + 1;
        assertEquals(text.substring(from, to), sm.protectedText().rawText());
    }

    @Test
    void deeplyNestedExpressionIsProtectedWithoutExhaustingTheStack() {
        String deep = "(".repeat(20_000) + "1" + ")".repeat(20_000);
        Module m = body("const C: int32 = " + deep + ";\nconst D: int32 = 2;\n");

        assertFalse(m.isUnstructured());
        assertEquals(2, m.declarations().size());
        assertInstanceOf(ProtectedDecl.class, m.declarations().get(0));
        assertTrue(m.member("D").isPresent());
        assertInstanceOf(ProtectedExpr.class, parser.parseExpression("pre ".repeat(5_000) + "x"));
        assertInstanceOf(ProtectedExpr.class, parser.parseExpression("not ".repeat(5_000) + "x"));
        assertFalse(parser.parseExpression("(((a + b)))").isProtected());
    }

    @Test
    void spansCoverTheSourceText() {
        Module m = body("node N (i: int32;) returns (o: int32;)\n{\n  let\n    o = i + 1;\n}\n");
        Operator n = (Operator) m.declarations().get(0);
        Equation eq = n.scopeBody().orElseThrow().sectionsOf(LetSection.class).get(0).equations().get(0);

        assertEquals("o = i + 1;", eq.sourceText().orElseThrow());
        assertEquals(4, eq.span().startLine());
        assertEquals(5, eq.span().startColumn());
    }
}
