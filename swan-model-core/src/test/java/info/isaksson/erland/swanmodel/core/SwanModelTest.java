package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.ConstDecl;
import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.ProtectedDecl;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.ast.VarDecl;
import info.isaksson.erland.swanmodel.parse.SwanParser;
import info.isaksson.erland.swanmodel.source.SwanModuleParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

public class SwanModelTest {

    /** Records which modules were parsed, in order. */
    static final class CountingParser implements SwanModuleParser {
        private final SwanParser delegate = new SwanParser();
        final List<String> parsed = new ArrayList<>();

        @Override public Module parse(SwanSource source) throws IOException {
            parsed.add(source.moduleName().toString());
            return delegate.parse(source);
        }
    }

    private static SwanSource body(String name, String text) {
        return SwanSource.ofText(name, ModuleKind.BODY, text);
    }

    private static List<SwanSource> threeModules() {
        return List.of(
                body("A", "const KA: int32 = 1;\ntype TA = int32;\n"),
                body("B", "const KB: int32 = 2; KC: int32 = 3;\n"),
                body("C", "function F (x: int32;) returns (y: int32;)\n  y = x;\n"));
    }

    private static List<String> names(Iterable<GlobalDeclaration> decls) {
        List<String> out = new ArrayList<>();
        for (GlobalDeclaration d : decls) out.add(d.kind() + ":" + d.members().size());
        return out;
    }

    private static Predicate<GlobalDeclaration> declares(String name) {
        return d -> d.members().stream().anyMatch(m -> m instanceof Declaration decl && decl.name().equals(name));
    }

    @Test
    void nothingIsParsedUntilIterationReachesIt() {
        CountingParser parser = new CountingParser();
        SwanModel model = new SwanModel(threeModules(), parser);

        Iterator<GlobalDeclaration> it = model.declarations().iterator();
        assertEquals(0, model.parseCount());
        assertTrue(model.modules().isEmpty());

        it.next();
        assertEquals(List.of("A"), parser.parsed);
        assertFalse(model.allModulesLoaded());
    }

    @Test
    void lookupParsesOnlyAsFarAsNeededAndIsMemoized() {
        CountingParser parser = new CountingParser();
        SwanModel model = new SwanModel(threeModules(), parser);

        Optional<GlobalDeclaration> found = model.findDeclaration(d -> d.members().size() == 2);
        assertTrue(found.isPresent());
        assertEquals(List.of("A", "B"), parser.parsed);

        Optional<GlobalDeclaration> again = model.findDeclaration(d -> d.members().size() == 2);
        assertSame(found.get(), again.get());
        assertEquals(2, model.parseCount());
        assertEquals(2, model.modules().size());
    }

    @Test
    void notFoundIsEmpty() {
        SwanModel model = new SwanModel(threeModules(), new CountingParser());

        assertTrue(model.findDeclaration(d -> false).isEmpty());
        assertTrue(model.allModulesLoaded());
    }

    @Test
    void enumerationIsDeterministic() {
        SwanModel model = new SwanModel(threeModules(), new CountingParser());

        List<GlobalDeclaration> first = new ArrayList<>();
        model.declarations().forEach(first::add);
        List<GlobalDeclaration> second = new ArrayList<>();
        model.declarations().forEach(second::add);

        assertEquals(first, second);
        assertEquals(List.of("CONSTANTS:1", "TYPES:1", "CONSTANTS:2", "OPERATOR:1"), names(model.declarations()));
        assertEquals(3, model.parseCount());
    }

    @Test
    void allOfFlattensDeclarationLists() {
        SwanModel model = new SwanModel(threeModules(), new CountingParser());

        List<String> constants = new ArrayList<>();
        for (ConstDecl c : model.constants()) constants.add(c.name());
        List<Operator> operators = new ArrayList<>();
        model.operators().forEach(operators::add);

        assertEquals(List.of("KA", "KB", "KC"), constants);
        assertEquals(1, operators.size());
        assertEquals("C::F", operators.get(0).fullPath());
    }

    @Test
    void dependenciesCanBeLeftOut() {
        CountingParser parser = new CountingParser();
        SwanModel model = new SwanModel(List.of(body("Own", "const K: int32 = 1;\n")),
                List.of(body("Dep", "const D: int32 = 1;\n")), parser, new SwanModelOptions());

        assertTrue(model.findDeclaration(declares("D"), false).isEmpty());
        assertEquals(List.of("Own"), parser.parsed);
        assertTrue(model.findDeclaration(declares("D")).isPresent());
        assertEquals(List.of("Own", "Dep"), parser.parsed);
    }

    @Test
    void dependenciesAreIgnoredWhenNotFollowed() {
        SwanModelOptions options = new SwanModelOptions();
        options.followDependencies = false;
        SwanModel model = new SwanModel(List.of(body("Own", "")), List.of(body("Dep", "")), new CountingParser(), options);

        assertEquals(1, model.sources().size());
    }

    @Test
    void interfacesCanBeExcluded() {
        SwanModelOptions options = new SwanModelOptions();
        options.includeInterfaces = false;
        SwanModel model = new SwanModel(List.of(body("M", ""), SwanSource.ofText("M", ModuleKind.INTERFACE, "")),
                List.of(), new CountingParser(), options);

        assertEquals(1, model.sources().size());
    }

    @Test
    void failingParserYieldsUnstructuredModule() {
        SwanModuleParser failing = source -> {
            throw new IllegalStateException("boom");
        };
        String text = "const K: int32 = 1;\n";
        SwanModel model = new SwanModel(List.of(body("M", text)), failing);

        List<GlobalDeclaration> decls = new ArrayList<>();
        model.declarations().forEach(decls::add);

        assertEquals(1, decls.size());
        ProtectedDecl whole = (ProtectedDecl) decls.get(0);
        assertEquals(text, whole.protectedText().rawText());
        assertFalse(whole.protectedText().isText());
        assertTrue(model.module("M").orElseThrow().isUnstructured());
        assertEquals(2, whole.span().endLine());
    }

    @Test
    void nullModuleIsAFailureToo() {
        SwanModel model = new SwanModel(List.of(body("M", "x")), source -> null);

        assertTrue(model.module("M").orElseThrow().isUnstructured());
        assertEquals(1, model.parseCount());
    }

    @Test
    void duplicateNamesFailOnlyInStrictMode() {
        String text = "const K: int32 = 1;\nconst K: int32 = 2;\n";

        SwanModel lenient = new SwanModel(List.of(body("M", text)), new CountingParser());
        assertEquals(2, lenient.module("M").orElseThrow().declarations().size());

        SwanModelOptions options = new SwanModelOptions();
        options.strictInvariants = true;
        SwanModel strict = new SwanModel(List.of(body("M", text)), List.of(), new CountingParser(), options);
        assertThrows(StructuralInvariantException.class, () -> strict.module("M"));
    }

    @Test
    void findsDeclarationsByPath() {
        SwanModel model = new SwanModel(List.of(
                body("P::Q", "node Ctl (i: int32;) returns (o: int32;)\n{\n  var\n    x: int32;\n  let\n    x = i;\n    o = x;\n}\n"),
                body("P", "type T = int32;\n")), new CountingParser());

        assertInstanceOf(Operator.class, model.findByPath("P::Q::Ctl").orElseThrow());
        VarDecl x = (VarDecl) model.findByPath("P::Q::Ctl::x").orElseThrow();
        assertEquals("P::Q::Ctl::x", x.fullPath());
        assertEquals("i", ((VarDecl) model.findByPath("P::Q::Ctl::i").orElseThrow()).name());
        assertEquals("T", ((Declaration) model.findByPath("P::T").orElseThrow()).name());
        assertTrue(model.findByPath("P::Q::Nope").isEmpty());
        assertTrue(model.findByPath("Z::T").isEmpty());
        assertTrue(model.findByPath("not a path").isEmpty());
    }

    @Test
    void loadAllModulesLoadsEachSourceOnce() {
        CountingParser parser = new CountingParser();
        SwanModel model = new SwanModel(threeModules(), parser);

        model.loadAllModules();
        model.loadAllModules();

        assertTrue(model.allModulesLoaded());
        assertEquals(List.of("A", "B", "C"), parser.parsed);
    }
    @Test
    void moduleByNameAndKindSelectsBodyOrInterface() {
        SwanModel model = new SwanModel(List.of(
                SwanSource.ofText("A", ModuleKind.INTERFACE, "const KI: int32 = 1;\n"),
                body("A", "const KB: int32 = 2;\n")), new CountingParser());

        assertTrue(model.module("A", ModuleKind.INTERFACE).orElseThrow().isInterface());
        assertFalse(model.module("A", ModuleKind.BODY).orElseThrow().isInterface());
        assertTrue(model.module("A").orElseThrow().member("KB").isPresent());
        assertTrue(model.module("B", ModuleKind.BODY).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> model.module((String) null, ModuleKind.BODY));
    }

    @Test
    void badDeclarationsStayLocalWhileIterating() {
        String deep = "(".repeat(20_000) + "1" + ")".repeat(20_000);
        SwanModel model = new SwanModel(List.of(
                body("Deep", "const C: int32 = " + deep + ";\n"),
                body("Mixed", "const K: int32 = 1;\ngroup G = (a: int32, bool);\nconst L: int32 = 2;\n"),
                body("Good", "const D: int32 = 3;\n")), new CountingParser());

        List<GlobalDeclaration> all = new ArrayList<>();
        model.declarations().forEach(all::add);

        assertEquals(5, all.size());
        assertInstanceOf(ProtectedDecl.class, all.get(0));
        assertInstanceOf(ProtectedDecl.class, all.get(2));
        assertFalse(model.module("Mixed").orElseThrow().isUnstructured());
        assertTrue(model.findDeclaration(declares("D")).isPresent());
        assertTrue(model.findDeclaration(declares("L")).isPresent());
    }

    @Test
    void parserRunningOutOfStackLeavesTheModuleUnstructured() {
        SwanModel model = new SwanModel(List.of(body("M", "const K: int32 = 1;\n")), source -> {
            throw new StackOverflowError();
        });

        Module m = model.module("M").orElseThrow();
        assertTrue(m.isUnstructured());
        ProtectedDecl whole = (ProtectedDecl) m.declarations().get(0);
        assertEquals("const K: int32 = 1;\n", whole.protectedText().rawText());
    }
}
