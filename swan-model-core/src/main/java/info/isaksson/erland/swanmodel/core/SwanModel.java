package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.ConstDecl;
import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.GroupDecl;
import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.ProtectedDecl;
import info.isaksson.erland.swanmodel.ast.SensorDecl;
import info.isaksson.erland.swanmodel.ast.Signature;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.TypeDecl;
import info.isaksson.erland.swanmodel.ast.UseDirective;
import info.isaksson.erland.swanmodel.source.SwanModuleParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Lazily built model of a set of Swan sources: the project's own sources first, then
 * those of its dependencies.
 *
 * <p>A source is parsed the first time an iteration or lookup reaches it and the module is
 * kept for the lifetime of the model. Declarations are always visited in source order, then
 * in declaration order within a module. A source whose parser fails is replaced by an
 * unstructured module holding its whole text.</p>
 *
 * <p>Not thread-safe: the model is meant to be used from one thread.</p>
 */
public final class SwanModel {

    private static final Logger logger = LogManager.getLogger();

    private final List<SwanSource> sources;
    private final int ownCount;
    private final SwanModuleParser parser;
    private final SwanModelOptions options;
    private final ModuleArena arena;
    private int parseCount;

    public SwanModel(List<SwanSource> ownSources, List<SwanSource> dependencySources,
                     SwanModuleParser parser, SwanModelOptions options) {
        if (parser == null) throw new IllegalArgumentException("parser is null");
        this.parser = parser;
        this.options = options == null ? new SwanModelOptions() : options;
        List<SwanSource> all = new ArrayList<>(selected(ownSources));
        this.ownCount = all.size();
        if (this.options.followDependencies) all.addAll(selected(dependencySources));
        this.sources = List.copyOf(all);
        this.arena = new ModuleArena(sources.size());
        logger.debug("Model over {} sources ({} own)", sources.size(), ownCount);
    }

    public SwanModel(List<SwanSource> sources, SwanModuleParser parser) {
        this(sources, List.of(), parser, null);
    }

    private List<SwanSource> selected(List<SwanSource> in) {
        List<SwanSource> out = new ArrayList<>();
        if (in == null) return out;
        for (SwanSource s : in) {
            if (s == null) throw new IllegalArgumentException("source is null");
            if (s.kind() == ModuleKind.INTERFACE && !options.includeInterfaces) continue;
            out.add(s);
        }
        return out;
    }

    public List<SwanSource> sources() {
        return sources;
    }

    public SwanModelOptions options() {
        return options;
    }

    // loading

    private Module load(int index) {
        Module m = arena.get(index);
        if (m != null) return m;
        SwanSource source = sources.get(index);
        parseCount++;
        try {
            m = parser.parse(source);
            if (m == null) logger.warn("Parser returned no module for {}, keeping it unstructured", source);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", source, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Parser failed on {}, keeping it unstructured", source, e);
        } catch (StackOverflowError e) {
            logger.warn("Parser ran out of stack on {}, keeping it unstructured", source);
        }
        if (m == null) m = unstructured(source);
        checkNamespace(m);
        arena.put(index, m);
        logger.debug("Loaded {} ({} declarations)", m.name(), m.declarations().size());
        return m;
    }

    private void checkNamespace(Module m) {
        try {
            m.checkNamespace();
        } catch (StructuralInvariantException e) {
            if (options.strictInvariants) throw e;
            logger.warn(e.getMessage());
        }
    }

    private static Module unstructured(SwanSource source) {
        String text;
        try {
            text = source.text();
        } catch (IOException e) {
            logger.debug("No text for {}: {}", source, e.getMessage());
            text = "";
        }
        return Module.unstructured(wholeSpan(source.name(), text), source.kind(), source.moduleName(), text);
    }

    private static SourceSpan wholeSpan(String name, String text) {
        int lines = 1;
        int lastBreak = -1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
                lastBreak = i;
            }
        }
        return new SourceSpan(name, 0, text.length(), 1, 1, lines, text.length() - lastBreak);
    }

    /** Number of parser invocations so far. */
    public int parseCount() {
        return parseCount;
    }

    /** Loaded modules, in source order. Nothing is parsed. */
    public List<Module> modules() {
        return arena.loaded();
    }

    public boolean allModulesLoaded() {
        return arena.isFull();
    }

    public void loadAllModules() {
        for (int i = 0; i < sources.size(); i++) load(i);
    }

    /** Module body of the given name, else the interface of that name; loaded on demand. */
    public Optional<Module> module(PathIdentifier name) {
        Optional<Module> body = module(name, ModuleKind.BODY);
        return body.isPresent() ? body : module(name, ModuleKind.INTERFACE);
    }

    public Optional<Module> module(String name) {
        if (name == null) throw new IllegalArgumentException("name is null");
        return module(PathIdentifier.parse(name));
    }

    public Optional<Module> module(String name, ModuleKind kind) {
        if (name == null) throw new IllegalArgumentException("name is null");
        return module(PathIdentifier.parse(name), kind);
    }

    /** First source of the given name and kind, loaded on demand. */
    public Optional<Module> module(PathIdentifier name, ModuleKind kind) {
        if (name == null) throw new IllegalArgumentException("name is null");
        String wanted = name.toString();
        for (int i = 0; i < sources.size(); i++) {
            SwanSource s = sources.get(i);
            if (s.kind() == kind && s.moduleName().toString().equals(wanted)) return Optional.of(load(i));
        }
        return Optional.empty();
    }

    // declarations

    private Stream<GlobalDeclaration> stream(int limit) {
        return IntStream.range(0, limit).boxed().flatMap(i -> load(i).declarations().stream());
    }

    /** All global declarations; each iterator parses modules only as far as it is advanced. */
    public Iterable<GlobalDeclaration> declarations() {
        return () -> stream(sources.size()).iterator();
    }

    public Stream<GlobalDeclaration> declarationStream() {
        return stream(sources.size());
    }

    /**
     * Declarations of the given class: global declarations themselves, and the entries of
     * declaration lists, so that {@code allOf(ConstDecl.class)} yields single constants.
     */
    public <T> Iterable<T> allOf(Class<T> kind) {
        if (kind == null) throw new IllegalArgumentException("kind is null");
        return () -> declarationStream().flatMap(d -> flatten(d, kind)).iterator();
    }

    private static <T> Stream<T> flatten(GlobalDeclaration d, Class<T> kind) {
        List<T> out = new ArrayList<>();
        if (kind.isInstance(d)) out.add(kind.cast(d));
        for (SwanNode m : d.members()) {
            if (m != d && kind.isInstance(m)) out.add(kind.cast(m));
        }
        return out.stream();
    }

    public Iterable<TypeDecl> types() {
        return allOf(TypeDecl.class);
    }

    public Iterable<ConstDecl> constants() {
        return allOf(ConstDecl.class);
    }

    public Iterable<SensorDecl> sensors() {
        return allOf(SensorDecl.class);
    }

    public Iterable<GroupDecl> groups() {
        return allOf(GroupDecl.class);
    }

    public Iterable<Operator> operators() {
        return allOf(Operator.class);
    }

    public Iterable<Signature> signatures() {
        return allOf(Signature.class);
    }

    public Iterable<UseDirective> useDirectives() {
        return allOf(UseDirective.class);
    }

    public Iterable<ProtectedDecl> protectedDeclarations() {
        return allOf(ProtectedDecl.class);
    }

    public Iterable<GlobalDeclaration> filterDeclarations(Predicate<GlobalDeclaration> predicate) {
        if (predicate == null) throw new IllegalArgumentException("predicate is null");
        return () -> declarationStream().filter(predicate).iterator();
    }

    /** First declaration matching the predicate; parsing stops at the module holding it. */
    public Optional<GlobalDeclaration> findDeclaration(Predicate<GlobalDeclaration> predicate) {
        return findDeclaration(predicate, true);
    }

    /**
     * @param includeDependencies false to search the project's own sources only
     */
    public Optional<GlobalDeclaration> findDeclaration(Predicate<GlobalDeclaration> predicate,
                                                       boolean includeDependencies) {
        if (predicate == null) throw new IllegalArgumentException("predicate is null");
        return stream(includeDependencies ? sources.size() : ownCount).filter(predicate).findFirst();
    }

    /**
     * Declaration designated by a full path: {@code M::T} for a module member,
     * {@code M::Op::x} for an input, output or local variable of an operator. The longest
     * module name that exists wins.
     */
    public Optional<Declaration> findByPath(String path) {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (!PathIdentifier.isValidPath(path)) return Optional.empty();
        List<Identifier> segments = PathIdentifier.parse(path).segments();
        for (int split = segments.size() - 1; split >= 1; split--) {
            Optional<Module> m = module(PathIdentifier.of(segments.subList(0, split)));
            if (m.isEmpty()) continue;
            Optional<Declaration> member = new ModuleNamespace(this, m.get()).find(segments.get(split).value());
            if (member.isEmpty()) continue;
            List<Identifier> rest = segments.subList(split + 1, segments.size());
            if (rest.isEmpty()) return member;
            if (rest.size() == 1 && member.get() instanceof SwanNode scope) {
                return ScopeNamespace.local(scope, rest.get(0).value());
            }
        }
        return Optional.empty();
    }
}
