package info.isaksson.erland.swanmodel.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A module body ({@code .swan}) or interface ({@code .swani}): an ordered list of global
 * declarations. Use directives are part of that list.
 */
public final class Module extends SwanNode {

    private final ModuleKind kind;
    private final PathIdentifier name;
    private final String versionHeader;
    private final List<GlobalDeclaration> declarations;
    private final ModuleInformation information;
    private final String text;
    private final boolean unstructured;

    public Module(SourceSpan span, ModuleKind kind, PathIdentifier name, String versionHeader,
                  List<GlobalDeclaration> declarations, ModuleInformation information, String text) {
        this(span, kind, name, versionHeader, declarations, information, text, false);
    }

    private Module(SourceSpan span, ModuleKind kind, PathIdentifier name, String versionHeader,
                   List<GlobalDeclaration> declarations, ModuleInformation information, String text,
                   boolean unstructured) {
        super(span);
        if (kind == null) throw new IllegalArgumentException("kind is null");
        if (name == null) throw new IllegalArgumentException("name is null");
        this.kind = kind;
        this.name = name;
        this.versionHeader = versionHeader;
        this.declarations = adoptAll(declarations);
        this.information = information == null ? ModuleInformation.none() : information;
        this.text = text;
        this.unstructured = unstructured;
    }

    /** A unit that could not be structured at all: one protected declaration holding the whole text. */
    public static Module unstructured(SourceSpan span, ModuleKind kind, PathIdentifier name, String text) {
        String raw = text == null ? "" : text;
        ProtectedDecl whole = new ProtectedDecl(span, ProtectedText.fallback(raw));
        return new Module(span, kind, name, null, List.of(whole), ModuleInformation.none(), raw, true);
    }

    public ModuleKind kind() {
        return kind;
    }

    public PathIdentifier name() {
        return name;
    }

    public boolean isInterface() {
        return kind == ModuleKind.INTERFACE;
    }

    /** True when the whole unit is a single protected declaration. */
    public boolean isUnstructured() {
        return unstructured;
    }

    /** First line {@code -- version ...} of the source, when present. */
    public Optional<String> versionHeader() {
        return Optional.ofNullable(versionHeader);
    }

    public List<GlobalDeclaration> declarations() {
        return declarations;
    }

    public List<UseDirective> useDirectives() {
        List<UseDirective> out = new ArrayList<>();
        for (GlobalDeclaration d : declarations) {
            if (d instanceof UseDirective u) out.add(u);
        }
        return out;
    }

    public ModuleInformation information() {
        return information;
    }

    /** Source text the module was parsed from. */
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    /**
     * Named member of the module namespace (types, constants, sensors, groups and operators).
     */
    public Optional<Declaration> member(String memberName) {
        if (memberName == null) return Optional.empty();
        for (GlobalDeclaration d : declarations) {
            for (SwanNode m : d.members()) {
                if (isNamespaceMember(m) && ((Declaration) m).name().equals(memberName)) {
                    return Optional.of((Declaration) m);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Checks that types, constants, sensors, groups and operators have unique names.
     *
     * @throws StructuralInvariantException naming the first duplicate
     */
    public void checkNamespace() {
        Map<String, SwanNode> seen = new HashMap<>();
        for (GlobalDeclaration d : declarations) {
            for (SwanNode m : d.members()) {
                if (!isNamespaceMember(m)) continue;
                String n = ((Declaration) m).name();
                SwanNode previous = seen.putIfAbsent(n, m);
                if (previous != null) {
                    throw new StructuralInvariantException("module " + name + ": '" + n + "' declared at "
                            + previous.span() + " is declared again at " + m.span());
                }
            }
        }
    }

    private static boolean isNamespaceMember(SwanNode node) {
        return node instanceof TypeDecl || node instanceof ConstDecl || node instanceof SensorDecl
                || node instanceof GroupDecl || node instanceof Operator || node instanceof Signature;
    }

    @Override public String fullPath() {
        return name.toString();
    }

    @Override public void write(SwanWriter out) {
        if (unstructured) {
            out.raw(text);
            return;
        }
        if (versionHeader != null) out.text(versionHeader).line();
        for (GlobalDeclaration d : declarations) {
            out.node(d).line();
        }
        if (information.isPresent()) {
            out.text(ModuleInformation.END_MARKER).line().raw(information.raw());
        }
    }
}
