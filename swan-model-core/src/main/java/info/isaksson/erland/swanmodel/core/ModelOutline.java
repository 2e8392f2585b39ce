package info.isaksson.erland.swanmodel.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.ProtectedDecl;
import info.isaksson.erland.swanmodel.ast.Signature;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.UseDirective;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat outline of a model: every module with its declarations, in source order.
 * Built from a fully loaded model, so the outline is the same on every run.
 */
@JsonPropertyOrder({"modules"})
public final class ModelOutline {

    public final List<ModuleEntry> modules;

    public ModelOutline(List<ModuleEntry> modules) {
        this.modules = modules == null ? List.of() : List.copyOf(modules);
    }

    /** Loads every module of the model and outlines it. */
    public static ModelOutline of(SwanModel model) {
        if (model == null) throw new IllegalArgumentException("model is null");
        model.loadAllModules();
        List<ModuleEntry> out = new ArrayList<>();
        for (Module m : model.modules()) out.add(ModuleEntry.of(m));
        return new ModelOutline(out);
    }

    @JsonPropertyOrder({"name", "kind", "source", "version", "unstructured", "declarations"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ModuleEntry {
        public final String name;
        public final String kind;
        public final String source;
        public final String version;
        public final boolean unstructured;
        public final List<DeclarationEntry> declarations;

        public ModuleEntry(String name, String kind, String source, String version, boolean unstructured,
                           List<DeclarationEntry> declarations) {
            this.name = name;
            this.kind = kind;
            this.source = source;
            this.version = version;
            this.unstructured = unstructured;
            this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        }

        static ModuleEntry of(Module m) {
            List<DeclarationEntry> decls = new ArrayList<>();
            for (GlobalDeclaration d : m.declarations()) {
                for (SwanNode member : d.members()) decls.add(DeclarationEntry.of(d, member));
            }
            return new ModuleEntry(m.name().toString(), m.kind().name().toLowerCase(), m.span().sourceName(),
                    m.information().modelTreeVersion().orElse(null), m.isUnstructured(), decls);
        }
    }

    @JsonPropertyOrder({"name", "kind", "path", "line", "column"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class DeclarationEntry {
        public final String name;
        public final String kind;
        public final String path;
        public final int line;
        public final int column;

        public DeclarationEntry(String name, String kind, String path, int line, int column) {
            this.name = name;
            this.kind = kind;
            this.path = path;
            this.line = line;
            this.column = column;
        }

        static DeclarationEntry of(GlobalDeclaration owner, SwanNode member) {
            String name;
            String path;
            if (member instanceof Declaration d) {
                name = d.name();
                path = member.fullPath();
            } else if (member instanceof UseDirective u) {
                name = u.visibleName();
                path = u.path().toString();
            } else {
                name = ProtectedDecl.PATH_SEGMENT;
                path = member.fullPath();
            }
            return new DeclarationEntry(name, kindOf(owner), path, member.span().startLine(), member.span().startColumn());
        }

        private static String kindOf(GlobalDeclaration d) {
            if (d instanceof Operator op) return op.signature().isNode() ? "node" : "function";
            if (d instanceof Signature sig) return sig.isNode() ? "node signature" : "function signature";
            switch (d.kind()) {
                case TYPES: return "type";
                case CONSTANTS: return "const";
                case SENSORS: return "sensor";
                case GROUPS: return "group";
                case USE: return "use";
                default: return "protected";
            }
        }
    }
}
