package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.Operator;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.Scope;
import info.isaksson.erland.swanmodel.ast.ScopeSection;
import info.isaksson.erland.swanmodel.ast.Signature;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.UseDirective;
import info.isaksson.erland.swanmodel.ast.VarDecl;
import info.isaksson.erland.swanmodel.ast.VarSection;
import info.isaksson.erland.swanmodel.ast.Variable;
import info.isaksson.erland.swanmodel.automaton.State;
import info.isaksson.erland.swanmodel.diagram.Diagram;
import info.isaksson.erland.swanmodel.diagram.DiagramObject;
import info.isaksson.erland.swanmodel.diagram.SectionBlock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a name as seen from a node.
 *
 * <p>A simple name is looked up outward: {@code var} sections of the enclosing scopes and
 * states (including variable sections of diagram section blocks), then the inputs and
 * outputs of the enclosing operator, then the module namespace. A qualified name
 * {@code P::Q::x} designates member {@code x} of module {@code P::Q}, where the module part
 * may be the alias of a {@code use} directive of the current module.</p>
 */
public final class ScopeNamespace {

    private static final Logger logger = LogManager.getLogger();

    private final SwanModel model;

    public ScopeNamespace(SwanModel model) {
        if (model == null) throw new IllegalArgumentException("model is null");
        this.model = model;
    }

    public Optional<Declaration> resolve(SwanNode from, String name) {
        if (from == null) throw new IllegalArgumentException("from is null");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is blank");
        if (name.contains(PathIdentifier.SEPARATOR)) return resolveQualified(from, name);
        for (SwanNode n = from; n != null; n = n.owner()) {
            Optional<Declaration> found = Optional.empty();
            if (n instanceof Scope s) {
                found = inSections(s.sections(), name);
            } else if (n instanceof State st) {
                found = inSections(st.sections(), name);
            } else if (n instanceof ScopeSection sec) {
                found = inSection(sec, name);
            } else if (n instanceof Operator op) {
                found = inVariables(op.signature().inputs(), name).or(() -> inVariables(op.signature().outputs(), name));
            } else if (n instanceof Signature sig && !(sig.owner() instanceof Operator)) {
                found = inVariables(sig.inputs(), name).or(() -> inVariables(sig.outputs(), name));
            } else if (n instanceof Module m) {
                return new ModuleNamespace(model, m).find(name);
            }
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private Optional<Declaration> resolveQualified(SwanNode from, String name) {
        int last = name.lastIndexOf(PathIdentifier.SEPARATOR);
        String modulePart = name.substring(0, last);
        String member = name.substring(last + PathIdentifier.SEPARATOR.length());
        if (!PathIdentifier.isValidPath(modulePart)) return Optional.empty();
        PathIdentifier moduleName = PathIdentifier.parse(modulePart);
        Optional<Module> current = from.module();
        if (current.isPresent()) {
            for (UseDirective use : current.get().useDirectives()) {
                if (use.alias().isPresent() && use.visibleName().equals(modulePart)) {
                    moduleName = use.path();
                    break;
                }
            }
        }
        Optional<Module> target = model.module(moduleName);
        if (target.isEmpty()) {
            logger.debug("No module {} for {}", moduleName, name);
            return Optional.empty();
        }
        return new ModuleNamespace(model, target.get()).find(member);
    }

    /** A variable of an operator or signature: inputs, outputs, then top level {@code var} sections. */
    static Optional<Declaration> local(SwanNode owner, String name) {
        if (owner instanceof Operator op) {
            return inVariables(op.signature().inputs(), name)
                    .or(() -> inVariables(op.signature().outputs(), name))
                    .or(() -> op.scopeBody().flatMap(s -> inSections(s.sections(), name)));
        }
        if (owner instanceof Signature sig) {
            return inVariables(sig.inputs(), name).or(() -> inVariables(sig.outputs(), name));
        }
        return Optional.empty();
    }

    private static Optional<Declaration> inSections(List<ScopeSection> sections, String name) {
        for (ScopeSection s : sections) {
            Optional<Declaration> d = inSection(s, name);
            if (d.isPresent()) return d;
        }
        return Optional.empty();
    }

    private static Optional<Declaration> inSection(ScopeSection section, String name) {
        if (section instanceof VarSection v) return inVariables(v.variables(), name);
        if (section instanceof Diagram d) {
            for (DiagramObject o : d.objects()) {
                if (o instanceof SectionBlock b && b.section() instanceof VarSection v) {
                    Optional<Declaration> found = inVariables(v.variables(), name);
                    if (found.isPresent()) return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Declaration> inVariables(List<Variable> variables, String name) {
        for (Variable v : variables) {
            if (v instanceof VarDecl d && d.name().equals(name)) return Optional.of(d);
        }
        return Optional.empty();
    }
}
