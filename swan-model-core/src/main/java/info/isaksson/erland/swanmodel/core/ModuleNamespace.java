package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.ModuleKind;

import java.util.Optional;

/**
 * Names declared at the top level of a module: types, constants, sensors, groups and
 * operators. A body that does not declare a name defers to the interface of the same
 * module, which is loaded on demand.
 */
public final class ModuleNamespace {

    private final SwanModel model;
    private final Module module;

    public ModuleNamespace(SwanModel model, Module module) {
        if (module == null) throw new IllegalArgumentException("module is null");
        this.model = model;
        this.module = module;
    }

    public Module module() {
        return module;
    }

    public Optional<Declaration> find(String name) {
        if (name == null) throw new IllegalArgumentException("name is null");
        Optional<Declaration> own = module.member(name);
        if (own.isPresent() || model == null || module.isInterface()) return own;
        return model.module(module.name(), ModuleKind.INTERFACE).flatMap(i -> i.member(name));
    }
}
