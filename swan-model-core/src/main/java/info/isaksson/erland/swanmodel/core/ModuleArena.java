package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.Module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Append-only cache of parsed modules, indexed by source position. */
final class ModuleArena {

    private final Module[] slots;
    private int loaded;

    ModuleArena(int size) {
        this.slots = new Module[size];
    }

    int size() {
        return slots.length;
    }

    Module get(int index) {
        return slots[index];
    }

    void put(int index, Module module) {
        if (module == null) throw new IllegalArgumentException("module is null");
        if (slots[index] != null) throw new IllegalStateException("module " + index + " is already loaded");
        slots[index] = module;
        loaded++;
    }

    boolean isFull() {
        return loaded == slots.length;
    }

    /** Loaded modules in source order. */
    List<Module> loaded() {
        List<Module> out = new ArrayList<>(loaded);
        Arrays.stream(slots).filter(m -> m != null).forEach(out::add);
        return out;
    }
}
