package info.isaksson.erland.swanmodel.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for loading a Swan model.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class SwanModelOptions {

    /** Whether {@code .swani} interfaces are loaded next to module bodies. */
    public boolean includeInterfaces = true;

    /**
     * If true, a module whose namespace holds a duplicate name fails to load with a
     * {@link info.isaksson.erland.swanmodel.ast.StructuralInvariantException}.
     * Otherwise the duplicate is logged and the module is kept.
     */
    public boolean strictInvariants = false;

    /** Glob patterns, relative to each scanned root, of files to skip. */
    public List<String> excludeGlobs = new ArrayList<>();

    /** Whether declarations of dependency sources take part in lookups. */
    public boolean followDependencies = true;
}
