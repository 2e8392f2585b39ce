package info.isaksson.erland.swanmodel.core;

import java.nio.file.Path;
import java.util.List;

/** Loading result container for programmatic usage. */
public final class SwanModelResult {

    public final SwanModel model;

    /** Files found under the project root, in scan order. */
    public final List<Path> ownFiles;

    /** Files found under the dependency roots, root by root. */
    public final List<Path> dependencyFiles;

    SwanModelResult(SwanModel model, List<Path> ownFiles, List<Path> dependencyFiles) {
        this.model = model;
        this.ownFiles = List.copyOf(ownFiles);
        this.dependencyFiles = List.copyOf(dependencyFiles);
    }
}
