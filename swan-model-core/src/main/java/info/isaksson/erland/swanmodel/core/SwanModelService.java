package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.io.SwanSourceScanner;
import info.isaksson.erland.swanmodel.parse.SwanParser;
import info.isaksson.erland.swanmodel.source.SwanModuleParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for building a model from directories on disk.
 *
 * <p>CLI and other front ends should use this class instead of wiring the scanner, parser
 * and model themselves.</p>
 */
public final class SwanModelService {

    private static final Logger logger = LogManager.getLogger();

    private final SwanModuleParser parser;

    public SwanModelService() {
        this(new SwanParser());
    }

    public SwanModelService(SwanModuleParser parser) {
        if (parser == null) throw new IllegalArgumentException("parser must not be null");
        this.parser = parser;
    }

    /**
     * Scans the project root and the dependency roots and builds a lazy model over the
     * files found. Nothing is parsed yet.
     */
    public SwanModelResult load(Path sourceRoot, List<Path> dependencyRoots, SwanModelOptions options)
            throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        if (options == null) options = new SwanModelOptions();

        List<Path> own = SwanSourceScanner.scan(sourceRoot, options.excludeGlobs, options.includeInterfaces);
        List<Path> deps = new ArrayList<>();
        if (dependencyRoots != null && options.followDependencies) {
            for (Path root : dependencyRoots) {
                deps.addAll(SwanSourceScanner.scan(root, options.excludeGlobs, options.includeInterfaces));
            }
        }
        logger.info("Found {} Swan files under {} and {} in dependencies", own.size(), sourceRoot, deps.size());

        SwanModel model = new SwanModel(toSources(own), toSources(deps), parser, options);
        return new SwanModelResult(model, own, deps);
    }

    private static List<SwanSource> toSources(List<Path> files) {
        List<SwanSource> out = new ArrayList<>();
        for (Path p : files) out.add(SwanSource.fromFile(p));
        return out;
    }
}
