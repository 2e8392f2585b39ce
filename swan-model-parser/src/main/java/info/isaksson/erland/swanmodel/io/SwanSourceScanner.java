package info.isaksson.erland.swanmodel.io;

import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.source.SwanSource;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Finds the Swan units below a directory.
 *
 * <p>Files are returned sorted by their path relative to the root, so two scans of the same
 * tree list the same units in the same order.</p>
 */
public final class SwanSourceScanner {

    /** First path segments that hold build output or tool state. */
    private static final Set<String> SKIPPED_TOP_DIRS = Set.of("target", "build", "out", ".git", ".idea");

    private SwanSourceScanner() {}

    /**
     * @param root directory to walk
     * @param excludeGlobs globs over the root-relative path, written with '/'; a bare name
     *                     excludes the directory of that name and everything below it
     * @param includeInterfaces true to return .swani interfaces next to .swan bodies
     */
    public static List<Path> scan(Path root, List<String> excludeGlobs, boolean includeInterfaces) throws IOException {
        Objects.requireNonNull(root, "root");
        List<PathMatcher> excludes = excludeMatchers(excludeGlobs);

        TreeMap<String, Path> byRelativePath = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                .filter(p -> isUnit(p, includeInterfaces))
                .forEach(p -> {
                    Path rel = root.relativize(p);
                    if (isSkippedDir(rel) || isExcluded(rel, excludes)) return;
                    byRelativePath.put(slashed(rel), p);
                });
        }
        return new ArrayList<>(byRelativePath.values());
    }

    /** Scanned files as sources; their text is read when first parsed. */
    public static List<SwanSource> sources(Path root, List<String> excludeGlobs, boolean includeInterfaces)
            throws IOException {
        List<SwanSource> out = new ArrayList<>();
        for (Path p : scan(root, excludeGlobs, includeInterfaces)) out.add(SwanSource.fromFile(p));
        return out;
    }

    private static boolean isUnit(Path p, boolean includeInterfaces) {
        return ModuleKind.fromFileName(p.getFileName().toString())
                .map(k -> k == ModuleKind.BODY || includeInterfaces)
                .orElse(false);
    }

    private static boolean isSkippedDir(Path rel) {
        return rel.getNameCount() > 1 && SKIPPED_TOP_DIRS.contains(rel.getName(0).toString());
    }

    private static boolean isExcluded(Path rel, List<PathMatcher> excludes) {
        if (excludes.isEmpty()) return false;
        Path normalized = Path.of(slashed(rel));
        for (PathMatcher m : excludes) {
            if (m.matches(normalized)) return true;
        }
        return false;
    }

    private static List<PathMatcher> excludeMatchers(List<String> globs) {
        List<PathMatcher> out = new ArrayList<>();
        if (globs == null) return out;
        for (String raw : globs) {
            if (raw == null || raw.isBlank()) continue;
            String glob = raw.trim().replace('\\', '/');
            boolean wildcard = glob.indexOf('*') >= 0 || glob.indexOf('?') >= 0 || glob.indexOf('[') >= 0;
            if (!wildcard && ModuleKind.fromFileName(glob).isEmpty()) glob = glob + "/**";
            out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        return out;
    }

    private static String slashed(Path p) {
        return p.toString().replace('\\', '/');
    }
}
