package info.isaksson.erland.swanmodel.source;

import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One source unit: a module body or interface, read from a file or given as text.
 * File content is read on first use and kept.
 */
public final class SwanSource {

    private static final Pattern VERSION = Pattern.compile("^--\\s*version\\s+swan:\\s*(\\S+)");

    private final PathIdentifier moduleName;
    private final ModuleKind kind;
    private final Path path;
    private String text;

    private SwanSource(PathIdentifier moduleName, ModuleKind kind, Path path, String text) {
        if (moduleName == null) throw new IllegalArgumentException("moduleName is null");
        if (kind == null) throw new IllegalArgumentException("kind is null");
        this.moduleName = moduleName;
        this.kind = kind;
        this.path = path;
        this.text = text;
    }

    /**
     * Source backed by a {@code .swan} or {@code .swani} file; the module name comes from the
     * file name ({@code P-Q.swan} is module {@code P::Q}).
     */
    public static SwanSource fromFile(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        String fileName = file.getFileName().toString();
        ModuleKind kind = ModuleKind.fromFileName(fileName)
                .orElseThrow(() -> new IllegalArgumentException("not a Swan source file: " + file));
        return new SwanSource(PathIdentifier.fromFileName(fileName), kind, file, null);
    }

    public static SwanSource ofText(String moduleName, ModuleKind kind, String text) {
        if (text == null) throw new IllegalArgumentException("text is null");
        return new SwanSource(PathIdentifier.parse(moduleName), kind, null, text);
    }

    public PathIdentifier moduleName() {
        return moduleName;
    }

    public ModuleKind kind() {
        return kind;
    }

    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    /** Display name used in spans and log messages. */
    public String name() {
        return path != null ? path.toString() : moduleName + kind.extension();
    }

    public String text() throws IOException {
        if (text == null) text = Files.readString(path, StandardCharsets.UTF_8);
        return text;
    }

    /** Version from a first line {@code -- version swan: X}. */
    public Optional<String> swanVersion() throws IOException {
        String t = text();
        int eol = t.indexOf('\n');
        String first = eol < 0 ? t : t.substring(0, eol);
        Matcher m = VERSION.matcher(first.strip());
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    @Override public String toString() {
        return name();
    }
}
