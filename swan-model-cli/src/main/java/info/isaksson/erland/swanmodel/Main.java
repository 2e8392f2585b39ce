package info.isaksson.erland.swanmodel;

import info.isaksson.erland.swanmodel.ast.Declaration;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.SwanModelException;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.core.ModelOutline;
import info.isaksson.erland.swanmodel.core.ModelOutlineJson;
import info.isaksson.erland.swanmodel.core.SwanModel;
import info.isaksson.erland.swanmodel.core.SwanModelOptions;
import info.isaksson.erland.swanmodel.core.SwanModelResult;
import info.isaksson.erland.swanmodel.core.SwanModelService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Command line front end: loads the Swan sources under a directory and lists, renders or
 * outlines their declarations.
 */
public final class Main {

    private static final SwanModelService SERVICE = new SwanModelService();

    static final Set<String> LIST_KINDS = Set.of(
            "all", "node", "function", "signature", "type", "const", "sensor", "group", "use", "protected");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.source == null) {
            System.err.println("Error: --source is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: --source must be an existing directory: " + sourcePath);
            return 1;
        }
        List<Path> dependencyPaths = new ArrayList<>();
        for (String d : parsed.dependencies) {
            Path p = Paths.get(d).toAbsolutePath().normalize();
            if (!Files.isDirectory(p)) {
                System.err.println("Error: --dependency must be an existing directory: " + p);
                return 1;
            }
            dependencyPaths.add(p);
        }

        final SwanModelResult res;
        try {
            res = SERVICE.load(sourcePath, dependencyPaths, toModelOptions(parsed));
        } catch (IOException e) {
            System.err.println("Error: could not scan sources.");
            System.err.println(e.getMessage());
            return 2;
        }
        SwanModel model = res.model;

        try {
            if (parsed.render != null) {
                Optional<Declaration> found = model.findByPath(parsed.render);
                if (found.isEmpty()) {
                    System.err.println("Error: no declaration at path: " + parsed.render);
                    return 4;
                }
                System.out.println(((SwanNode) found.get()).render());
            }

            if (parsed.list != null) {
                for (ModelOutline.ModuleEntry m : ModelOutline.of(model).modules) {
                    for (ModelOutline.DeclarationEntry d : m.declarations) {
                        if (matchesKind(parsed.list, d.kind)) {
                            System.out.println(d.kind + " " + d.path + " (" + m.source + ":" + d.line + ")");
                        }
                    }
                }
            }

            if (parsed.outline != null) {
                Path outlineOut = Paths.get(parsed.outline).toAbsolutePath().normalize();
                try {
                    ModelOutlineJson.write(ModelOutline.of(model), outlineOut);
                } catch (IOException e) {
                    System.err.println("Error: could not write outline to: " + outlineOut);
                    System.err.println(e.getMessage());
                    return 2;
                }
            }

            if (parsed.render == null && parsed.list == null) {
                printSummary(sourcePath, res);
            }
        } catch (SwanModelException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
        return 0;
    }

    private static SwanModelOptions toModelOptions(CliArgs parsed) {
        SwanModelOptions o = new SwanModelOptions();
        o.includeInterfaces = parsed.interfaces;
        o.strictInvariants = parsed.strict;
        o.followDependencies = !parsed.dependencies.isEmpty();
        o.excludeGlobs.addAll(parsed.excludes);
        return o;
    }

    static boolean matchesKind(String wanted, String kind) {
        if (wanted.equals("all")) return true;
        if (wanted.equals("signature")) return kind.endsWith(" signature");
        return kind.equals(wanted);
    }

    private static void printSummary(Path sourcePath, SwanModelResult res) {
        int declarations = 0;
        int protectedCount = 0;
        for (GlobalDeclaration d : res.model.declarations()) {
            declarations++;
            if (d.isProtected()) protectedCount++;
        }
        System.out.println(
                "swan-model\n" +
                "- Source: " + sourcePath + "\n" +
                "- Files: " + res.ownFiles.size() + "\n" +
                "- Dependency files: " + res.dependencyFiles.size() + "\n" +
                "- Declarations: " + declarations + "\n" +
                "- Protected declarations: " + protectedCount
        );
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        final List<String> dependencies = new ArrayList<>();
        String list;
        String render;
        String outline;
        boolean interfaces = true;
        boolean strict = false;
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--dependency":
                        out.dependencies.add(requireValue(args, ++i, "--dependency"));
                        break;
                    case "--list":
                        out.list = parseKind(requireValue(args, ++i, "--list"));
                        break;
                    case "--render":
                        out.render = requireValue(args, ++i, "--render");
                        break;
                    case "--outline":
                        out.outline = requireValue(args, ++i, "--outline");
                        break;
                    case "--interfaces":
                        out.interfaces = parseBoolean(requireValue(args, ++i, "--interfaces"), "--interfaces");
                        break;
                    case "--strict":
                        out.strict = parseBoolean(requireValue(args, ++i, "--strict"), "--strict");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String parseKind(String v) {
            String s = v.trim().toLowerCase();
            if (!LIST_KINDS.contains(s)) {
                throw new IllegalArgumentException("Invalid kind for --list: " + v);
            }
            return s;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "swan-model\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar swan-model-cli.jar --source <dir> [--dependency <dir>]... [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <dir>         Root folder containing the project's .swan/.swani files (required)\n" +
                    "  --dependency <dir>     Root folder of a dependency (repeatable). Searched after --source.\n" +
                    "  --list <kind>          Print declarations of a kind:\n" +
                    "                         all | node | function | signature | type | const | sensor |\n" +
                    "                         group | use | protected\n" +
                    "  --render <path>        Print the declaration at a path such as P::Q::Op or P::Q::Op::x\n" +
                    "  --outline <file.json>  Write a JSON outline of all modules\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths *relative to each root* using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --interfaces <bool>    Load .swani interfaces. Default: true.\n" +
                    "  --strict <bool>        Fail on duplicate declarations instead of warning. Default: false.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 usage error, 2 I/O or model error, 4 path not found.\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/swan-model-cli.jar --source assets --list node\n" +
                    "  java -jar target/swan-model-cli.jar assets --render Ctrl::Pid\n" +
                    "  java -jar target/swan-model-cli.jar --source . --exclude \"**/generated/**\" --outline out/outline.json\n"
            );
        }
    }
}
