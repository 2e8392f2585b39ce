package info.isaksson.erland.swanmodel.io;

import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SwanSourceScannerTest {

    private static String rel(Path root, Path p) {
        return root.relativize(p).toString().replace("\\", "/");
    }

    @Test
    void scansUnitsDeterministically_andExcludesCommonBuildDirs(@TempDir Path tmp) throws Exception {
        Path lib = tmp.resolve("assets/lib");
        Path target = tmp.resolve("target/gen");
        Files.createDirectories(lib);
        Files.createDirectories(target);

        Files.writeString(lib.resolve("Lib-B.swan"), "const K: int32 = 1;");
        Files.writeString(lib.resolve("Lib-A.swan"), "const K: int32 = 2;");
        Files.writeString(lib.resolve("notes.txt"), "not a unit");
        Files.writeString(target.resolve("Gen.swan"), "const G: int32 = 0;");

        List<Path> files = SwanSourceScanner.scan(tmp, List.of(), false);

        assertEquals(2, files.size());
        assertEquals("assets/lib/Lib-A.swan", rel(tmp, files.get(0)));
        assertEquals("assets/lib/Lib-B.swan", rel(tmp, files.get(1)));
    }

    @Test
    void skipsInterfacesByDefault_butCanInclude(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("M.swan"), "");
        Files.writeString(tmp.resolve("M.swani"), "");

        assertEquals(1, SwanSourceScanner.scan(tmp, List.of(), false).size());
        assertEquals(2, SwanSourceScanner.scan(tmp, List.of(), true).size());
    }

    @Test
    void supportsGlobAndDirectoryExcludes(@TempDir Path tmp) throws Exception {
        Path keep = tmp.resolve("src/Keep.swan");
        Path gen = tmp.resolve("src/generated/Gen.swan");
        Path old = tmp.resolve("legacy/Old.swan");
        Files.createDirectories(gen.getParent());
        Files.createDirectories(old.getParent());
        Files.writeString(keep, "");
        Files.writeString(gen, "");
        Files.writeString(old, "");

        List<Path> files = SwanSourceScanner.scan(tmp, List.of("**/generated/**", "legacy"), false);

        assertEquals(1, files.size());
        assertEquals("src/Keep.swan", rel(tmp, files.get(0)));
    }

    @Test
    void sourcesTakeTheirModuleNameFromTheFileName(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("Ctrl-Pid.swani"), "-- version swan: 2024.1\n");

        List<SwanSource> sources = SwanSourceScanner.sources(tmp, List.of(), true);

        assertEquals(1, sources.size());
        SwanSource s = sources.get(0);
        assertEquals("Ctrl::Pid", s.moduleName().toString());
        assertEquals(ModuleKind.INTERFACE, s.kind());
        assertEquals("2024.1", s.swanVersion().orElseThrow());
    }
}
