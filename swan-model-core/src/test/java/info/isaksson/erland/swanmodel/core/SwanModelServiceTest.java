package info.isaksson.erland.swanmodel.core;

import info.isaksson.erland.swanmodel.ast.ConstDecl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SwanModelServiceTest {

    @Test
    void loadsOwnSourcesBeforeDependencies(@TempDir Path tmp) throws Exception {
        Path project = tmp.resolve("project");
        Path lib = tmp.resolve("lib");
        Files.createDirectories(project);
        Files.createDirectories(lib);
        Files.writeString(project.resolve("App.swan"), "const K: int32 = Util::ONE;\n");
        Files.writeString(project.resolve("App.swani"), "const K: int32;\n");
        Files.writeString(lib.resolve("Util.swan"), "const ONE: int32 = 1;\n");

        SwanModelResult result = new SwanModelService().load(project, List.of(lib), new SwanModelOptions());

        assertEquals(2, result.ownFiles.size());
        assertEquals(1, result.dependencyFiles.size());
        assertEquals(0, result.model.parseCount());

        List<String> names = new ArrayList<>();
        for (ConstDecl c : result.model.constants()) names.add(c.fullPath());
        assertEquals(List.of("App::K", "App::K", "Util::ONE"), names);
        assertEquals("ONE", result.model.findByPath("Util::ONE").orElseThrow().name());
    }

    @Test
    void optionsNarrowTheScan(@TempDir Path tmp) throws Exception {
        Path project = Files.createDirectories(tmp.resolve("project"));
        Path lib = Files.createDirectories(tmp.resolve("lib"));
        Files.createDirectories(project.resolve("generated"));
        Files.writeString(project.resolve("App.swan"), "");
        Files.writeString(project.resolve("App.swani"), "");
        Files.writeString(project.resolve("generated/Gen.swan"), "");
        Files.writeString(lib.resolve("Util.swan"), "");

        SwanModelOptions options = new SwanModelOptions();
        options.includeInterfaces = false;
        options.followDependencies = false;
        options.excludeGlobs.add("**/generated/**");
        SwanModelResult result = new SwanModelService().load(project, List.of(lib), options);

        assertEquals(List.of(project.resolve("App.swan")), result.ownFiles);
        assertTrue(result.dependencyFiles.isEmpty());
        assertEquals(1, result.model.sources().size());
    }

    @Test
    void rejectsMissingRoot() {
        assertThrows(IllegalArgumentException.class, () -> new SwanModelService().load(null, List.of(), null));
    }
}
