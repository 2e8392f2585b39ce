package info.isaksson.erland.swanmodel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmp;

    private Path project;

    @BeforeEach
    void writeProject() throws IOException {
        project = Files.createDirectories(tmp.resolve("assets"));
        Files.writeString(project.resolve("Ctrl.swan"), """
                const GAIN: float64 = 2.0;
                node Pid (e: float64;) returns (u: float64;)
                  u = GAIN * e;
                const = ;
                """);
        Files.writeString(project.resolve("Ctrl.swani"), """
                node Pid (e: float64;) returns (u: float64;);
                """);
    }

    /** Runs the CLI and returns what it printed on standard output. */
    private static String runCapturing(int expectedCode, String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            assertEquals(expectedCode, Main.run(args));
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void listsDeclarationsOfAKind() {
        String out = runCapturing(0, "--source", project.toString(), "--list", "node");

        assertTrue(out.contains("node Ctrl::Pid"), out);
        assertFalse(out.contains("GAIN"), out);
        assertFalse(out.contains("node signature"), out);
    }

    @Test
    void listsSignaturesOnlyWhenInterfacesAreLoaded() {
        assertTrue(runCapturing(0, project.toString(), "--list", "signature").contains("node signature Ctrl::Pid"));
        assertTrue(runCapturing(0, project.toString(), "--list", "signature", "--interfaces", "false").isBlank());
    }

    @Test
    void rendersDeclarationAtPath() {
        String out = runCapturing(0, "--source", project.toString(), "--render", "Ctrl::GAIN");

        assertEquals("GAIN: float64 = 2.0", out.strip());
    }

    @Test
    void unknownPathExitsWithFour() {
        runCapturing(4, "--source", project.toString(), "--render", "Ctrl::Missing");
    }

    @Test
    void writesOutlineAndSummary() throws IOException {
        Path outline = tmp.resolve("out/outline.json");

        String out = runCapturing(0, "--source", project.toString(), "--outline", outline.toString());

        assertTrue(Files.exists(outline));
        String json = Files.readString(outline);
        assertTrue(json.contains("\"Ctrl::Pid\""), json);
        assertTrue(json.endsWith("\n"));
        assertTrue(out.contains("- Files: 2"), out);
        assertTrue(out.contains("- Protected declarations: 1"), out);
    }

    @Test
    void dependenciesAreSearchedAfterTheProject() throws IOException {
        Path lib = Files.createDirectories(tmp.resolve("lib"));
        Files.writeString(lib.resolve("Util.swan"), "const ONE: int32 = 1;\n");

        String out = runCapturing(0, project.toString(), "--dependency", lib.toString(), "--list", "const");

        assertTrue(out.indexOf("Ctrl::GAIN") < out.indexOf("Util::ONE"), out);
    }

    @Test
    void missingSourceIsAUsageError() {
        runCapturing(1, "--list", "all");
        runCapturing(1, "--source", tmp.resolve("nope").toString());
    }
}
