package info.isaksson.erland.swanmodel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void parsesBasicArgsAndExcludeForms() {
        String[] args = new String[] {
                "--source", "assets",
                "--dependency", "libs/a",
                "--dependency", "libs/b",
                "--exclude", "**/generated/**",
                "--exclude=legacy",
                "--list", "Node",
                "--render", "Ctrl::Pid",
                "--outline", "target/outline.json",
                "--interfaces", "no",
                "--strict", "true"
        };

        Main.CliArgs parsed = Main.CliArgs.parse(args);
        assertEquals("assets", parsed.source);
        assertEquals(List.of("libs/a", "libs/b"), parsed.dependencies);
        assertEquals(List.of("**/generated/**", "legacy"), parsed.excludes);
        assertEquals("node", parsed.list);
        assertEquals("Ctrl::Pid", parsed.render);
        assertEquals("target/outline.json", parsed.outline);
        assertFalse(parsed.interfaces);
        assertTrue(parsed.strict);
        assertFalse(parsed.help);
    }

    @Test
    void acceptsBarePathAsSourceShorthand() {
        Main.CliArgs parsed = Main.CliArgs.parse(new String[] {"assets"});
        assertEquals("assets", parsed.source);
        assertTrue(parsed.interfaces);
        assertFalse(parsed.strict);
    }

    @Test
    void rejectsUnknownListKind() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Main.CliArgs.parse(new String[] {"--source", "x", "--list", "classes"}));
        assertTrue(ex.getMessage().contains("--list"));
    }

    @Test
    void parseBooleanRejectsInvalidValues() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Main.CliArgs.parse(new String[] {"--source", "x", "--strict", "maybe"}));
        assertTrue(ex.getMessage().contains("Invalid boolean"));
    }

    @Test
    void unknownFlagThrows() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--nope"}));
    }

    @Test
    void missingValueThrows() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--render"}));
    }

    @Test
    void secondBarePathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a", "b"}));
    }

    @Test
    void signatureKindMatchesBothSignatureFlavours() {
        assertTrue(Main.matchesKind("signature", "node signature"));
        assertTrue(Main.matchesKind("signature", "function signature"));
        assertFalse(Main.matchesKind("node", "node signature"));
        assertTrue(Main.matchesKind("all", "protected"));
    }
}
