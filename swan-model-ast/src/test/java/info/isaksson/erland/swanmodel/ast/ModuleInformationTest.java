package info.isaksson.erland.swanmodel.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleInformationTest {

    @Test
    void readsModelTreeVersion() throws Exception {
        ModuleInformation info = ModuleInformation.parse("""
                {"ModelTree": {"Properties": {"version": "2.0"}}, "Other": 1}
                """);

        assertTrue(info.isPresent());
        assertEquals("2.0", info.modelTreeVersion().orElseThrow());
        assertTrue(info.has("Other"));
        assertEquals(1, info.get("Other").orElseThrow().asInt());
    }

    @Test
    void blankTextIsAnEmptyDocument() throws Exception {
        ModuleInformation info = ModuleInformation.parse("\n");

        assertTrue(info.isPresent());
        assertTrue(info.isEmpty());
        assertTrue(info.modelTreeVersion().isEmpty());
    }

    @Test
    void nonObjectIsRejected() {
        assertThrows(JsonProcessingException.class, () -> ModuleInformation.parse("[1, 2]"));
        assertThrows(JsonProcessingException.class, () -> ModuleInformation.parse("{broken"));
    }

    @Test
    void absentInformationIsNotPresent() {
        assertFalse(ModuleInformation.none().isPresent());
        assertTrue(ModuleInformation.unreadable("x").isPresent());
        assertEquals("x", ModuleInformation.unreadable("x").raw());
    }
}
