package info.isaksson.erland.swanmodel.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.parse.SwanParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModelOutlineJsonTest {

    private static SwanModel model() {
        return new SwanModel(List.of(
                SwanSource.ofText("App", ModuleKind.BODY, """
                        use Lib;
                        const A: int32 = 1; B: int32 = 2;
                        function F (x: int32;) returns (y: int32;)
                          y = x;
                        const = ;
                        """),
                SwanSource.ofText("App", ModuleKind.INTERFACE, """
                        node N (i: int32;) returns (o: int32;);
                        """)), new SwanParser());
    }

    @Test
    void outlineListsEveryMemberInSourceOrder() throws Exception {
        ModelOutline outline = ModelOutline.of(model());

        assertEquals(2, outline.modules.size());
        ModelOutline.ModuleEntry body = outline.modules.get(0);
        assertEquals("App", body.name);
        assertEquals("body", body.kind);
        assertFalse(body.unstructured);

        List<String> names = body.declarations.stream().map(d -> d.kind + " " + d.name).toList();
        assertEquals(List.of("use Lib", "const A", "const B", "function F", "protected <protected>"), names);
        assertEquals("App::B", body.declarations.get(2).path);
        assertEquals(2, body.declarations.get(1).line);

        ModelOutline.DeclarationEntry sig = outline.modules.get(1).declarations.get(0);
        assertEquals("node signature", sig.kind);
        assertEquals("App::N", sig.path);
    }

    @Test
    void jsonIsStableAndEndsWithNewline() throws Exception {
        String first = ModelOutlineJson.toJsonString(ModelOutline.of(model()));
        String second = ModelOutlineJson.toJsonString(ModelOutline.of(model()));

        assertEquals(first, second);
        assertTrue(first.endsWith("}\n"));
        assertTrue(first.indexOf("\"name\"") < first.indexOf("\"kind\""));
        assertFalse(first.contains("\"version\""), "absent version is left out");

        JsonNode root = new ObjectMapper().readTree(first);
        assertEquals("F", root.get("modules").get(0).get("declarations").get(3).get("name").asText());
    }

    @Test
    void writeCreatesParentDirectories(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("out/nested/outline.json");
        ModelOutline outline = ModelOutline.of(model());

        ModelOutlineJson.write(outline, out);

        assertTrue(Files.exists(out));
        assertEquals(ModelOutlineJson.toJsonString(outline), Files.readString(out));
    }
}
