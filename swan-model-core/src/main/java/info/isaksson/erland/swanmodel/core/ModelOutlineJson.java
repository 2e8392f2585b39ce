package info.isaksson.erland.swanmodel.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization of a {@link ModelOutline}.
 *
 * <p>Writing is deterministic: properties have a fixed order and map keys are sorted.</p>
 */
public final class ModelOutlineJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ModelOutlineJson() {}

    public static String toJsonString(ModelOutline outline) throws IOException {
        if (outline == null) throw new IllegalArgumentException("outline is null");
        return MAPPER.writer(PRETTY).writeValueAsString(outline) + "\n";
    }

    public static void write(ModelOutline outline, Path path) throws IOException {
        if (outline == null) throw new IllegalArgumentException("outline is null");
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, outline);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // The caller owns the stream.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
