package info.isaksson.erland.swanmodel.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * JSON document stored after the {@code __END__} line of a module. The raw text is kept
 * so that rendering reproduces it unchanged.
 */
public final class ModuleInformation {

    public static final String END_MARKER = "__END__";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ModuleInformation NONE = new ModuleInformation(null, JsonNodeFactory.instance.objectNode());

    private final String raw;
    private final ObjectNode root;

    private ModuleInformation(String raw, ObjectNode root) {
        this.raw = raw;
        this.root = root;
    }

    public static ModuleInformation none() {
        return NONE;
    }

    /**
     * Parses the text following the end marker.
     *
     * @throws JsonProcessingException when the text is not a JSON object
     */
    public static ModuleInformation parse(String raw) throws JsonProcessingException {
        if (raw == null) throw new IllegalArgumentException("raw is null");
        if (raw.isBlank()) return new ModuleInformation(raw, JsonNodeFactory.instance.objectNode());
        JsonNode node = MAPPER.readTree(raw);
        if (!(node instanceof ObjectNode obj)) {
            throw new JsonProcessingException("module information is not a JSON object") {};
        }
        return new ModuleInformation(raw, obj);
    }

    /** Keeps unreadable text for rendering but exposes no keys. */
    public static ModuleInformation unreadable(String raw) {
        if (raw == null) throw new IllegalArgumentException("raw is null");
        return new ModuleInformation(raw, JsonNodeFactory.instance.objectNode());
    }

    /** True when the module had an end marker. */
    public boolean isPresent() {
        return raw != null;
    }

    public String raw() {
        return raw;
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    public boolean has(String key) {
        return root.has(key);
    }

    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(root.get(key));
    }

    /** {@code ModelTree.Properties.version}, when present. */
    public Optional<String> modelTreeVersion() {
        JsonNode v = root.path("ModelTree").path("Properties").path("version");
        return v.isValueNode() ? Optional.of(v.asText()) : Optional.empty();
    }
}
