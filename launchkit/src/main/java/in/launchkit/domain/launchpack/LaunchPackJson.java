package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.launchkit.domain.common.LaunchKitException;

import java.util.List;
import java.util.Map;

/**
 * JSON codec for the LaunchPack document.
 *
 * Unknown keys are rejected. Timestamps are written as ISO-8601 UTC strings.
 */
public final class LaunchPackJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toTree(LaunchPack pack) {
        return MAPPER.valueToTree(pack);
    }

    public static LaunchPack fromTree(JsonNode tree) {
        try {
            return MAPPER.treeToValue(tree, LaunchPack.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw schemaError(e);
        }
    }

    public static LaunchPackInput readInput(String json) {
        try {
            return MAPPER.readValue(json, LaunchPackInput.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw schemaError(e);
        }
    }

    public static LaunchPackInput inputFromTree(JsonNode tree) {
        try {
            return MAPPER.treeToValue(tree, LaunchPackInput.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw schemaError(e);
        }
    }

    /**
     * Serialize a stored document. Failures here mean a programming error, not bad input.
     */
    public static String write(LaunchPack pack) {
        try {
            return MAPPER.writeValueAsString(pack);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize LaunchPack " + pack.id(), e);
        }
    }

    public static LaunchPack read(String json) {
        try {
            return MAPPER.readValue(json, LaunchPack.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored LaunchPack document is unreadable", e);
        }
    }

    private static LaunchKitException schemaError(Exception e) {
        String message = e instanceof JsonProcessingException
            ? ((JsonProcessingException) e).getOriginalMessage()
            : e.getMessage();
        return LaunchKitException.validation("VALIDATION_ERROR",
            "Invalid LaunchPack document: " + message,
            Map.of("errors", List.of(String.valueOf(message))));
    }

    private LaunchPackJson() {}
}
