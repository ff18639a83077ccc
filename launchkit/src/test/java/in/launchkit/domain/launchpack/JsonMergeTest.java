package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JsonMergeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    public void testNestedSiblingsSurvive() throws Exception {
        JsonNode base = json("{\"brand\":{\"name\":\"Dog\",\"ticker\":\"DOG\"},\"links\":{\"x\":\"https://x.com/dog\"}}");
        JsonNode patch = json("{\"brand\":{\"tagline\":\"woof\"}}");

        JsonNode merged = JsonMerge.merge(base, patch);

        assertEquals("Dog", merged.path("brand").path("name").asText());
        assertEquals("DOG", merged.path("brand").path("ticker").asText());
        assertEquals("woof", merged.path("brand").path("tagline").asText());
        assertEquals("https://x.com/dog", merged.path("links").path("x").asText());
    }

    @Test
    public void testArraysReplaceWholesale() throws Exception {
        JsonNode base = json("{\"x\":{\"thread\":[\"a\",\"b\",\"c\"]}}");
        JsonNode patch = json("{\"x\":{\"thread\":[\"z\"]}}");

        JsonNode merged = JsonMerge.merge(base, patch);

        assertEquals(1, merged.path("x").path("thread").size());
        assertEquals("z", merged.path("x").path("thread").get(0).asText());
    }

    @Test
    public void testNullRemovesKey() throws Exception {
        JsonNode base = json("{\"launch\":{\"status\":\"failed\",\"error_code\":\"LAUNCH_FAILED\"}}");
        JsonNode patch = json("{\"launch\":{\"status\":\"ready\",\"error_code\":null}}");

        JsonNode merged = JsonMerge.merge(base, patch);

        assertEquals("ready", merged.path("launch").path("status").asText());
        assertFalse(merged.path("launch").has("error_code"));
    }

    @Test
    public void testInputsAreNotModified() throws Exception {
        JsonNode base = json("{\"a\":{\"b\":1}}");
        JsonNode patch = json("{\"a\":{\"c\":2}}");

        JsonMerge.merge(base, patch);

        assertEquals("{\"a\":{\"b\":1}}", base.toString());
        assertEquals("{\"a\":{\"c\":2}}", patch.toString());
    }
}
