package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Recursive structural merge of JSON documents.
 *
 * Objects merge key by key, arrays and scalars replace wholesale, and an explicit null removes the key.
 * Neither input is modified.
 */
public final class JsonMerge {

    public static JsonNode merge(JsonNode base, JsonNode patch) {
        if (patch == null || patch.isMissingNode()) {
            return base == null ? null : base.deepCopy();
        }
        if (!patch.isObject() || base == null || !base.isObject()) {
            return patch.deepCopy();
        }

        ObjectNode result = ((ObjectNode) base).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (value.isNull()) {
                result.remove(key);
            } else if (value.isObject() && result.path(key).isObject()) {
                result.set(key, merge(result.get(key), value));
            } else {
                result.set(key, value.deepCopy());
            }
        }
        return result;
    }

    private JsonMerge() {}
}
