package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.launchkit.domain.common.LaunchKitException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A deep-merge patch plus audit entries to append.
 *
 * Audit entries are appended by the store against the current record, so concurrent writers
 * never overwrite each other's entries.
 */
public final class LaunchPackPatch {

    private final ObjectNode changes;
    private final List<AuditEntry> auditAppends;

    private LaunchPackPatch(ObjectNode changes, List<AuditEntry> auditAppends) {
        this.changes = changes;
        this.auditAppends = auditAppends;
    }

    public static LaunchPackPatch empty() {
        return new LaunchPackPatch(LaunchPackJson.mapper().createObjectNode(), new ArrayList<>());
    }

    public static LaunchPackPatch of(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw LaunchKitException.validation("VALIDATION_ERROR", "Patch must be a JSON object",
                Map.of("errors", List.of("patch: expected object")));
        }
        return new LaunchPackPatch(((ObjectNode) json).deepCopy(), new ArrayList<>());
    }

    /**
     * Set a value at a dotted path, e.g. {@code "launch.status"}. A null value removes the field.
     */
    public LaunchPackPatch set(String path, Object value) {
        String[] parts = path.split("\\.");
        ObjectNode node = changes;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode child = node.get(parts[i]);
            if (child == null || !child.isObject()) {
                child = node.putObject(parts[i]);
            }
            node = (ObjectNode) child;
        }
        node.set(parts[parts.length - 1], LaunchPackJson.mapper().valueToTree(value));
        return this;
    }

    public LaunchPackPatch checklist(String item, boolean value) {
        return set("ops.checklist." + item, value);
    }

    public LaunchPackPatch appendAudit(AuditEntry entry) {
        auditAppends.add(entry);
        return this;
    }

    public ObjectNode changes() {
        return changes.deepCopy();
    }

    public List<AuditEntry> auditAppends() {
        return List.copyOf(auditAppends);
    }

    @Override
    public String toString() {
        return "LaunchPackPatch{changes=" + changes + ", auditAppends=" + auditAppends.size() + "}";
    }
}
