package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-channel publish state.
 *
 * Allowed moves: IDLE → IN_PROGRESS, IN_PROGRESS → PUBLISHED | FAILED, FAILED → IN_PROGRESS.
 * PUBLISHED is terminal.
 */
public enum PublishStatus {
    IDLE("idle"),
    IN_PROGRESS("in_progress"),
    PUBLISHED("published"),
    FAILED("failed");

    private final String wire;

    PublishStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static PublishStatus fromWire(String value) {
        for (PublishStatus s : values()) {
            if (s.wire.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown publish status: " + value);
    }

    public boolean canMoveTo(PublishStatus next) {
        if (this == next) {
            return true;
        }
        return switch (this) {
            case IDLE -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == PUBLISHED || next == FAILED;
            case FAILED -> next == IN_PROGRESS;
            case PUBLISHED -> false;
        };
    }
}
