package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Launch sub-state of a LaunchPack.
 *
 * Allowed moves: DRAFT → READY | FAILED, READY → LAUNCHED | FAILED, FAILED → READY.
 * LAUNCHED is terminal.
 */
public enum LaunchStatus {
    DRAFT("draft"),
    READY("ready"),
    LAUNCHED("launched"),
    FAILED("failed");

    private final String wire;

    LaunchStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static LaunchStatus fromWire(String value) {
        for (LaunchStatus s : values()) {
            if (s.wire.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown launch status: " + value);
    }

    public boolean canMoveTo(LaunchStatus next) {
        if (this == next) {
            return true;
        }
        return switch (this) {
            case DRAFT -> next == READY || next == FAILED;
            case READY -> next == LAUNCHED || next == FAILED;
            case FAILED -> next == READY;
            case LAUNCHED -> false;
        };
    }
}
