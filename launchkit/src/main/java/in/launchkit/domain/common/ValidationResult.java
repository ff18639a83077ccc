package in.launchkit.domain.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of LaunchPack document validation.
 *
 * @param passed true when no errors were recorded
 * @param errors field-level problems in the order they were found
 */
public record ValidationResult(boolean passed, List<FieldError> errors) {

    public record FieldError(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<FieldError> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * Raise a VALIDATION error if this result did not pass.
     */
    public void throwIfFailed() {
        if (passed) {
            return;
        }
        List<String> messages = errors.stream().map(FieldError::toString).toList();
        throw LaunchKitException.validation("VALIDATION_ERROR",
            "Invalid LaunchPack: " + String.join("; ", messages),
            Map.of("errors", messages));
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final List<FieldError> errors = new ArrayList<>();

        public Builder addError(String field, String message) {
            errors.add(new FieldError(field, message));
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return errors.isEmpty() ? pass() : fail(errors);
        }
    }
}
