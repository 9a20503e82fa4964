package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * Exit-code ranges mapped to exit actions, for example {@code RESCHEDULE: "1-5,10"}.
 * Ranges are inclusive; actions are matched in declaration order of {@link ExitAction}.
 */
public record ExitActionRules(Map<ExitAction, String> ranges) implements Serializable {

    public static final ExitActionRules NONE = new ExitActionRules(Map.of());

    public ExitActionRules {
        ranges = ranges == null ? Map.of() : Map.copyOf(ranges);
        for (Map.Entry<ExitAction, String> entry : ranges.entrySet()) {
            validate(entry.getKey(), entry.getValue());
        }
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Action for an exit code, if any range covers it.
     */
    public Optional<ExitAction> actionFor(int exitCode) {
        for (ExitAction action : ExitAction.values()) {
            String spec = ranges.get(action);
            if (spec != null && covers(spec, exitCode)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    private static boolean covers(String spec, int exitCode) {
        for (String part : spec.split(",")) {
            String trimmed = part.trim();
            int dash = trimmed.indexOf('-', 1);
            if (dash > 0) {
                int low = Integer.parseInt(trimmed.substring(0, dash).trim());
                int high = Integer.parseInt(trimmed.substring(dash + 1).trim());
                if (exitCode >= low && exitCode <= high) {
                    return true;
                }
            } else if (Integer.parseInt(trimmed) == exitCode) {
                return true;
            }
        }
        return false;
    }

    private static void validate(ExitAction action, String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Exit code range for " + action + " cannot be empty");
        }
        try {
            covers(spec, Integer.MIN_VALUE);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid exit code range for " + action + ": '" + spec + "'", e);
        }
    }
}
