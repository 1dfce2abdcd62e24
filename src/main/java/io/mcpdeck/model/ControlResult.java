package io.mcpdeck.model;

public record ControlResult(
        boolean ok,
        ControlOutcome outcome,
        String message,
        Long pid
) {
    public static ControlResult ok(ControlOutcome outcome, String message) {
        return new ControlResult(true, outcome, message, null);
    }

    public static ControlResult ok(ControlOutcome outcome, String message, long pid) {
        return new ControlResult(true, outcome, message, pid);
    }

    public static ControlResult fail(ControlOutcome outcome, String message) {
        return new ControlResult(false, outcome, message, null);
    }
}
