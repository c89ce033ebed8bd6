package io.deskrelay.model;

public record TaskResult(
        String output,
        String error
) {
    public static TaskResult ok(String output) {
        return new TaskResult(output, null);
    }

    public static TaskResult failed(String error) {
        return new TaskResult(null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
