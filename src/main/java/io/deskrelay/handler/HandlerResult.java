package io.deskrelay.handler;

public record HandlerResult(
        boolean success,
        String output,
        String error
) {
    public static HandlerResult ok(String output) {
        return new HandlerResult(true, output, null);
    }

    public static HandlerResult fail(String error) {
        return new HandlerResult(false, null, error);
    }
}
