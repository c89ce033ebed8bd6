package io.deskrelay.error;

public final class RetryExhaustedException extends DeskRelayException {
    private final int attempts;

    public RetryExhaustedException(int attempts, HandlerExecutionException lastError) {
        super("retry exhausted after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
