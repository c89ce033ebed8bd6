package io.deskrelay.error;

public class HandlerExecutionException extends DeskRelayException {
    public HandlerExecutionException(String message) {
        super(message);
    }

    public HandlerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
