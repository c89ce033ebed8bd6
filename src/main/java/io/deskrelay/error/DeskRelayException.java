package io.deskrelay.error;

public class DeskRelayException extends RuntimeException {
    public DeskRelayException(String message) {
        super(message);
    }

    public DeskRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
