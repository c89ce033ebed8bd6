package io.deskrelay.error;

public final class StoreUnavailableException extends DeskRelayException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
