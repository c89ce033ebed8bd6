package io.deskrelay.error;

public final class DelegationException extends DeskRelayException {
    public DelegationException(String message, Throwable cause) {
        super(message, cause);
    }
}
