package io.deskrelay.error;

public final class DuplicateTypeException extends DeskRelayException {
    public DuplicateTypeException(String type) {
        super("handler type already registered: " + type);
    }
}
