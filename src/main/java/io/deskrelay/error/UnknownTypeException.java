package io.deskrelay.error;

public final class UnknownTypeException extends ValidationException {
    private final String type;

    public UnknownTypeException(String type) {
        super("type", "no handler registered for type '" + type + "'");
        this.type = type;
    }

    public String type() {
        return type;
    }
}
