package io.deskrelay.error;

import java.time.Duration;

public final class HandlerTimeoutException extends HandlerExecutionException {
    public HandlerTimeoutException(String type, Duration timeout) {
        super("handler '" + type + "' timed out after " + timeout);
    }
}
