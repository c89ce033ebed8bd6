package io.deskrelay.error;

public final class QueueClosedException extends DeskRelayException {
    public QueueClosedException() {
        super("local task queue is closed");
    }
}
