package io.deskrelay.runtime;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoffMs < 1 || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("invalid backoff bounds: base=" + baseBackoffMs + " max=" + maxBackoffMs);
        }
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitterBound = Math.min(250L, backoff / 4L);
        long jitter = jitterBound <= 0L ? 0L : ThreadLocalRandom.current().nextLong(0L, jitterBound + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
