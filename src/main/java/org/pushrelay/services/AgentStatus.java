package org.pushrelay.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Receipt and error timestamps of the agent. Written by the delivery task, read by the
 * health endpoint.
 */
public class AgentStatus {

    /** An error counts as recent if it happened after the last receipt minus this window. */
    static final Duration ERROR_GRACE = Duration.ofMinutes(2);

    private final Clock clock;
    private final AtomicReference<Instant> lastReceiveAt = new AtomicReference<>();
    private final AtomicReference<LastError> lastError = new AtomicReference<>();

    /** Time and message of one failure, swapped in together. */
    public record LastError(Instant at, String message) {}

    public AgentStatus(Clock clock) {
        this.clock = clock;
    }

    public void recordReceive() {
        lastReceiveAt.set(clock.instant());
    }

    public void recordError(String message) {
        lastError.set(new LastError(clock.instant(), message));
    }

    public Instant lastReceiveAt() { return lastReceiveAt.get(); }

    /** @return the most recent failure, or null when none was recorded */
    public LastError lastError() { return lastError.get(); }

    public Instant lastErrorAt() {
        LastError error = lastError.get();
        return error == null ? null : error.at();
    }

    public String lastErrorMessage() {
        LastError error = lastError.get();
        return error == null ? null : error.message();
    }

    public boolean hasRecentError() {
        Instant received = lastReceiveAt.get();
        LastError error = lastError.get();
        return received != null && error != null && error.at().isAfter(received.minus(ERROR_GRACE));
    }

    /**
     * Healthy iff an event was received within the expected period and no error
     * has been recorded since.
     */
    public boolean isWorking(int expectedReceivePeriodInDays) {
        Instant received = lastReceiveAt.get();
        if (received == null) return false;
        Instant cutoff = clock.instant().minus(Duration.ofDays(expectedReceivePeriodInDays));
        return received.isAfter(cutoff) && !hasRecentError();
    }
}
