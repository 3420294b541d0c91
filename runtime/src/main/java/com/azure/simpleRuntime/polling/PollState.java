package com.azure.simpleRuntime.polling;

import com.azure.simpleRuntime.http.TransportResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Progress of one long running operation. Written only by the polling loop; readable from other
 * threads for diagnostics.
 */
public class PollState {
    private final Clock clock;
    private final Instant startedAt;
    private volatile PollStatus status = PollStatus.IN_PROGRESS;
    private volatile int pollCount;
    private volatile TransportResponse lastResponse;

    public PollState() {
        this(Clock.systemUTC());
    }

    PollState(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    void update(PollStatus status, TransportResponse response) {
        this.status = status;
        this.lastResponse = response;
    }

    void recordPoll(PollStatus status, TransportResponse response) {
        this.pollCount++;
        update(status, response);
    }

    public PollStatus getStatus() {
        return status;
    }

    public int getPollCount() {
        return pollCount;
    }

    public TransportResponse getLastResponse() {
        return lastResponse;
    }

    public Duration getElapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    @Override
    public String toString() {
        return "PollState{status=" + status + ", pollCount=" + pollCount + ", elapsed=" + getElapsed() + "}";
    }
}
