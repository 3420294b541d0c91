package com.azure.simpleRuntime.exceptions;

import java.util.OptionalInt;

/**
 * Root of every failure surfaced by the runtime.
 *
 * <p>The pager and the poller record how far they got before the failure, so callers can tell a
 * failure on the first page apart from one on the fortieth.
 */
public class ServiceClientException extends Exception {
    private int pagesProcessed = -1;
    private int pollsCompleted = -1;

    public ServiceClientException(String message) {
        super(message);
    }

    public ServiceClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public ServiceClientException(Throwable cause) {
        super(cause);
    }

    public ServiceClientException withPagesProcessed(int pagesProcessed) {
        this.pagesProcessed = pagesProcessed;
        return this;
    }

    public ServiceClientException withPollsCompleted(int pollsCompleted) {
        this.pollsCompleted = pollsCompleted;
        return this;
    }

    public OptionalInt getPagesProcessed() {
        return pagesProcessed < 0 ? OptionalInt.empty() : OptionalInt.of(pagesProcessed);
    }

    public OptionalInt getPollsCompleted() {
        return pollsCompleted < 0 ? OptionalInt.empty() : OptionalInt.of(pollsCompleted);
    }
}
