package com.azure.simpleRuntime;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and one invocation.
 *
 * <p>Waits performed through {@link #await(Duration)} return as soon as the token is cancelled,
 * and callbacks registered with {@link #onCancel(Runnable)} abort in-flight transport calls.
 */
public final class CancellationToken {
    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<OnceCallback> callbacks = new CopyOnWriteArrayList<>();

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (!cancellable || latch.getCount() == 0) {
            return;
        }
        latch.countDown();
        for (OnceCallback callback : callbacks) {
            callback.run();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0 && cancellable;
    }

    /**
     * Waits for the given duration or until cancelled, whichever comes first.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        if (!cancellable) {
            Thread.sleep(saturatedMillis(duration));
            return false;
        }
        return latch.await(saturatedMillis(duration), TimeUnit.MILLISECONDS);
    }

    private static long saturatedMillis(Duration duration) {
        if (duration.getSeconds() >= Long.MAX_VALUE / 1000) {
            return Long.MAX_VALUE;
        }
        return duration.toMillis();
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately when already cancelled.
     * Closing the returned registration removes the callback.
     */
    public Registration onCancel(Runnable callback) {
        if (!cancellable) {
            return () -> { };
        }
        OnceCallback registered = new OnceCallback(callback);
        callbacks.add(registered);
        if (isCancelled() && callbacks.remove(registered)) {
            registered.run();
        }
        return () -> callbacks.remove(registered);
    }

    // cancel() and a late onCancel() may both reach the same registration
    private static final class OnceCallback implements Runnable {
        private final Runnable callback;
        private final AtomicBoolean ran = new AtomicBoolean();

        private OnceCallback(Runnable callback) {
            this.callback = callback;
        }

        @Override
        public void run() {
            if (ran.compareAndSet(false, true)) {
                callback.run();
            }
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
