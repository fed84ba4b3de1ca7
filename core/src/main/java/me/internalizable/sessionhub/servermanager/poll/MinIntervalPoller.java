package me.internalizable.sessionhub.servermanager.poll;

import me.internalizable.sessionhub.servermanager.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an asynchronous function repeatedly with a minimum interval between
 * the start of one run and the start of the next.
 *
 * <p>The next run is scheduled once the previous one completed, with a delay
 * of {@code max(0, minInterval - elapsed)}. Runs therefore never overlap, and
 * a run that takes longer than the interval is followed immediately.</p>
 *
 * <p>The first run is always handed to the scheduler, even with zero delay,
 * so {@link #start} never calls the function on the caller's stack.</p>
 *
 * <p>A run that throws or returns a failed future is treated as a bug in the
 * supplied function: the error is logged and polling stops.</p>
 */
public class MinIntervalPoller implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MinIntervalPoller.class);

    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();

    // Guarded by lock. Bumped on every start/stop so stale chains drop out.
    private long generation = 0;
    private boolean running = false;
    private ScheduledFuture<?> pending;

    /**
     * Create a poller.
     *
     * @param scheduler scheduler the runs are dispatched on
     */
    public MinIntervalPoller(@Nonnull ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Start polling, replacing any previous polling function.
     *
     * @param run function to run; its future signals completion of one run
     * @param minIntervalMillis minimum time between the starts of two runs
     */
    public void start(@Nonnull Supplier<CompletableFuture<Void>> run, long minIntervalMillis) {
        Objects.requireNonNull(run, "run");
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("minIntervalMillis must not be negative: " + minIntervalMillis);
        }

        synchronized (lock) {
            cancelPending();
            long current = ++generation;
            running = true;
            schedule(current, run, minIntervalMillis, 0);
        }
    }

    /**
     * Stop polling. A run that is already queued will not start; a run that
     * is in progress finishes but is not followed by another one.
     */
    public void stop() {
        synchronized (lock) {
            running = false;
            generation++;
            cancelPending();
        }
    }

    /**
     * Check if polling is active.
     *
     * @return true between {@link #start} and {@link #stop} (or a failed run)
     */
    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    @Override
    public void close() {
        stop();
    }

    // Caller holds lock
    private void schedule(long owner, Supplier<CompletableFuture<Void>> run, long interval, long delayMillis) {
        try {
            pending = scheduler.schedule(() -> poll(owner, run, interval), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Scheduler rejected next poll, stopping");
            running = false;
            pending = null;
        }
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private boolean isCurrent(long owner) {
        synchronized (lock) {
            return running && generation == owner;
        }
    }

    private void poll(long owner, Supplier<CompletableFuture<Void>> run, long interval) {
        if (!isCurrent(owner)) {
            return;
        }

        long start = System.nanoTime();
        CompletableFuture<Void> result;
        try {
            result = Objects.requireNonNull(run.get(), "polling function returned null");
        } catch (RuntimeException e) {
            fail(owner, e);
            return;
        }

        result.whenComplete((ignored, error) -> {
            if (error != null) {
                fail(owner, error);
                return;
            }

            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            long wait = Math.max(0, interval - elapsed);

            synchronized (lock) {
                if (running && generation == owner) {
                    schedule(owner, run, interval, wait);
                }
            }
        });
    }

    private void fail(long owner, Throwable error) {
        synchronized (lock) {
            if (generation != owner) {
                return;
            }
            running = false;
            pending = null;
        }
        LOGGER.error("Polling function failed, polling stopped", Futures.unwrap(error));
    }

    /**
     * Poll a predicate until it resolves {@code true}.
     *
     * <p>The returned poll completes with {@code true} once the predicate
     * held, fails with the predicate's error if it throws or fails, and fails
     * with {@link PollingCancelledException} on timeout or cancel. Polling and
     * the timeout timer are torn down as soon as the result settles.</p>
     *
     * @param scheduler scheduler to poll on
     * @param predicate asynchronous predicate
     * @param intervalMillis minimum interval between predicate calls
     * @param timeoutMillis optional timeout, null to poll until cancelled
     * @return the running poll
     */
    @Nonnull
    public static CancellablePoll pollUntilTrue(
            @Nonnull ScheduledExecutorService scheduler,
            @Nonnull Supplier<CompletableFuture<Boolean>> predicate,
            long intervalMillis,
            @Nullable Long timeoutMillis) {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(predicate, "predicate");

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        MinIntervalPoller poller = new MinIntervalPoller(scheduler);

        // Start before arming the teardown hook
        poller.start(() -> {
            if (result.isDone()) {
                poller.stop();
                return CompletableFuture.completedFuture(null);
            }

            CompletableFuture<Boolean> check;
            try {
                check = Objects.requireNonNull(predicate.get(), "predicate returned null");
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return CompletableFuture.completedFuture(null);
            }

            return check.handle((isTrue, error) -> {
                if (error != null) {
                    result.completeExceptionally(Futures.unwrap(error));
                } else if (Boolean.TRUE.equals(isTrue)) {
                    result.complete(true);
                }
                return null;
            });
        }, intervalMillis);

        ScheduledFuture<?> timer = timeoutMillis == null
                ? null
                : scheduler.schedule(
                        () -> result.completeExceptionally(new PollingCancelledException()),
                        timeoutMillis,
                        TimeUnit.MILLISECONDS);

        result.whenComplete((ignored, error) -> {
            poller.stop();
            if (timer != null) {
                timer.cancel(false);
            }
        });

        return new CancellablePoll(result);
    }
}
