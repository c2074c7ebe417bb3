package org.endlesssource.mediastate.poll;

import org.endlesssource.mediastate.api.Category;
import org.endlesssource.mediastate.api.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one fixed-delay loop per category. The fetch runs on a worker pool under a timeout;
 * a poll that overruns is abandoned and its result discarded. A category never has two
 * polls in flight: a poll counts until its result or failure has been applied, and an
 * abandoned fetch counts until it returns.
 */
public final class PollScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PollScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Map<Category, CategoryLoop<?>> loops = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public PollScheduler(ScheduledExecutorService scheduler, ExecutorService workers) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
    }

    /**
     * Register a category loop without starting it.
     */
    public <T> void register(Category category, Duration timeout, PollTask<T> task, PollOutcome<T> outcome) {
        Objects.requireNonNull(category, "category must not be null");
        CategoryLoop<T> loop = new CategoryLoop<>(category, timeout, task, outcome);
        CategoryLoop<?> previous = loops.put(category, loop);
        if (previous != null) {
            previous.cancel();
        }
    }

    /**
     * Start or restart a registered loop; the first poll runs immediately.
     */
    public void start(Category category, Duration interval) {
        CategoryLoop<?> loop = requireLoop(category);
        if (closed) {
            return;
        }
        long delayMs = interval.toMillis();
        // the first tick may cancel before the assignment below, so both hold the loop's lock
        synchronized (loop) {
            loop.cancel();
            loop.future = scheduler.scheduleWithFixedDelay(loop::tick, 0L, delayMs, TimeUnit.MILLISECONDS);
        }
        logger.debug("Scheduled {} polling every {} ms", category.id(), delayMs);
    }

    public void stop(Category category) {
        CategoryLoop<?> loop = loops.get(category);
        if (loop != null && loop.cancel()) {
            logger.debug("Stopped {} polling", category.id());
        }
    }

    public boolean isRunning(Category category) {
        CategoryLoop<?> loop = loops.get(category);
        return loop != null && loop.future != null && !loop.future.isDone();
    }

    /**
     * Run one poll of a category on the calling thread, with the same timeout and outcome handling.
     * @return false when a previous poll of the category is still in flight
     */
    public boolean pollNow(Category category) {
        return requireLoop(category).tick();
    }

    /**
     * Change the timeout of a registered loop.
     */
    public void setTimeout(Category category, Duration timeout) {
        requireLoop(category).timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        loops.values().forEach(CategoryLoop::cancel);
        scheduler.shutdownNow();
        workers.shutdownNow();
    }

    private CategoryLoop<?> requireLoop(Category category) {
        CategoryLoop<?> loop = loops.get(category);
        if (loop == null) {
            throw new IllegalStateException("No poll registered for " + category.id());
        }
        return loop;
    }

    private final class CategoryLoop<T> {
        private final Category category;
        private final PollTask<T> task;
        private final PollOutcome<T> outcome;
        private final AtomicBoolean inFlight = new AtomicBoolean();
        private volatile Duration timeout;
        private volatile ScheduledFuture<?> future;

        CategoryLoop(Category category, Duration timeout, PollTask<T> task, PollOutcome<T> outcome) {
            this.category = category;
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            this.task = Objects.requireNonNull(task, "task must not be null");
            this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        }

        boolean tick() {
            if (closed) {
                return false;
            }
            if (!inFlight.compareAndSet(false, true)) {
                logger.debug("Skipping {} poll, previous poll still running", category.id());
                return false;
            }
            Claim claim = new Claim();
            Future<T> pending;
            try {
                pending = workers.submit(() -> {
                    if (!claim.begin()) {
                        return null;
                    }
                    try {
                        return task.poll();
                    } finally {
                        claim.release();
                    }
                });
            } catch (RuntimeException ex) {
                inFlight.set(false);
                logger.debug("Could not submit {} poll: {}", category.id(), ex.getMessage());
                return false;
            }

            try {
                T result;
                try {
                    result = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException ex) {
                    abandon(pending, claim);
                    fail(new TransportException(TransportException.Kind.TIMEOUT,
                            category.id() + " poll exceeded " + timeout.toMillis() + " ms", ex));
                    return true;
                } catch (InterruptedException ex) {
                    abandon(pending, claim);
                    Thread.currentThread().interrupt();
                    return true;
                } catch (CancellationException ex) {
                    abandon(pending, claim);
                    return true;
                } catch (ExecutionException ex) {
                    fail(asTransportException(ex.getCause()));
                    return true;
                }

                try {
                    outcome.onSuccess(result);
                } catch (RuntimeException ex) {
                    logger.warn("Failed to apply {} poll result", category.id(), ex);
                }
                return true;
            } finally {
                claim.release();
            }
        }

        private void abandon(Future<T> pending, Claim claim) {
            pending.cancel(true);
            // a worker that never started will not release its share
            if (claim.begin()) {
                claim.release();
            }
        }

        private void fail(TransportException failure) {
            if (failure.isUnauthorized()) {
                cancel();
            }
            try {
                outcome.onFailure(failure);
            } catch (RuntimeException ex) {
                logger.warn("Failed to record {} poll failure", category.id(), ex);
            }
        }

        private TransportException asTransportException(Throwable cause) {
            if (cause instanceof TransportException transport) {
                return transport;
            }
            logger.warn("Unexpected error while polling {}", category.id(), cause);
            return new TransportException(TransportException.Kind.UNREACHABLE,
                    "Unexpected " + category.id() + " poll error: " + cause, cause);
        }

        synchronized boolean cancel() {
            ScheduledFuture<?> current = future;
            future = null;
            return current != null && current.cancel(false);
        }

        /**
         * Held by the ticking thread until the result is applied and by the worker until the fetch
         * returns. The category is free again once both have let go.
         */
        private final class Claim {
            private final AtomicInteger holders = new AtomicInteger(2);
            private final AtomicBoolean started = new AtomicBoolean();

            boolean begin() {
                return started.compareAndSet(false, true);
            }

            void release() {
                if (holders.decrementAndGet() == 0) {
                    inFlight.set(false);
                }
            }
        }
    }
}
