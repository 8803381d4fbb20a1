package com.automagik.telemetry.client.batch;

import com.automagik.telemetry.model.Batch;
import com.automagik.telemetry.model.ResourceContext;
import com.automagik.telemetry.model.TelemetryEvent;
import com.automagik.telemetry.transport.SendOutcome;
import com.automagik.telemetry.transport.Transport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory queue in front of a {@link Transport}. Flushes when the queue reaches {@code batchSize} and on a
 * fixed interval. All sends run on one daemon worker, so at most one flush is ever in flight; a flush
 * requested meanwhile joins the running one. Failed batches are dropped, not re-queued.
 *
 * <p>A flush triggered by size only takes whole batches and leaves the remainder queued; timer, explicit
 * and shutdown flushes take everything.
 */
@Slf4j
public final class BatchScheduler implements AutoCloseable {

    public enum State {
        IDLE,
        ACCUMULATING,
        FLUSHING,
        STOPPED
    }

    private final Transport transport;
    private final ResourceContext resource;
    private final int batchSize;
    private final boolean verbose;
    private final ScheduledExecutorService worker;
    private final ScheduledFuture<?> ticker;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    private final Object lock = new Object();
    // guarded by lock
    private List<TelemetryEvent> queue = new ArrayList<>();
    private CompletableFuture<Void> inFlight;
    private State state = State.IDLE;

    public BatchScheduler(
            Transport transport, ResourceContext resource, int batchSize, Duration flushInterval, boolean verbose) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.batchSize = batchSize;
        this.verbose = verbose;
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "automagik-telemetry-" + resource.getProjectName());
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1, flushInterval.toMillis());
        this.ticker = worker.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Queues an event; never blocks on I/O. A full queue triggers a flush on the worker.
     *
     * @return {@code false} if the scheduler is stopped and the event was dropped
     */
    public boolean enqueue(TelemetryEvent event) {
        boolean full;
        synchronized (lock) {
            if (state == State.STOPPED) return false;
            queue.add(event);
            if (state == State.IDLE) state = State.ACCUMULATING;
            full = queue.size() >= batchSize;
        }
        if (full) requestFlush(false);
        return true;
    }

    /** Starts a flush of everything queued, or returns the flush already running. */
    public CompletableFuture<Void> flush() {
        return requestFlush(true);
    }

    private CompletableFuture<Void> requestFlush(boolean drainAll) {
        CompletableFuture<Void> f;
        synchronized (lock) {
            if (inFlight != null) return inFlight;
            f = new CompletableFuture<>();
            inFlight = f;
            if (state != State.STOPPED) state = State.FLUSHING;
        }
        try {
            worker.execute(() -> runFlush(f, drainAll));
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                inFlight = null;
            }
            f.complete(null);
        }
        return f;
    }

    /**
     * Flushes until the queue is empty or {@code timeout} elapses.
     *
     * @return whether the queue was drained in time
     */
    public boolean flushAndWait(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            CompletableFuture<Void> f = flush();
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return false;
            try {
                f.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                log.debug("Flush completed exceptionally", e.getCause());
            }
            if (pending() == 0) return true;
        }
    }

    /**
     * Stops the timer, drains what it can within {@code timeout}, then stops the worker. Later events
     * are dropped. Safe to call more than once.
     */
    public void shutdown(Duration timeout) {
        if (!shutdown.compareAndSet(false, true)) return;
        synchronized (lock) {
            state = State.STOPPED;
        }
        ticker.cancel(false);
        boolean drained = flushAndWait(timeout);
        worker.shutdownNow();
        int dropped;
        synchronized (lock) {
            dropped = queue.size();
            queue = new ArrayList<>();
        }
        if (!drained || dropped > 0) {
            report("Telemetry shutdown timed out; {} queued events dropped", dropped);
        }
        try {
            transport.close();
        } catch (Exception e) {
            log.debug("Error closing transport {}", transport.name(), e);
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    public int pending() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    private void tick() {
        if (pending() > 0) flush();
    }

    private void runFlush(CompletableFuture<Void> f, boolean drainAll) {
        List<TelemetryEvent> drained;
        synchronized (lock) {
            int take = drainAll ? queue.size() : queue.size() - queue.size() % batchSize;
            if (take == queue.size()) {
                drained = queue;
                queue = new ArrayList<>();
            } else {
                drained = new ArrayList<>(queue.subList(0, take));
                queue = new ArrayList<>(queue.subList(take, queue.size()));
            }
        }
        try {
            sendInChunks(drained);
        } catch (Throwable t) {
            log.warn("Telemetry flush failed unexpectedly: {}", t.getMessage(), t);
        } finally {
            boolean again;
            synchronized (lock) {
                inFlight = null;
                if (state != State.STOPPED) state = queue.isEmpty() ? State.IDLE : State.ACCUMULATING;
                again = state != State.STOPPED && queue.size() >= batchSize;
            }
            f.complete(null);
            if (again) requestFlush(false);
        }
    }

    private void sendInChunks(List<TelemetryEvent> events) {
        int total = events.size();
        for (int i = 0; i < total; i += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                report("Telemetry flush interrupted; {} events dropped", total - i);
                return;
            }
            int toIndex = Math.min(i + batchSize, total);
            Batch batch = new Batch(resource, events.subList(i, toIndex));
            SendOutcome outcome = transport.send(batch);
            if (outcome.success()) {
                log.debug("Sent {} events via {} in {} attempt(s)", batch.size(), transport.name(), outcome.attempts());
            } else {
                report(
                        "Dropping batch of {} events after {} attempt(s) via {}: {}",
                        batch.size(),
                        outcome.attempts(),
                        transport.name(),
                        String.valueOf(outcome.lastError()));
            }
        }
    }

    private void report(String format, Object... args) {
        if (verbose) {
            log.warn(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
