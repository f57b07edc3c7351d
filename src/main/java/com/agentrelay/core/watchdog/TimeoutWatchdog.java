package com.agentrelay.core.watchdog;

import com.agentrelay.core.events.WorkerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Enforces an inactivity timeout and a hard wall-clock timeout on one running unit.
 * <p>
 * The inactivity timer is re-armed by every activity signal; the hard timer is fixed at
 * {@link #start()} and cannot be postponed by activity. A warning fires {@code warnLead}
 * before either deadline and a heartbeat fires every {@code progressInterval}.
 * <p>
 * On timeout the watchdog captures {@link PartialResults}, reports a {@link TimeoutEnvelope}
 * through {@code onTimeout}, then terminates the unit (graceful first, forced after
 * {@code killGrace}). At most one terminal outcome is reported: whichever of {@link #stop()}
 * and {@link #abort(TimeoutKind)} runs first wins.
 */
public class TimeoutWatchdog {

    private static final Logger log = LoggerFactory.getLogger(TimeoutWatchdog.class);

    private final String id;
    private final MonitoredProcess process;
    private final WatchdogConfig config;
    private final ScheduledExecutorService scheduler;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicInteger eventCount = new AtomicInteger();
    private final List<ScheduledFuture<?>> timers = new CopyOnWriteArrayList<>();
    private final Deque<WorkerEvent> recentEvents = new ArrayDeque<>();
    private final TailBuffer stdoutTail;
    private final TailBuffer stderrTail;

    private volatile long startedAtNanos;
    private volatile long lastActivityNanos;
    private volatile Instant lastActivityAt;
    private volatile boolean idleWarned;
    private volatile ScheduledFuture<?> idleCheck;

    public TimeoutWatchdog(String id, MonitoredProcess process, WatchdogConfig config,
                           ScheduledExecutorService scheduler) {
        this.id = id;
        this.process = process;
        this.config = config;
        this.scheduler = scheduler;
        this.stdoutTail = new TailBuffer(config.maxTailChars());
        this.stderrTail = new TailBuffer(config.maxTailChars());
        this.startedAtNanos = System.nanoTime();
        this.lastActivityNanos = startedAtNanos;
        this.lastActivityAt = Instant.now();
    }

    /**
     * Arms the timers. Elapsed and idle time are measured from this call.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        startedAtNanos = System.nanoTime();
        lastActivityNanos = startedAtNanos;
        lastActivityAt = Instant.now();

        long hardNanos = config.hardTimeout().toNanos();
        long warnLeadNanos = config.warnLead().toNanos();
        try {
            timers.add(scheduler.schedule(() -> abort(TimeoutKind.HARD), hardNanos, TimeUnit.NANOSECONDS));
            if (warnLeadNanos > 0 && hardNanos > warnLeadNanos) {
                timers.add(scheduler.schedule(this::warnHard, hardNanos - warnLeadNanos, TimeUnit.NANOSECONDS));
            }
            long interval = config.progressInterval().toNanos();
            timers.add(scheduler.scheduleAtFixedRate(this::heartbeat, interval, interval, TimeUnit.NANOSECONDS));
            scheduleIdleCheck(firstIdleCheckDelay());
        } catch (RejectedExecutionException e) {
            log.error("Watchdog scheduler rejected timers for {}; unit will run unbounded", id, e);
        }
        log.debug("Watchdog started for {} (idle={}ms, hard={}ms)", id,
                config.idleTimeout().toMillis(), config.hardTimeout().toMillis());
    }

    // ── Activity ─────────────────────────────────────────────────────────

    public void recordActivity() {
        lastActivityNanos = System.nanoTime();
        lastActivityAt = Instant.now();
        idleWarned = false;
    }

    public void recordStdout(String chunk) {
        stdoutTail.append(chunk);
        recordActivity();
    }

    public void recordStderr(String chunk) {
        stderrTail.append(chunk);
        recordActivity();
    }

    public void recordEvent(WorkerEvent event) {
        synchronized (recentEvents) {
            recentEvents.addLast(event);
            while (recentEvents.size() > config.maxEvents()) {
                recentEvents.removeFirst();
            }
        }
        eventCount.incrementAndGet();
        recordActivity();
    }

    // ── Terminal outcomes ────────────────────────────────────────────────

    /**
     * Cancels all timers after a normal completion or cancellation.
     *
     * @return true if this call claimed the terminal outcome; false if a timeout already fired
     */
    public boolean stop() {
        if (!finished.compareAndSet(false, true)) {
            return false;
        }
        cancelTimers();
        log.debug("Watchdog stopped for {} after {}ms", id, elapsedMs());
        return true;
    }

    /**
     * Aborts the unit as timed out. Also used for manual aborts.
     *
     * @return the envelope, or empty if the watchdog had already finished
     */
    public Optional<TimeoutEnvelope> abort(TimeoutKind kind) {
        if (!finished.compareAndSet(false, true)) {
            return Optional.empty();
        }
        cancelTimers();

        long elapsed = elapsedMs();
        long idle = idleMs();
        String message = switch (kind) {
            case INACTIVITY -> "Worker %s produced no output within the allowed inactivity window (%ds) [%s]"
                    .formatted(id, config.idleTimeout().toSeconds(), kind.code());
            case HARD -> "Worker %s exceeded the maximum allowed wall-clock time (%ds) [%s]"
                    .formatted(id, config.hardTimeout().toSeconds(), kind.code());
        };
        TimeoutEnvelope envelope = new TimeoutEnvelope(kind, message, elapsed, idle, partialResults());
        log.warn("{} (elapsed={}ms, idle={}ms, events={})", message, elapsed, idle, eventCount.get());

        deliverSafely(config.onTimeout(), envelope);
        ProcessTerminator.terminate(id, process, config.killGrace(), scheduler);
        return Optional.of(envelope);
    }

    public boolean isFinished() {
        return finished.get();
    }

    public PartialResults partialResults() {
        List<WorkerEvent> events;
        synchronized (recentEvents) {
            events = new ArrayList<>(recentEvents);
        }
        return new PartialResults(events, eventCount.get(), stdoutTail.toString(), stderrTail.toString(),
                lastActivityAt);
    }

    public long elapsedMs() {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos).toMillis();
    }

    public long idleMs() {
        return Duration.ofNanos(System.nanoTime() - lastActivityNanos).toMillis();
    }

    // ── Timers ───────────────────────────────────────────────────────────

    private long firstIdleCheckDelay() {
        long idleNanos = config.idleTimeout().toNanos();
        long warnAt = idleNanos - config.warnLead().toNanos();
        return warnAt > 0 ? warnAt : idleNanos;
    }

    private void scheduleIdleCheck(long delayNanos) {
        if (finished.get()) {
            return;
        }
        try {
            idleCheck = scheduler.schedule(this::checkIdle, Math.max(delayNanos, 0), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Watchdog scheduler rejected idle check for {}", id);
        }
    }

    /**
     * Idle checks are scheduled lazily against the last activity time rather than
     * rescheduled on every chunk of output.
     */
    private void checkIdle() {
        if (finished.get()) {
            return;
        }
        long idleTimeout = config.idleTimeout().toNanos();
        long idle = System.nanoTime() - lastActivityNanos;
        if (idle >= idleTimeout) {
            abort(TimeoutKind.INACTIVITY);
            return;
        }
        long warnAt = idleTimeout - config.warnLead().toNanos();
        if (warnAt > 0 && !idleWarned && idle >= warnAt) {
            idleWarned = true;
            deliverSafely(config.onWarning(), new TimeoutWarning(id, TimeoutKind.INACTIVITY, elapsedMs(),
                    Duration.ofNanos(idleTimeout - idle).toMillis()));
        }
        long next = (warnAt > 0 && !idleWarned && idle < warnAt) ? warnAt - idle : idleTimeout - idle;
        scheduleIdleCheck(next);
    }

    private void warnHard() {
        if (finished.get()) {
            return;
        }
        long remaining = Math.max(0, config.hardTimeout().toMillis() - elapsedMs());
        log.info("Worker {} will hit its hard timeout in {}ms", id, remaining);
        deliverSafely(config.onWarning(), new TimeoutWarning(id, TimeoutKind.HARD, elapsedMs(), remaining));
    }

    private void heartbeat() {
        if (finished.get()) {
            return;
        }
        deliverSafely(config.onProgress(), new Heartbeat(id, elapsedMs(), idleMs(), eventCount.get()));
    }

    private void cancelTimers() {
        timers.forEach(t -> t.cancel(false));
        timers.clear();
        ScheduledFuture<?> check = idleCheck;
        if (check != null) {
            check.cancel(false);
        }
    }

    private <T> void deliverSafely(Consumer<T> callback, T value) {
        try {
            callback.accept(value);
        } catch (Exception e) {
            log.warn("Watchdog callback for {} threw: {}", id, e.getMessage(), e);
        }
    }
}
