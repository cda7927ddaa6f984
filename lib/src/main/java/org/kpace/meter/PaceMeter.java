package org.kpace.meter;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.kpace.annotations.VisibleForTesting;
import org.kpace.meter.enums.MeterState;
import org.kpace.reporter.LoggingReporter;
import org.kpace.reporter.Reporter;

/**
 * Default {@link Pace} implementation backed by a lock-guarded accumulator and a one-shot timer
 * that is re-armed after every flush.
 *
 * <p>Key features include:
 *
 * <ul>
 *   <li>Lock-protected accumulation from any number of producer threads
 *   <li>Automatic flush every interval, with timeframes within 10ms of the interval snapped to it
 *   <li>Pause and resume, optionally with a new interval
 *   <li>Manual reports with a one-off reporter
 *   <li>Explicit disposal that releases the timer thread
 * </ul>
 *
 * <p>The reporter runs while the lock is held. A slow reporter delays concurrent steps and the
 * next automatic flush.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * // Meter with its own timer thread
 * var pace = PaceMeter.builder("uploads")
 *     .withInterval(Duration.ofMinutes(1))
 *     .withReporter(new StallAwareReporter(logger))
 *     .build();
 *
 * // Many meters sharing one timer thread
 * var scheduler = Executors.newSingleThreadScheduledExecutor();
 * var reads = PaceMeter.builder("reads").withScheduler(scheduler).build();
 * var writes = PaceMeter.builder("writes").withScheduler(scheduler).build();
 * }</pre>
 */
public final class PaceMeter implements Pace {

  private static final Logger LOGGER = System.getLogger(PaceMeter.class.getName());

  /** Elapsed times closer than this to the interval are reported as exactly the interval. */
  static final Duration SNAP_TOLERANCE = Duration.ofMillis(10);

  private final String label;
  private final Reporter reporter;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final ReentrantLock lock = new ReentrantLock();

  // Guarded by lock
  private double value;
  private Duration interval;
  private Instant lastFlushAt;
  private MeterState state = MeterState.RUNNING;
  private ScheduledFuture<?> pendingTick;
  private long generation;

  /**
   * Creates a builder for a meter with the given label.
   *
   * @param label display label used in reports
   * @return a new builder instance
   */
  public static Builder builder(final String label) {
    return new Builder(label);
  }

  /** Builder for {@link PaceMeter} instances. */
  public static class Builder {

    private final String label;
    private Duration interval = Duration.ofSeconds(1);
    private Reporter reporter;
    private Clock clock = Clock.systemUTC();
    private ScheduledExecutorService scheduler;

    private Builder(final String label) {
      this.label = Objects.requireNonNull(label, "Label cannot be null");
    }

    /**
     * Sets the time between automatic reports. Defaults to one second.
     *
     * @param interval the positive interval
     * @return this builder instance
     */
    public Builder withInterval(final Duration interval) {
      this.interval = Objects.requireNonNull(interval, "Interval cannot be null");
      if (interval.isNegative() || interval.isZero()) {
        throw new IllegalArgumentException("Interval must be positive");
      }
      return this;
    }

    /**
     * Sets the reporter receiving every automatic report.
     *
     * @param reporter the reporter (defaults to a {@link LoggingReporter} if null)
     * @return this builder instance
     */
    public Builder withReporter(final Reporter reporter) {
      this.reporter = reporter;
      return this;
    }

    /**
     * Sets the clock used to measure timeframes.
     *
     * @param clock the clock
     * @return this builder instance
     */
    public Builder withClock(final Clock clock) {
      this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
      return this;
    }

    /**
     * Runs the timer on a caller-owned scheduler instead of a dedicated thread. The meter never
     * shuts this scheduler down.
     *
     * @param scheduler the scheduler
     * @return this builder instance
     */
    public Builder withScheduler(final ScheduledExecutorService scheduler) {
      this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
      return this;
    }

    /**
     * Builds the meter and arms its timer.
     *
     * @return a running meter
     */
    public PaceMeter build() {
      final var meter = new PaceMeter(this);
      meter.start();
      return meter;
    }
  }

  private PaceMeter(final Builder builder) {
    this.label = builder.label;
    this.interval = builder.interval;
    this.reporter = builder.reporter != null ? builder.reporter : new LoggingReporter();
    this.clock = builder.clock;
    this.ownsScheduler = builder.scheduler == null;
    this.scheduler =
      ownsScheduler
        ? Executors.newSingleThreadScheduledExecutor(r -> {
          final var thread = new Thread(r, "pace-" + builder.label);
          thread.setDaemon(true);
          return thread;
        })
        : builder.scheduler;
  }

  private void start() {
    lock.lock();
    try {
      lastFlushAt = clock.instant();
      scheduleTick();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void step(final double n) {
    lock.lock();
    try {
      value += n;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void pause() {
    lock.lock();
    try {
      cancelTick();
      flush(reporter);
      if (state == MeterState.RUNNING) {
        state = MeterState.PAUSED;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalStateException if the meter has been closed
   */
  @Override
  public void resume(final Duration newInterval) {
    lock.lock();
    try {
      if (state == MeterState.CLOSED) {
        throw new IllegalStateException("Cannot restart a closed meter");
      }
      cancelTick();
      flush(reporter);
      if (newInterval != null && !newInterval.isNegative() && !newInterval.isZero()) {
        interval = newInterval;
      }
      state = MeterState.RUNNING;
      scheduleTick();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void report(final Reporter override) {
    lock.lock();
    try {
      cancelTick();
      flush(override != null ? override : reporter);
      if (state == MeterState.RUNNING) {
        scheduleTick();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (state == MeterState.CLOSED) {
        return;
      }
      cancelTick();
      flush(reporter);
      state = MeterState.CLOSED;
    } finally {
      lock.unlock();
    }

    if (ownsScheduler) {
      stopScheduler();
    }
  }

  /**
   * Returns the display label.
   *
   * @return the label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the interval between automatic reports.
   *
   * @return the current interval
   */
  public Duration interval() {
    lock.lock();
    try {
      return interval;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the lifecycle state.
   *
   * @return the current state
   */
  public MeterState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Checks whether automatic reporting is paused.
   *
   * @return true if paused, false otherwise
   */
  public boolean isPaused() {
    return state() == MeterState.PAUSED;
  }

  @VisibleForTesting
  void tick(final long expectedGeneration) {
    lock.lock();
    try {
      // superseded by a manual report, pause, resume or close
      if (expectedGeneration != generation || state != MeterState.RUNNING) {
        return;
      }
      flush(reporter);
      scheduleTick();
    } finally {
      lock.unlock();
    }
  }

  private void flush(final Reporter target) {
    final var now = clock.instant();
    var timeframe = Duration.between(lastFlushAt, now);
    if (timeframe.minus(interval).abs().compareTo(SNAP_TOLERANCE) < 0) {
      timeframe = interval;
    }

    try {
      target.report(label, timeframe, value);
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Error reporting pace for " + label, e);
    }

    value = 0;
    // time spent inside the reporter belongs to no timeframe
    lastFlushAt = clock.instant();
  }

  private void scheduleTick() {
    final var tickGeneration = ++generation;
    try {
      pendingTick = scheduler.schedule(() -> tick(tickGeneration), interval.toNanos(), TimeUnit.NANOSECONDS);
    } catch (final RejectedExecutionException e) {
      LOGGER.log(Level.WARNING, "Scheduler rejected the next report of {0}", label);
      pendingTick = null;
    }
  }

  private void cancelTick() {
    generation++;
    if (pendingTick != null) {
      pendingTick.cancel(false);
      pendingTick = null;
    }
  }

  private void stopScheduler() {
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.WARNING, "Interrupted while stopping the timer of {0}", label);
      scheduler.shutdownNow();
    }
  }
}
