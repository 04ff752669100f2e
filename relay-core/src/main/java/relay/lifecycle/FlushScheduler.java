package relay.lifecycle;

import relay.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the flush task on a fixed delay and once more when the process shuts down.
 *
 * <p>{@link #start()} does nothing while the relay is inactive (disabled or without a sink):
 * no timer thread is created and the {@link Lifecycle} is not called.
 *
 * <p>{@link #stop()} cancels future runs but lets an in-flight flush complete. The shutdown
 * hook stays registered until {@link #close()}.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()}, {@link #stop()} and
 * {@link #close()} methods are synchronized.
 */
public final class FlushScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FlushScheduler.class.getName());

  private final Runnable flushTask;
  private final long intervalMs;
  private final Lifecycle lifecycle;
  private final BooleanSupplier active;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> flushFuture;
  private Lifecycle.Registration shutdownRegistration;

  private FlushScheduler(Builder builder) {
    this.flushTask = Objects.requireNonNull(builder.flushTask, "flushTask");
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.intervalMs = builder.intervalMs;
    this.lifecycle = builder.lifecycle != null ? builder.lifecycle : JvmShutdownLifecycle.INSTANCE;
    this.active = builder.active != null ? builder.active : () -> true;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic flush and registers the shutdown flush. Subsequent calls are no-ops
   * while running.
   */
  public synchronized void start() {
    if (flushFuture != null) {
      return;
    }
    if (!active.getAsBoolean()) {
      logger.log(Level.FINE, "Relay inactive; flush scheduler not started");
      return;
    }
    try {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-flush-"));
      flushFuture = scheduler.scheduleWithFixedDelay(this::runFlush, intervalMs, intervalMs,
          TimeUnit.MILLISECONDS);
      if (shutdownRegistration == null) {
        shutdownRegistration = lifecycle.onShutdown("relay-shutdown-flush", this::runFlush);
      }
      logger.log(Level.INFO, "Flush scheduler started (interval {0} ms)", intervalMs);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to start flush scheduler", e);
    }
  }

  /**
   * Cancels future periodic flushes. An in-flight flush is not interrupted.
   */
  public synchronized void stop() {
    if (flushFuture != null) {
      flushFuture.cancel(false);
      flushFuture = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      scheduler = null;
      logger.log(Level.INFO, "Flush scheduler stopped");
    }
  }

  /**
   * Stops the scheduler and unregisters the shutdown flush.
   */
  @Override
  public synchronized void close() {
    stop();
    if (shutdownRegistration != null) {
      try {
        shutdownRegistration.cancel();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to unregister shutdown flush", e);
      }
      shutdownRegistration = null;
    }
  }

  public boolean isRunning() {
    return flushFuture != null;
  }

  private void runFlush() {
    try {
      flushTask.run();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Scheduled flush failed", e);
    }
  }

  /** Builder for {@link FlushScheduler}. */
  public static final class Builder {
    private Runnable flushTask;
    private long intervalMs = 5000;
    private Lifecycle lifecycle;
    private BooleanSupplier active;

    private Builder() {}

    /**
     * Sets the action run on every tick and at shutdown.
     *
     * <p><b>Required.</b>
     *
     * @param flushTask the flush action
     * @return this builder
     */
    public Builder flushTask(Runnable flushTask) {
      this.flushTask = flushTask;
      return this;
    }

    /**
     * Sets the delay between the end of one flush and the start of the next.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param intervalMs flush interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets where the shutdown flush is registered.
     *
     * <p>Optional. Defaults to {@link JvmShutdownLifecycle#INSTANCE}.
     *
     * @param lifecycle the lifecycle
     * @return this builder
     */
    public Builder lifecycle(Lifecycle lifecycle) {
      this.lifecycle = lifecycle;
      return this;
    }

    /**
     * Sets the check consulted by {@link #start()}.
     *
     * <p>Optional. Defaults to always active.
     *
     * @param active whether flushing would reach a sink
     * @return this builder
     */
    public Builder active(BooleanSupplier active) {
      this.active = active;
      return this;
    }

    public FlushScheduler build() {
      return new FlushScheduler(this);
    }
  }
}
