package lexicon.jdbc.queue;

import lexicon.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes acknowledged rows of a {@link JdbcMessageQueue} that are older
 * than the retention period.
 *
 * <p>Runs on a single daemon thread. A failed cycle is logged and the next one runs on
 * schedule.
 *
 * @see JdbcMessageQueue#purgeAcked(Duration)
 */
public final class AckedMessagePurgeScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AckedMessagePurgeScheduler.class);

  private final JdbcMessageQueue queue;
  private final Duration retention;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private AckedMessagePurgeScheduler(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.retention = Objects.requireNonNull(builder.retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the purge loop. Calling it again is a no-op.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("AckedMessagePurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("lexicon-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    log.info("Purging acked messages older than {} every {}s", retention, intervalSeconds);
  }

  /**
   * Runs one purge cycle on the calling thread.
   *
   * @return rows deleted, {@code 0} when closed or when the cycle failed
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      return queue.purgeAcked(retention);
    } catch (RuntimeException e) {
      log.error("Purge cycle failed", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link AckedMessagePurgeScheduler}. */
  public static final class Builder {
    private JdbcMessageQueue queue;
    private Duration retention = Duration.ofDays(7);
    private long intervalSeconds = 3600;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder queue(JdbcMessageQueue queue) {
      this.queue = queue;
      return this;
    }

    /** Age after acknowledgement at which a row may be deleted. Defaults to 7 days. */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /** Seconds between cycles. Defaults to {@code 3600}. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link AckedMessagePurgeScheduler#start()} to begin.
     *
     * @throws NullPointerException     if {@code queue} or {@code retention} is null
     * @throws IllegalArgumentException if {@code retention} is negative or {@code intervalSeconds <= 0}
     */
    public AckedMessagePurgeScheduler build() {
      return new AckedMessagePurgeScheduler(this);
    }
  }
}
