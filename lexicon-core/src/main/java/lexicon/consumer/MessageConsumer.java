package lexicon.consumer;

import lexicon.Envelope;
import lexicon.EnvelopeCodec;
import lexicon.ValidationException;
import lexicon.registry.HandlerRegistry;
import lexicon.registry.PurposeHandler;
import lexicon.spi.Delivery;
import lexicon.spi.MessageQueue;
import lexicon.spi.MetricsExporter;
import lexicon.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker pool that takes envelopes off a {@link MessageQueue} and routes them to
 * the handler registered for their purpose.
 *
 * <p>Each message goes through received, dispatched, succeeded or failed, and
 * acknowledged. Acknowledgement happens in a {@code finally} block, so a message is
 * acknowledged whether its body was malformed, its purpose unknown, or its handler
 * threw. Delivery is therefore at-most-once: a failed message is logged and lost.
 *
 * <p>Create instances via {@link #builder()}. Workers start polling as soon as the
 * consumer is built. This class is thread-safe and implements {@link AutoCloseable}
 * for graceful shutdown with a configurable drain timeout.
 *
 * @see MessageConsumer.Builder
 */
public final class MessageConsumer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);

  private final MessageQueue queue;
  private final HandlerRegistry registry;
  private final EnvelopeCodec codec;
  private final MetricsExporter metrics;
  private final Duration pollTimeout;
  private final long drainTimeoutMs;
  private final ExecutorService workers;
  private final AtomicBoolean running = new AtomicBoolean(true);

  private MessageConsumer(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.codec = builder.codec != null ? builder.codec : new EnvelopeCodec();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.pollTimeout = Objects.requireNonNull(builder.pollTimeout, "pollTimeout");
    this.drainTimeoutMs = builder.drainTimeoutMs;

    int workerCount = builder.workerCount;
    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be > 0");
    }

    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("lexicon-consumer-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // messages are only processed through consumeOne
      log.warn("workerCount=0: no consumer workers started; messages will not be processed");
      this.workers = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Receives and processes at most one message on the calling thread.
   *
   * @param timeout how long to wait for a message
   * @return {@code true} if a message was processed
   * @throws InterruptedException if interrupted while waiting
   */
  boolean consumeOne(Duration timeout) throws InterruptedException {
    Delivery delivery = queue.receive(timeout);
    if (delivery == null) {
      return false;
    }
    process(delivery);
    return true;
  }

  private void workerLoop() {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        consumeOne(pollTimeout);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        log.error("Consumer loop error", t);
        pause();
      }
    }
  }

  private void process(Delivery delivery) {
    metrics.incrementReceived();
    try {
      dispatch(delivery);
    } finally {
      queue.ack(delivery);
    }
  }

  private void dispatch(Delivery delivery) {
    Envelope envelope;
    try {
      envelope = codec.decode(delivery.body());
    } catch (ValidationException e) {
      metrics.incrementDropped();
      log.warn("Dropping malformed message {}: {}", delivery.messageId(), e.getMessage());
      return;
    }

    PurposeHandler handler = registry.handlerFor(envelope.purposeTag());
    if (handler == null) {
      metrics.incrementDropped();
      log.warn("No handler for purpose {}; message {} acknowledged without processing",
          envelope.purposeTag(), delivery.messageId());
      return;
    }

    long start = System.nanoTime();
    try {
      handler.handle(envelope);
      metrics.incrementHandled();
      log.debug("Handled {} message {}", envelope.purposeTag(), delivery.messageId());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incrementFailed();
      log.warn("Interrupted while handling {} message {}", envelope.purposeTag(), delivery.messageId());
    } catch (Exception e) {
      metrics.incrementFailed();
      log.error("Handler for {} failed on message {}", envelope.purposeTag(), delivery.messageId(), e);
    } finally {
      metrics.recordHandlerDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  // Keeps a worker from spinning while the queue's store is unreachable.
  private void pause() {
    try {
      Thread.sleep(pollTimeout.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // null when built with workerCount 0
  ExecutorService workers() {
    return workers;
  }

  /**
   * Initiates graceful shutdown: workers stop receiving, messages already received
   * finish within the configured drain timeout, then remaining workers are interrupted.
   */
  @Override
  public void close() {
    if (!running.getAndSet(false) || workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        log.warn("Drain timeout exceeded; forcing shutdown with {} unacknowledged messages",
            queue.unackedCount());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link MessageConsumer}. */
  public static final class Builder {
    private MessageQueue queue;
    private HandlerRegistry registry;
    private EnvelopeCodec codec;
    private MetricsExporter metrics;
    private int workerCount = 4;
    private Duration pollTimeout = Duration.ofMillis(500);
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the queue to consume from.
     *
     * <p><b>Required.</b>
     *
     * @param queue the message queue
     * @return this builder
     */
    public Builder queue(MessageQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the registry that maps purpose tags to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param registry the handler registry
     * @return this builder
     */
    public Builder registry(HandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the envelope codec.
     *
     * <p>Optional. Defaults to an {@link EnvelopeCodec} over the default JSON codec.
     *
     * @param codec the envelope codec
     * @return this builder
     */
    public Builder codec(EnvelopeCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 0. With {@code 0} no
     * message is consumed (testing only).
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long a worker waits on the queue before re-checking for shutdown.
     *
     * <p>Optional. Defaults to 500 ms. Must be positive.
     *
     * @param pollTimeout receive timeout
     * @return this builder
     */
    public Builder pollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for in-flight messages during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the consumer.
     *
     * @return a new {@link MessageConsumer}
     * @throws NullPointerException     if {@code queue} or {@code registry} is null
     * @throws IllegalArgumentException if {@code workerCount < 0} or {@code pollTimeout} is not positive
     */
    public MessageConsumer build() {
      return new MessageConsumer(this);
    }
  }
}
