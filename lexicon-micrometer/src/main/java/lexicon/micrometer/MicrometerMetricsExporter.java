package lexicon.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lexicon.spi.MessageQueue;
import lexicon.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code lexicon.messages.published} - envelopes published</li>
 *   <li>{@code lexicon.messages.received} - messages taken off the queue</li>
 *   <li>{@code lexicon.messages.handled} - handler completed normally</li>
 *   <li>{@code lexicon.messages.failed} - handler threw (message still acked)</li>
 *   <li>{@code lexicon.messages.dropped} - malformed body or no handler</li>
 * </ul>
 *
 * <h3>Timers and gauges</h3>
 * <ul>
 *   <li>{@code lexicon.handler.duration} - time spent inside handlers</li>
 *   <li>{@code lexicon.queue.unacked} - received but unacknowledged messages, once a
 *       queue is {@linkplain #monitor(MessageQueue) monitored}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter published;
  private final Counter received;
  private final Counter handled;
  private final Counter failed;
  private final Counter dropped;
  private final Timer handlerDuration;
  private final List<Meter> gauges = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "lexicon");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "bot.lexicon"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.published = counter("published", "Envelopes published to the queue");
    this.received = counter("received", "Messages taken off the queue");
    this.handled = counter("handled", "Messages whose handler completed");
    this.failed = counter("failed", "Messages whose handler threw");
    this.dropped = counter("dropped", "Messages dropped without a handler call");
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Time spent inside purpose handlers")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(namePrefix + ".messages." + name)
        .description(description)
        .register(registry);
  }

  /**
   * Registers a gauge reporting the queue's unacknowledged message count.
   *
   * @return this exporter
   */
  public MicrometerMetricsExporter monitor(MessageQueue queue) {
    Objects.requireNonNull(queue, "queue");
    gauges.add(Gauge.builder(namePrefix + ".queue.unacked", queue, MessageQueue::unackedCount)
        .description("Messages received but not yet acknowledged")
        .strongReference(true)
        .register(registry));
    return this;
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementReceived() {
    if (closed) return;
    received.increment();
  }

  @Override
  public void incrementHandled() {
    if (closed) return;
    handled.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(published, received, handled, failed, dropped, handlerDuration));
    meters.addAll(gauges);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
