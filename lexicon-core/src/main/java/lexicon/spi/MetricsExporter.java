package lexicon.spi;

/**
 * Observability hook for exporting consumer and publisher counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of envelopes published to the queue.
   */
  void incrementPublished();

  /**
   * Increments the count of messages taken off the queue.
   */
  void incrementReceived();

  /**
   * Increments the count of messages whose handler completed normally.
   */
  void incrementHandled();

  /**
   * Increments the count of messages whose handler threw. The message is still acknowledged.
   */
  void incrementFailed();

  /**
   * Increments the count of messages dropped without a handler call, either because
   * the body was malformed or because no handler is registered for the purpose.
   */
  void incrementDropped();

  /**
   * Records the time spent inside a handler.
   *
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementPublished() {
    }

    @Override
    public void incrementReceived() {
    }

    @Override
    public void incrementHandled() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementDropped() {
    }
  }
}
