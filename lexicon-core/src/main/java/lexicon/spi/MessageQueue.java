package lexicon.spi;

import java.time.Duration;

/**
 * Durable queue of envelope bodies between the publisher and the consumer.
 *
 * <p>Delivery is at-most-once: a received message is never handed out again,
 * whether or not it is later acknowledged.
 *
 * @see lexicon.queue.InMemoryMessageQueue
 */
public interface MessageQueue {

  /**
   * Appends a message body to the queue.
   *
   * @param body the encoded envelope
   * @return the message id assigned by the queue
   * @throws lexicon.ConnectivityException if the queue's backing store is unreachable
   */
  String publish(String body);

  /**
   * Waits up to {@code timeout} for the next message and takes it out of the
   * deliverable set. The returned delivery stays un-acked until {@link #ack}.
   *
   * @param timeout maximum time to wait
   * @return the next delivery, or {@code null} if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  Delivery receive(Duration timeout) throws InterruptedException;

  /**
   * Acknowledges a delivery. Acknowledging twice is a no-op.
   *
   * @param delivery a delivery returned by {@link #receive}
   */
  void ack(Delivery delivery);

  /**
   * Number of messages received but not yet acknowledged.
   */
  int unackedCount();
}
