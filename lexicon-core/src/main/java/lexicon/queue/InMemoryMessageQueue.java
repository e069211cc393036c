package lexicon.queue;

import com.github.f4b6a3.ulid.UlidCreator;
import lexicon.spi.Delivery;
import lexicon.spi.MessageQueue;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process {@link MessageQueue}. Messages do not survive a restart.
 *
 * <p>Message ids are monotonic ULIDs, so they sort in publish order.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryMessageQueue implements MessageQueue {
  public static final int DEFAULT_CAPACITY = 10_000;

  private final BlockingQueue<Pending> ready;
  private final Map<String, Delivery> unacked = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryMessageQueue() {
    this(DEFAULT_CAPACITY, Clock.systemUTC());
  }

  public InMemoryMessageQueue(int capacity, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.ready = new LinkedBlockingQueue<>(capacity);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @throws IllegalStateException if the queue is at capacity
   */
  @Override
  public String publish(String body) {
    Objects.requireNonNull(body, "body");
    String id = UlidCreator.getMonotonicUlid().toString();
    if (!ready.offer(new Pending(id, body))) {
      throw new IllegalStateException("Queue is full (" + ready.size() + " messages)");
    }
    return id;
  }

  @Override
  public Delivery receive(Duration timeout) throws InterruptedException {
    Pending next = ready.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (next == null) {
      return null;
    }
    Delivery delivery = new Delivery(next.id(), next.body(), clock.instant());
    unacked.put(delivery.messageId(), delivery);
    return delivery;
  }

  @Override
  public void ack(Delivery delivery) {
    unacked.remove(delivery.messageId());
  }

  @Override
  public int unackedCount() {
    return unacked.size();
  }

  /**
   * Number of messages published but not yet received.
   */
  public int pendingCount() {
    return ready.size();
  }

  private record Pending(String id, String body) {
  }
}
