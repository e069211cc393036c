package lexicon.publisher;

import lexicon.Envelope;
import lexicon.EnvelopeCodec;
import lexicon.Purpose;
import lexicon.model.Location;
import lexicon.model.NewWord;
import lexicon.model.Payment;
import lexicon.model.Profile;
import lexicon.model.User;
import lexicon.spi.MessageQueue;
import lexicon.spi.MetricsExporter;
import lexicon.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes user-state changes to the queue for asynchronous persistence.
 *
 * <p>The payload is serialized to JSON and embedded as a string under the purpose's
 * payload key:
 * <pre>{@code
 * {"purpose": "ADD_USER", "user": "{\"user_id\":42,\"first_name\":\"Ann\",...}"}
 * }</pre>
 *
 * <p>This class is thread-safe if the queue is.
 */
public final class EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

  private final MessageQueue queue;
  private final JsonCodec json;
  private final EnvelopeCodec codec;
  private final MetricsExporter metrics;

  public EventPublisher(MessageQueue queue) {
    this(queue, JsonCodec.getDefault(), MetricsExporter.NOOP);
  }

  public EventPublisher(MessageQueue queue, JsonCodec json, MetricsExporter metrics) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.json = Objects.requireNonNull(json, "json");
    this.codec = new EnvelopeCodec(json);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String publishUser(User user) {
    return publish(Purpose.ADD_USER, user);
  }

  public String publishProfile(Profile profile) {
    return publish(Purpose.ADD_PROFILE, profile);
  }

  public String publishLocation(Location location) {
    return publish(Purpose.ADD_LOCATION, location);
  }

  public String publishWord(NewWord word) {
    return publish(Purpose.ADD_WORD, word);
  }

  public String publishPayment(Payment payment) {
    return publish(Purpose.CREATE_PAYMENT_PURPOSE, payment);
  }

  /**
   * Serializes {@code payload} and publishes it under {@code purpose}.
   *
   * @return the message id assigned by the queue
   * @throws IllegalArgumentException      if the payload cannot be serialized or is too large
   * @throws lexicon.ConnectivityException if the queue is unreachable
   */
  public String publish(Purpose purpose, Object payload) {
    Objects.requireNonNull(purpose, "purpose");
    Objects.requireNonNull(payload, "payload");
    String body = codec.encode(Envelope.of(purpose, json.toJson(payload)));
    String messageId = queue.publish(body);
    metrics.incrementPublished();
    log.debug("Published {} as message {}", purpose, messageId);
    return messageId;
  }
}
