package lexicon.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A message handed to a consumer by {@link MessageQueue#receive}.
 */
public record Delivery(String messageId, String body, Instant receivedAt) {

  public Delivery {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }
}
