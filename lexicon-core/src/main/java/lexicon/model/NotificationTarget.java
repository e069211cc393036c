package lexicon.model;

import java.time.Instant;

/**
 * A user that may receive reminders, with the time of the last one sent.
 */
public record NotificationTarget(long userId, Instant lastNotified) {
}
