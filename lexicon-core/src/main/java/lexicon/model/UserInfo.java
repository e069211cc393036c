package lexicon.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A user row joined with its profile, if any.
 */
public record UserInfo(User user, boolean active, boolean blocked, Instant lastNotified, Profile profile) {

  public Optional<Profile> profileIfPresent() {
    return Optional.ofNullable(profile);
  }
}
