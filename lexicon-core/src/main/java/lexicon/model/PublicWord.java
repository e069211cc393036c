package lexicon.model;

import java.time.Instant;

/**
 * A public word as seen by other users searching for it.
 */
public record PublicWord(String nickname, long userId, String word, Instant createdAt) {
}
