package lexicon.spi;

import lexicon.model.Location;
import lexicon.model.NotificationTarget;
import lexicon.model.Payment;
import lexicon.model.Profile;
import lexicon.model.User;
import lexicon.model.UserField;
import lexicon.model.UserInfo;
import lexicon.model.UserLocation;

import java.util.List;
import java.util.Optional;

/**
 * Reads and writes of users and their one-to-one records.
 *
 * <p>Writes are idempotent upserts keyed on the user id. Point reads return
 * {@link Optional#empty()} on a miss.
 *
 * @see WordRepository
 */
public interface UserRepository {

  /**
   * Inserts the user, or overwrites its application-owned columns if it exists.
   * Subscription and notification columns are left untouched on update.
   */
  void upsertUser(User user);

  /**
   * Inserts or overwrites the profile of {@code profile.userId()}.
   *
   * @throws lexicon.ConflictException if the nickname belongs to another user
   */
  void upsertProfile(Profile profile);

  /**
   * Inserts or overwrites the location of {@code location.userId()}.
   */
  void upsertLocation(Location location);

  void createPayment(Payment payment);

  boolean userExists(long userId);

  boolean profileExists(long userId);

  boolean locationExists(long userId);

  boolean nicknameExists(String nickname);

  Optional<UserInfo> getUserInfo(long userId);

  Optional<UserLocation> getLocation(long userId);

  /**
   * Reads one field of a user or its profile.
   *
   * @return the value, or empty if the owning row is missing or the value is null
   */
  Optional<Object> getField(long userId, UserField field);

  /**
   * Updates one field of a user or its profile.
   *
   * @return {@code true} if a row was updated
   * @throws IllegalArgumentException if {@code value} does not fit the field
   */
  boolean updateField(long userId, UserField field, Object value);

  /**
   * Users that have not blocked the bot, with the time of their last reminder.
   */
  List<NotificationTarget> notificationTargets();

  void markNotified(long userId);

  boolean isBlocked(long userId);

  /**
   * Deactivates the user and flags it as having blocked the bot.
   */
  void markBlocked(long userId);
}
