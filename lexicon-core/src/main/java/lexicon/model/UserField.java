package lexicon.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Fields of a user or profile that may be read or updated one at a time.
 *
 * <p>This is the complete set of addressable fields: each constant fixes the owning
 * record and the column, so no caller-supplied identifier is ever placed into SQL.
 */
public enum UserField {
  USERNAME(Owner.USER, "username", String.class),
  LANGUAGE(Owner.USER, "language", String.class),
  FLUENCY(Owner.USER, "fluency", Integer.class),
  TOPICS(Owner.USER, "topics", List.class),
  LANG_CODE(Owner.USER, "lang_code", String.class),
  NICKNAME(Owner.PROFILE, "nickname", String.class),
  EMAIL(Owner.PROFILE, "email", String.class),
  BIRTHDAY(Owner.PROFILE, "birthday", LocalDate.class),
  DATING(Owner.PROFILE, "dating", Boolean.class),
  GENDER(Owner.PROFILE, "gender", String.class),
  INTRO(Owner.PROFILE, "intro", String.class),
  STATUS(Owner.PROFILE, "status", String.class);

  /** Record that owns a field. */
  public enum Owner {
    USER,
    PROFILE
  }

  private final Owner owner;
  private final String column;
  private final Class<?> valueType;

  UserField(Owner owner, String column, Class<?> valueType) {
    this.owner = owner;
    this.column = column;
    this.valueType = valueType;
  }

  public Owner owner() {
    return owner;
  }

  public String column() {
    return column;
  }

  public Class<?> valueType() {
    return valueType;
  }

  /**
   * Checks that {@code value} may be stored in this field.
   *
   * @throws IllegalArgumentException if the value has the wrong type
   */
  public Object requireAssignable(Object value) {
    if (value != null && !valueType.isInstance(value)) {
      throw new IllegalArgumentException(name() + " expects " + valueType.getSimpleName()
          + " but got " + value.getClass().getSimpleName());
    }
    return value;
  }
}
