package lexicon.model;

/**
 * City and country of a user, as returned by point reads.
 */
public record UserLocation(String city, String country) {
}
