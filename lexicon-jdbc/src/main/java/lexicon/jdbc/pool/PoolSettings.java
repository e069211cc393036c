package lexicon.jdbc.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection pool configuration.
 *
 * <p>Defaults: minimum 5 idle connections, maximum 20, 60 second acquisition timeout.
 */
public final class PoolSettings {
  public static final int DEFAULT_MIN_SIZE = 5;
  public static final int DEFAULT_MAX_SIZE = 20;
  public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(60);
  // HikariCP rejects anything shorter
  public static final Duration MIN_ACQUIRE_TIMEOUT = Duration.ofMillis(250);

  private final String jdbcUrl;
  private final String username;
  private final String password;
  private final int minSize;
  private final int maxSize;
  private final Duration acquireTimeout;
  private final String poolName;

  private PoolSettings(Builder builder) {
    this.jdbcUrl = Objects.requireNonNull(builder.jdbcUrl, "jdbcUrl");
    this.username = builder.username;
    this.password = builder.password;
    this.minSize = builder.minSize;
    this.maxSize = builder.maxSize;
    this.acquireTimeout = Objects.requireNonNull(builder.acquireTimeout, "acquireTimeout");
    this.poolName = builder.poolName;

    if (jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("jdbcUrl must not be blank");
    }
    if (maxSize < 1) {
      throw new IllegalArgumentException("maxSize must be >= 1");
    }
    if (minSize < 0 || minSize > maxSize) {
      throw new IllegalArgumentException("minSize must be between 0 and maxSize (" + maxSize + ")");
    }
    if (acquireTimeout.compareTo(MIN_ACQUIRE_TIMEOUT) < 0) {
      throw new IllegalArgumentException("acquireTimeout must be >= " + MIN_ACQUIRE_TIMEOUT.toMillis() + "ms");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public String jdbcUrl() {
    return jdbcUrl;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public int minSize() {
    return minSize;
  }

  public int maxSize() {
    return maxSize;
  }

  public Duration acquireTimeout() {
    return acquireTimeout;
  }

  public String poolName() {
    return poolName;
  }

  @Override
  public String toString() {
    return "PoolSettings{jdbcUrl=" + jdbcUrl + ", username=" + username + ", minSize=" + minSize
        + ", maxSize=" + maxSize + ", acquireTimeout=" + acquireTimeout + ", poolName=" + poolName + "}";
  }

  /** Builder for {@link PoolSettings}. */
  public static final class Builder {
    private String jdbcUrl;
    private String username;
    private String password;
    private int minSize = DEFAULT_MIN_SIZE;
    private int maxSize = DEFAULT_MAX_SIZE;
    private Duration acquireTimeout = DEFAULT_ACQUIRE_TIMEOUT;
    private String poolName = "lexicon-pool";

    private Builder() {}

    /** <b>Required.</b> */
    public Builder jdbcUrl(String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /** Minimum number of idle connections. Defaults to {@code 5}. */
    public Builder minSize(int minSize) {
      this.minSize = minSize;
      return this;
    }

    /** Maximum number of connections. Defaults to {@code 20}. */
    public Builder maxSize(int maxSize) {
      this.maxSize = maxSize;
      return this;
    }

    /** How long {@code acquire} waits for a free connection. Defaults to 60 seconds. */
    public Builder acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    public Builder poolName(String poolName) {
      this.poolName = poolName;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code jdbcUrl} is null
     * @throws IllegalArgumentException if sizes or timeout are out of range
     */
    public PoolSettings build() {
      return new PoolSettings(this);
    }
  }
}
