package lexicon.spring.boot;

import lexicon.jdbc.pool.PoolSettings;
import lexicon.jdbc.queue.JdbcMessageQueue;
import lexicon.model.TrialTerms;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for the lexicon service.
 *
 * @see LexiconAutoConfiguration
 */
@ConfigurationProperties(prefix = "lexicon")
public class LexiconProperties {

  private final Pool pool = new Pool();
  private final Consumer consumer = new Consumer();
  private final Queue queue = new Queue();
  private final Schema schema = new Schema();
  private final Tables tables = new Tables();
  private final Trial trial = new Trial();
  private final Metrics metrics = new Metrics();

  public Pool getPool() {
    return pool;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public Queue getQueue() {
    return queue;
  }

  public Schema getSchema() {
    return schema;
  }

  public Tables getTables() {
    return tables;
  }

  public Trial getTrial() {
    return trial;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Settings for the pool opened when the application has no {@code DataSource} of its own.
   */
  public static class Pool {
    private String url;
    private String username;
    private String password;
    private int minSize = PoolSettings.DEFAULT_MIN_SIZE;
    private int maxSize = PoolSettings.DEFAULT_MAX_SIZE;
    private Duration acquireTimeout = PoolSettings.DEFAULT_ACQUIRE_TIMEOUT;
    private String name = "lexicon-pool";

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public int getMinSize() {
      return minSize;
    }

    public void setMinSize(int minSize) {
      this.minSize = minSize;
    }

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    public Duration getAcquireTimeout() {
      return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    PoolSettings toSettings() {
      return PoolSettings.builder()
          .jdbcUrl(url)
          .username(username)
          .password(password)
          .minSize(minSize)
          .maxSize(maxSize)
          .acquireTimeout(acquireTimeout)
          .poolName(name)
          .build();
    }
  }

  public static class Consumer {
    private boolean enabled = true;
    /**
     * Register the five built-in user-state handlers. Turn off to supply every
     * handler through {@link PurposeListener} beans.
     */
    private boolean builtinHandlers = true;
    private int workerCount = 4;
    private Duration pollTimeout = Duration.ofMillis(500);
    private long drainTimeoutMs = 5000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isBuiltinHandlers() {
      return builtinHandlers;
    }

    public void setBuiltinHandlers(boolean builtinHandlers) {
      this.builtinHandlers = builtinHandlers;
    }

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public Duration getPollTimeout() {
      return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }
  }

  public static class Queue {
    private QueueType type = QueueType.JDBC;
    private Duration pollInterval = JdbcMessageQueue.DEFAULT_POLL_INTERVAL;
    /**
     * Capacity of the in-memory queue. Ignored for {@link QueueType#JDBC}.
     */
    private int capacity = 10_000;
    private final Purge purge = new Purge();

    public QueueType getType() {
      return type;
    }

    public void setType(QueueType type) {
      this.type = type;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public int getCapacity() {
      return capacity;
    }

    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }

    public Purge getPurge() {
      return purge;
    }
  }

  /**
   * Scheduled deletion of acknowledged rows from the JDBC queue.
   */
  public static class Purge {
    private boolean enabled = false;
    private Duration retention = Duration.ofDays(7);
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public enum QueueType {
    JDBC,
    IN_MEMORY
  }

  public static class Schema {
    /**
     * Create missing tables and indexes at startup.
     */
    private boolean initialize = true;
    /**
     * Dialect name (h2, postgresql, mysql). Detected from the store's JDBC URL when unset.
     */
    private String dialect;

    public boolean isInitialize() {
      return initialize;
    }

    public void setInitialize(boolean initialize) {
      this.initialize = initialize;
    }

    public String getDialect() {
      return dialect;
    }

    public void setDialect(String dialect) {
      this.dialect = dialect;
    }
  }

  public static class Tables {
    private String profiles = "profiles";

    public String getProfiles() {
      return profiles;
    }

    public void setProfiles(String profiles) {
      this.profiles = profiles;
    }
  }

  public static class Trial {
    private BigDecimal amount = TrialTerms.DEFAULT.amount();
    private String currency = TrialTerms.DEFAULT.currency();
    private Duration length = TrialTerms.DEFAULT.length();

    public BigDecimal getAmount() {
      return amount;
    }

    public void setAmount(BigDecimal amount) {
      this.amount = amount;
    }

    public String getCurrency() {
      return currency;
    }

    public void setCurrency(String currency) {
      this.currency = currency;
    }

    public Duration getLength() {
      return length;
    }

    public void setLength(Duration length) {
      this.length = length;
    }

    TrialTerms toTerms() {
      return new TrialTerms(amount, currency, length);
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "lexicon";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
