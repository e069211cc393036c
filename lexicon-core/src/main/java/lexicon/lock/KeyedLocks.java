package lexicon.lock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key mutual exclusion, with one {@link ReentrantLock} per live key.
 *
 * <p>Entries are created on first use and reference-counted: a caller retains the
 * entry before waiting on its lock and releases it when the lease is closed. The
 * entry is removed from the map in the same atomic step that drops its count to
 * zero, so the map holds exactly the keys that are locked or being waited on.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * KeyedLocks<Long> locks = new KeyedLocks<>();
 * try (KeyedLocks.Lease lease = locks.lock(userId)) {
 *   // critical section for userId
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @param <K> key type, compared with {@link Object#equals}
 */
public final class KeyedLocks<K> {
  private final ConcurrentHashMap<K, Entry> entries = new ConcurrentHashMap<>();

  /**
   * Acquires the lock for {@code key}, waiting as long as needed.
   *
   * @return a lease that must be closed to unlock
   * @throws InterruptedException if interrupted while waiting; nothing is held then
   */
  public Lease lock(K key) throws InterruptedException {
    Entry entry = retain(key);
    try {
      entry.lock.lockInterruptibly();
    } catch (InterruptedException e) {
      release(key);
      throw e;
    }
    return new Lease(key, entry);
  }

  /**
   * Acquires the lock for {@code key} if it becomes free within {@code timeout}.
   *
   * @return the lease, or empty on timeout
   * @throws InterruptedException if interrupted while waiting; nothing is held then
   */
  public Optional<Lease> tryLock(K key, Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    Entry entry = retain(key);
    boolean acquired;
    try {
      acquired = entry.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      release(key);
      throw e;
    }
    if (!acquired) {
      release(key);
      return Optional.empty();
    }
    return Optional.of(new Lease(key, entry));
  }

  /**
   * Runs {@code section} while holding the lock for {@code key}.
   *
   * @return the section's result
   * @throws InterruptedException if interrupted before the lock was acquired
   * @throws E                    whatever the section throws
   */
  public <T, E extends Exception> T withLock(K key, CriticalSection<T, E> section)
      throws InterruptedException, E {
    Objects.requireNonNull(section, "section");
    try (Lease ignored = lock(key)) {
      return section.run();
    }
  }

  /**
   * Removes entries that nobody holds or waits for.
   *
   * <p>Released entries already leave the map on their own; this sweep only
   * matters if a count was leaked.
   *
   * @return number of entries removed
   */
  public int purgeIdle() {
    AtomicInteger removed = new AtomicInteger();
    for (K key : entries.keySet()) {
      entries.computeIfPresent(key, (k, entry) -> {
        if (entry.refs == 0 && !entry.lock.isLocked()) {
          removed.incrementAndGet();
          return null;
        }
        return entry;
      });
    }
    return removed.get();
  }

  /**
   * Number of keys currently locked or waited on.
   */
  public int size() {
    return entries.size();
  }

  /**
   * Whether some thread holds the lock for {@code key}.
   */
  public boolean isLocked(K key) {
    Entry entry = entries.get(key);
    return entry != null && entry.lock.isLocked();
  }

  private Entry retain(K key) {
    Objects.requireNonNull(key, "key");
    return entries.compute(key, (k, entry) -> {
      Entry e = entry != null ? entry : new Entry();
      e.refs++;
      return e;
    });
  }

  private void release(K key) {
    entries.computeIfPresent(key, (k, entry) -> --entry.refs == 0 ? null : entry);
  }

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's per-key compute
    int refs;
  }

  /**
   * Held lock for one key. Closing it unlocks; closing twice is a no-op.
   * Must be closed by the thread that acquired it.
   */
  public final class Lease implements AutoCloseable {
    private final K key;
    private final Entry entry;
    private boolean closed;

    private Lease(K key, Entry entry) {
      this.key = key;
      this.entry = entry;
    }

    public K key() {
      return key;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      entry.lock.unlock();
      release(key);
    }
  }

  /**
   * Work run under a key's lock.
   */
  @FunctionalInterface
  public interface CriticalSection<T, E extends Exception> {
    T run() throws E;
  }
}
