package lexicon.jdbc.repo;

import lexicon.ConflictException;
import lexicon.PaymentRequiredException;
import lexicon.jdbc.MutableClock;
import lexicon.jdbc.TestDatabase;
import lexicon.lock.KeyedLocks;
import lexicon.model.DueWords;
import lexicon.model.NewWord;
import lexicon.model.PublicWord;
import lexicon.model.Translation;
import lexicon.model.WordEntry;
import lexicon.model.WordState;
import lexicon.model.WordStats;
import lexicon.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWordRepositoryTest {
  private static final Instant NOW = Instant.parse("2024-04-01T08:00:00Z");

  private TestDatabase db;
  private MutableClock clock;
  private KeyedLocks<Long> userLocks;
  private JdbcUserRepository users;
  private JdbcWordRepository words;

  @BeforeEach
  void setup() {
    db = TestDatabase.open(8, lexicon.jdbc.TableNames.DEFAULT);
    clock = new MutableClock(NOW);
    userLocks = new KeyedLocks<>();
    users = new JdbcUserRepository(db.pool(), db.dialect(), db.tables(), JsonCodec.getDefault(), clock);
    words = new JdbcWordRepository(db.pool(), db.dialect(), db.tables(), clock, userLocks);
    users.upsertUser(JdbcUserRepositoryTest.user(1, "Ann", 1));
    users.upsertUser(JdbcUserRepositoryTest.user(2, "Bob", 1));
    users.upsertProfile(JdbcUserRepositoryTest.profile(1, "ann"));
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  @Test
  void addWordStoresChildren() {
    long id = words.addWord(new NewWord(1, "apple", true,
        List.of(new Translation("яблоко", "noun"), new Translation("яблоня", "noun")),
        "An apple a day", "https://cdn/apple.ogg"));

    WordEntry entry = words.findWord(1, "apple").orElseThrow();
    assertEquals(id, entry.id());
    assertEquals("ann", entry.nickname());
    assertEquals(WordState.NEW, entry.state());
    assertEquals(NOW, entry.createdAt());
    assertEquals("An apple a day", entry.context());
    assertEquals("https://cdn/apple.ogg", entry.audio());
    assertEquals(2, entry.translations().size());
    assertTrue(entry.isPublic());
  }

  @Test
  void addWordIgnoresRepeatedTranslation() {
    words.addWord(new NewWord(1, "run", false,
        List.of(new Translation("бежать", "verb"), new Translation("бежать", "verb")), null, null));

    assertEquals(1, words.findWord(1, "run").orElseThrow().translations().size());
  }

  @Test
  void addWordForInactiveOrUnknownUserNeedsPayment() {
    users.markBlocked(2);

    assertThrows(PaymentRequiredException.class, () -> words.addWord(word(2, "cat")));
    PaymentRequiredException ex = assertThrows(PaymentRequiredException.class, () -> words.addWord(word(99, "cat")));
    assertEquals(99, ex.userId());
    assertEquals(0, db.count("SELECT COUNT(*) FROM words"));
  }

  @Test
  void duplicateWordIsConflict() {
    words.addWord(word(1, "cat"));

    assertThrows(ConflictException.class, () -> words.addWord(word(1, "cat")));
    words.addWord(word(2, "cat"));
    assertEquals(2, db.count("SELECT COUNT(*) FROM words WHERE word = 'cat'"));
  }

  @Test
  void queryWordsByUserOrdersByText() {
    words.addWord(word(1, "zebra"));
    words.addWord(word(1, "apple"));
    words.addWord(word(2, "moon"));

    List<String> texts = words.queryWordsByUser(1).stream().map(WordEntry::word).toList();
    assertEquals(List.of("apple", "zebra"), texts);
    assertTrue(words.queryWordsByUser(3).isEmpty());
    assertTrue(words.wordExists(2, "moon"));
    assertFalse(words.wordExists(1, "moon"));
  }

  @Test
  void searchPublicWordNeedsNickname() {
    words.addWord(new NewWord(1, "star", true, List.of(), null, null));
    words.addWord(new NewWord(2, "star", true, List.of(), null, null));

    List<PublicWord> found = words.searchPublicWord("star");
    assertEquals(List.of(new PublicWord("ann", 1, "star", NOW)), found);
  }

  @Test
  void deleteWordCascadesToChildren() {
    long id = words.addWord(new NewWord(1, "cat", false,
        List.of(new Translation("кот", "noun")), "The cat sat", "https://cdn/cat.ogg"));

    assertFalse(words.deleteWord(2, id));
    assertTrue(words.deleteWord(1, id));
    assertFalse(words.deleteWord(1, id));
    assertEquals(0, db.count("SELECT COUNT(*) FROM translations"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM contexts"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM audios"));
  }

  @Test
  void renameKeepsChildrenStateAndCreationTime() {
    long id = words.addWord(new NewWord(1, "colour", true,
        List.of(new Translation("цвет", "noun")), "A bright colour", null));
    words.reviewOutcome(1, "colour", true);
    clock.advance(Duration.ofHours(3));

    assertTrue(words.renameWord(1, "colour", "color"));

    assertFalse(words.wordExists(1, "colour"));
    WordEntry moved = words.findWord(1, "color").orElseThrow();
    assertEquals(id, moved.id());
    assertEquals(WordState.REPEATED, moved.state());
    assertEquals(NOW, moved.createdAt());
    assertEquals("A bright colour", moved.context());
    assertEquals(List.of(new Translation("цвет", "noun")), moved.translations());
    assertTrue(moved.isPublic());
  }

  @Test
  void renameOntoExistingWordMerges() {
    words.addWord(word(1, "colour"));
    words.addWord(word(1, "color"));

    assertTrue(words.renameWord(1, "colour", "color"));

    assertEquals(1, db.count("SELECT COUNT(*) FROM words WHERE user_id = 1"));
    assertTrue(words.wordExists(1, "color"));
  }

  @Test
  void renameMissingWordReturnsFalse() {
    assertFalse(words.renameWord(1, "ghost", "spirit"));
    assertEquals(0, db.pool().activeConnections());
  }

  @Test
  void concurrentRenamesOfOneUserAreSerialized() throws Exception {
    words.addWord(word(1, "a"));
    int threads = 6;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        String target = i % 2 == 0 ? "b" : "a";
        String source = i % 2 == 0 ? "a" : "b";
        results.add(executor.submit(() -> {
          start.await();
          return words.renameWord(1, source, target);
        }));
      }
      start.countDown();
      for (Future<Boolean> result : results) {
        result.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, db.count("SELECT COUNT(*) FROM words WHERE user_id = 1"));
    assertEquals(0, userLocks.size());
    assertEquals(0, db.pool().activeConnections());
  }

  @Test
  void renameOfOneUserDoesNotWaitForAnother() throws Exception {
    words.addWord(word(2, "sun"));

    try (KeyedLocks<Long>.Lease lease = userLocks.lock(1L)) {
      ExecutorService executor = Executors.newSingleThreadExecutor();
      try {
        Future<Boolean> other = executor.submit(() -> words.renameWord(2, "sun", "star"));
        assertTrue(other.get(2, TimeUnit.SECONDS));
      } finally {
        executor.shutdownNow();
      }
      assertTrue(userLocks.isLocked(1L));
    }
    assertTrue(words.wordExists(2, "star"));
  }

  @Test
  void reviewOutcomeWalksTheLadder() {
    words.addWord(word(1, "dog"));

    assertEquals(Optional.of(WordState.REPEATED), words.reviewOutcome(1, "dog", true));
    assertEquals(Optional.of(WordState.REINFORCED), words.reviewOutcome(1, "dog", true));
    assertEquals(Optional.of(WordState.LEARNED), words.reviewOutcome(1, "dog", true));
    assertEquals(Optional.of(WordState.LEARNED), words.reviewOutcome(1, "dog", true));
    assertEquals(Optional.of(WordState.REINFORCED), words.reviewOutcome(1, "dog", false));
    assertEquals(Optional.of(WordState.REPEATED), words.reviewOutcome(1, "dog", false));
    assertEquals(Optional.of(WordState.NEW), words.reviewOutcome(1, "dog", false));
    assertEquals(Optional.of(WordState.NEW), words.reviewOutcome(1, "dog", false));
    assertTrue(words.reviewOutcome(1, "cat", true).isEmpty());
  }

  @Test
  void concurrentReviewsEachReportTheirOwnStep() throws Exception {
    words.addWord(word(1, "dog"));
    int threads = 3;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    List<WordState> reported = new ArrayList<>();
    try {
      List<Future<Optional<WordState>>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return words.reviewOutcome(1, "dog", true);
        }));
      }
      start.countDown();
      for (Future<Optional<WordState>> result : results) {
        reported.add(result.get(10, TimeUnit.SECONDS).orElseThrow());
      }
    } finally {
      executor.shutdownNow();
    }

    reported.sort(null);
    assertEquals(List.of(WordState.REPEATED, WordState.REINFORCED, WordState.LEARNED), reported);
    assertEquals(WordState.LEARNED, words.findWord(1, "dog").orElseThrow().state());
    assertEquals(0, db.pool().activeConnections());
  }

  @Test
  void dueSelectionBoundaries() {
    words.addWord(word(1, "fresh"));
    words.addWord(word(1, "repeated"));
    words.addWord(word(1, "reinforced"));
    words.addWord(word(1, "learned"));
    words.reviewOutcome(1, "repeated", true);
    promote(1, "reinforced", 2);
    promote(1, "learned", 3);

    clock.set(NOW.plus(Duration.ofDays(1)).minusSeconds(1));
    assertTrue(words.dueForReview().isEmpty());

    clock.set(NOW.plus(Duration.ofDays(1)));
    assertEquals(List.of(new DueWords(1, List.of("fresh"))), words.dueForReview());

    clock.set(NOW.plus(Duration.ofDays(5)));
    assertEquals(List.of(new DueWords(1, List.of("fresh", "repeated"))), words.dueForReview());

    clock.set(NOW.plus(Duration.ofDays(14)).minusSeconds(1));
    assertEquals(List.of(new DueWords(1, List.of("fresh", "repeated"))), words.dueForReview());

    clock.set(NOW.plus(Duration.ofDays(14)));
    assertEquals(List.of(new DueWords(1, List.of("fresh", "reinforced", "repeated"))), words.dueForReview());

    clock.set(NOW.plus(Duration.ofDays(3650)));
    assertFalse(words.dueForReview().get(0).words().contains("learned"));
  }

  @Test
  void dueWordsAreGroupedPerUser() {
    words.addWord(word(1, "one"));
    words.addWord(word(2, "two"));
    words.addWord(word(2, "three"));
    clock.advance(Duration.ofDays(2));

    assertEquals(List.of(
        new DueWords(1, List.of("one")),
        new DueWords(2, List.of("three", "two"))), words.dueForReview());
  }

  @Test
  void markRepeatedPromotesNewWordsFoundInMessage() {
    words.addWord(word(1, "Apple"));
    words.addWord(word(1, "pear"));
    words.addWord(word(1, "plum"));
    words.addWord(word(2, "apple"));
    promote(1, "plum", 2);

    int promoted = words.markRepeated("ann", "I ate an APPLE and a plum\tand  pear ");

    assertEquals(2, promoted);
    assertEquals(WordState.REPEATED, words.findWord(1, "Apple").orElseThrow().state());
    assertEquals(WordState.REPEATED, words.findWord(1, "pear").orElseThrow().state());
    assertEquals(WordState.REINFORCED, words.findWord(1, "plum").orElseThrow().state());
    assertEquals(WordState.NEW, words.findWord(2, "apple").orElseThrow().state());
    assertEquals(0, words.markRepeated("nobody", "apple"));
    assertEquals(0, words.markRepeated("ann", "   "));
  }

  @Test
  void statsCountWordsPerPartOfSpeech() {
    words.addWord(new NewWord(1, "run", false,
        List.of(new Translation("бег", "noun"), new Translation("бежать", "verb")), null, null));
    words.addWord(new NewWord(1, "fast", false,
        List.of(new Translation("быстрый", "adjective"), new Translation("быстро", "adverb")), null, null));
    words.addWord(new NewWord(1, "oh", false, List.of(new Translation("ох", "other")), null, null));
    words.addWord(new NewWord(1, "bare", false, List.of(), null, null));

    WordStats stats = words.getUserStats(1);

    assertEquals(new WordStats(1, 1, 1, 1, 1), stats);
    assertEquals(5, stats.total());
    assertEquals(WordStats.EMPTY, words.getUserStats(2));
    assertFalse(words.isStatsLocked());
  }

  @Test
  void countWordsSinceUsesWindow() {
    words.addWord(word(1, "old"));
    clock.advance(Duration.ofDays(8));
    words.addWord(word(1, "recent"));
    clock.advance(Duration.ofDays(1));

    assertEquals(1, words.countWordsSince(1, Duration.ofDays(7)));
    assertEquals(2, words.countWordsSince(1, Duration.ofDays(30)));
    assertEquals(0, words.countWordsSince(2, Duration.ofDays(7)));
  }

  private void promote(long userId, String text, int steps) {
    for (int i = 0; i < steps; i++) {
      words.reviewOutcome(userId, text, true);
    }
  }

  private static NewWord word(long userId, String text) {
    return new NewWord(userId, text, false, List.of(), null, null);
  }
}
