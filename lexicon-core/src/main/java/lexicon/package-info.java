/**
 * Root API of lexicon: message-driven persistence of language learners' state.
 *
 * <h2>Core Design</h2>
 * <p>Synchronous callers publish user-state changes through the
 * {@linkplain lexicon.publisher.EventPublisher publisher}. Each change travels as an
 * {@link lexicon.Envelope} tagged with a {@link lexicon.Purpose}. The
 * {@linkplain lexicon.consumer.MessageConsumer consumer} takes envelopes off the
 * {@linkplain lexicon.spi.MessageQueue queue}, looks up the handler for the purpose in a
 * {@linkplain lexicon.registry.HandlerRegistry registry} and acknowledges the message
 * whatever the outcome. Writes are idempotent upserts; renames of one user's words are
 * serialized by {@linkplain lexicon.lock.KeyedLocks per-user locks}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>lexicon-core</b> - model, registry, consumer, publisher, SPIs</li>
 *   <li><b>lexicon-jdbc</b> - connection pool, repositories and durable queue
 *       (H2, MySQL, PostgreSQL)</li>
 *   <li><b>lexicon-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>lexicon-spring-boot-starter</b> - auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ConnectionPool pool = ConnectionPool.create(PoolSettings.builder()
 *     .jdbcUrl("jdbc:postgresql://localhost/lexicon")
 *     .username("lexicon")
 *     .password("secret")
 *     .build());
 * Dialect dialect = Dialects.detect(pool);
 * SchemaInitializer.create(pool, dialect);
 *
 * var users = new JdbcUserRepository(pool, dialect);
 * var words = new JdbcWordRepository(pool, dialect);
 * var queue = new JdbcMessageQueue(pool, dialect);
 * var registry = new UserStateHandlers(users, words)
 *     .registerAll(DefaultHandlerRegistry.builder())
 *     .build();
 *
 * try (MessageConsumer consumer = MessageConsumer.builder()
 *     .queue(queue)
 *     .registry(registry)
 *     .build()) {
 *   new EventPublisher(queue).publishUser(user);
 * }
 * }</pre>
 *
 * @see lexicon.Envelope
 * @see lexicon.Purpose
 * @see lexicon.LexiconException
 */
package lexicon;
