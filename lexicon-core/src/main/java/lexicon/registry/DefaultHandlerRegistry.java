package lexicon.registry;

import lexicon.Purpose;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry mapping each {@link Purpose} to exactly one handler.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = DefaultHandlerRegistry.builder()
 *     .register(Purpose.ADD_USER, handlers::addUser)
 *     .register(Purpose.ADD_WORD, handlers::addWord)
 *     .build();
 * }</pre>
 *
 * <p>The map is built once and never changes, so lookups need no synchronization.
 *
 * @see lexicon.handler.UserStateHandlers
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<Purpose, PurposeHandler> handlers;

  private DefaultHandlerRegistry(Map<Purpose, PurposeHandler> handlers) {
    this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public PurposeHandler handlerFor(String purposeTag) {
    return Purpose.fromTag(purposeTag).map(handlers::get).orElse(null);
  }

  @Override
  public Set<Purpose> purposes() {
    return handlers.keySet();
  }

  /** Builder for {@link DefaultHandlerRegistry}. */
  public static final class Builder {
    private final Map<Purpose, PurposeHandler> handlers = new EnumMap<>(Purpose.class);

    private Builder() {}

    /**
     * Registers the handler for a purpose.
     *
     * @return this builder
     * @throws IllegalStateException if the purpose already has a handler
     */
    public Builder register(Purpose purpose, PurposeHandler handler) {
      Objects.requireNonNull(purpose, "purpose");
      Objects.requireNonNull(handler, "handler");
      if (handlers.putIfAbsent(purpose, handler) != null) {
        throw new IllegalStateException("Duplicate handler for purpose " + purpose);
      }
      return this;
    }

    /**
     * Registers every entry of {@code handlers}.
     *
     * @return this builder
     * @throws IllegalStateException if a purpose already has a handler
     */
    public Builder registerAll(Map<Purpose, ? extends PurposeHandler> handlers) {
      handlers.forEach(this::register);
      return this;
    }

    public DefaultHandlerRegistry build() {
      return new DefaultHandlerRegistry(handlers);
    }
  }
}
