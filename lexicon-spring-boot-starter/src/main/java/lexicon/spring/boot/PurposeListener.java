package lexicon.spring.boot;

import lexicon.Purpose;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one purpose.
 *
 * <p>The annotated bean must implement {@link lexicon.registry.PurposeHandler}.
 *
 * <pre>{@code
 * @Component
 * @PurposeListener(Purpose.ADD_WORD)
 * public class WordAudit implements PurposeHandler {
 *   public void handle(Envelope envelope) { ... }
 * }
 * }</pre>
 *
 * <p>Each purpose accepts exactly one handler. While the built-in handlers are
 * enabled ({@code lexicon.consumer.builtin-handlers}), a listener for one of their
 * purposes fails startup.
 *
 * @see PurposeListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface PurposeListener {

  /**
   * The purpose this handler serves.
   */
  Purpose value();
}
