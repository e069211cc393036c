package lexicon.spring.boot;

import lexicon.registry.DefaultHandlerRegistry;
import lexicon.registry.PurposeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Collects beans annotated with {@link PurposeListener} into a handler registry builder.
 *
 * <p>The registry is immutable once built, so collection happens while the registry
 * bean is being created rather than after singleton instantiation.
 *
 * @see PurposeListener
 */
public class PurposeListenerRegistrar {
  private static final Logger log = LoggerFactory.getLogger(PurposeListenerRegistrar.class);

  private final ListableBeanFactory beanFactory;

  public PurposeListenerRegistrar(ListableBeanFactory beanFactory) {
    this.beanFactory = beanFactory;
  }

  /**
   * Registers every annotated bean with {@code builder}.
   *
   * @throws BeanCreationException if an annotated bean is not a {@link PurposeHandler}
   *                               or its purpose already has a handler
   */
  public DefaultHandlerRegistry.Builder registerAll(DefaultHandlerRegistry.Builder builder) {
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(PurposeListener.class);
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();

      if (!(bean instanceof PurposeHandler handler)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @PurposeListener must implement PurposeHandler, "
                + "but " + bean.getClass().getName() + " does not");
      }

      // proxies may hide the annotation
      PurposeListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), PurposeListener.class);
      if (annotation == null) {
        annotation = beanFactory.findAnnotationOnBean(beanName, PurposeListener.class);
      }
      if (annotation == null) {
        throw new BeanCreationException(beanName,
            "Could not find @PurposeListener annotation on " + bean.getClass().getName());
      }

      try {
        builder.register(annotation.value(), handler);
      } catch (IllegalStateException e) {
        throw new BeanCreationException(beanName, e.getMessage(), e);
      }
      log.info("Registered @PurposeListener bean {} for {}", beanName, annotation.value());
    }
    return builder;
  }
}
