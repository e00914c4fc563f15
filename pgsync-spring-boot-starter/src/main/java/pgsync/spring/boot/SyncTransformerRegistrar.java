package pgsync.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;
import pgsync.mapping.RowTransformer;
import pgsync.mapping.TransformerRegistry;

import java.util.Map;

/**
 * Collects beans annotated with {@link SyncTransformer} into a {@link TransformerRegistry}.
 *
 * @see SyncTransformer
 */
public class SyncTransformerRegistrar {

  private final ListableBeanFactory beanFactory;

  public SyncTransformerRegistrar(ListableBeanFactory beanFactory) {
    this.beanFactory = beanFactory;
  }

  /**
   * @throws BeanCreationException if an annotated bean is not a {@link RowTransformer}
   *                               or two beans claim the same name
   */
  public TransformerRegistry registry() {
    TransformerRegistry registry = new TransformerRegistry();
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(SyncTransformer.class);
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();

      if (!(bean instanceof RowTransformer transformer)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @SyncTransformer must implement RowTransformer, "
                + "but " + bean.getClass().getName() + " does not");
      }
      SyncTransformer annotation = AnnotationUtils.findAnnotation(bean.getClass(), SyncTransformer.class);
      if (annotation == null) {
        throw new BeanCreationException(beanName,
            "Could not find @SyncTransformer annotation on " + bean.getClass().getName());
      }
      try {
        registry.register(annotation.value(), transformer);
      } catch (IllegalStateException e) {
        throw new BeanCreationException(beanName, e.getMessage(), e);
      }
    }
    return registry;
  }
}
