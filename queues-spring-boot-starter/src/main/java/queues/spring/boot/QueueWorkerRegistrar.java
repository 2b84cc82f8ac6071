package queues.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import queues.QueueHandler;
import queues.registry.DefaultWorkerRegistry;

import java.util.Map;

/**
 * Scans for beans annotated with {@link QueueWorker} and registers them
 * in the {@link DefaultWorkerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see QueueWorker
 */
public class QueueWorkerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultWorkerRegistry registry;

    public QueueWorkerRegistrar(ListableBeanFactory beanFactory, DefaultWorkerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(QueueWorker.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof QueueHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @QueueWorker must implement QueueHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            QueueWorker annotation = AnnotationUtils.findAnnotation(bean.getClass(), QueueWorker.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, QueueWorker.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @QueueWorker annotation on " + bean.getClass().getName());
            }

            String workerName = annotation.value().isEmpty() ? beanName : annotation.value();
            try {
                registry.register(workerName, handler);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }
}
