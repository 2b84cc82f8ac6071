package queues.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a queue worker.
 *
 * <p>The annotated bean must implement {@link queues.QueueHandler}. It receives
 * the batches of every queue whose {@code queues.consumers.<queue>.worker}
 * names it.
 *
 * <pre>{@code
 * @Component
 * @QueueWorker("mailer")
 * public class Mailer implements QueueHandler {
 *   public void queue(MessageBatch batch) { ... }
 * }
 * }</pre>
 *
 * @see QueueWorkerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface QueueWorker {

    /**
     * Worker name. Defaults to the bean name.
     */
    String value() default "";
}
