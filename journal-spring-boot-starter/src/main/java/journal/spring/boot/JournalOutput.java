package journal.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Mounts a {@link journal.Destination} bean on one or more journal paths.
 *
 * <pre>{@code
 * @Component
 * @JournalOutput({"/moderation", "/journal"})
 * public class ModLogChannel implements Destination { ... }
 * }</pre>
 *
 * <p>Outputs declared this way are registered with the router at startup and are not
 * persisted. Use {@link journal.admin.JournalOutputs} for outputs managed at runtime.
 *
 * @see JournalOutputRegistrar
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JournalOutput {

    /**
     * Journal paths to mount the destination on.
     */
    String[] value();

    /**
     * Whether events below each path are delivered too.
     */
    boolean recursive() default true;

    /**
     * Scope the listeners are restricted to. Empty means every scope.
     */
    String scope() default "";

    /**
     * Whether rendered output includes the event path and attributes.
     */
    boolean showAttributes() default true;
}
