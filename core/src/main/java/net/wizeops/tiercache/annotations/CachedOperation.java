package net.wizeops.tiercache.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Caches the result of an AI text operation. The first argument of the annotated method
 * is the input text; the first {@link java.util.Map} argument, if any, supplies the
 * operation options.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface CachedOperation {
    String operation();

    /**
     * Index of the argument holding the question for {@code qa} style operations, or -1.
     */
    int questionArgument() default -1;

    /**
     * Overrides the configured operation TTL when positive.
     */
    long ttlSeconds() default -1;
}
