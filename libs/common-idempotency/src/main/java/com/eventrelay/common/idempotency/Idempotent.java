package com.eventrelay.common.idempotency;

import java.lang.annotation.*;

/**
 * Runs the annotated bean method through {@link IdempotencyTemplate}. The method's return
 * value is the cached response.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Idempotent {

    /** SpEL evaluated against the method arguments ({@code #event.id()}, {@code #p0}). */
    String key();

    /** Optional prefix, e.g. the event type, prepended as {@code prefix:key}. */
    String prefix() default "";
}
