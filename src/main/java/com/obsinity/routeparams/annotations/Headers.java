package com.obsinity.routeparams.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds the request headers, or a single header.
 *
 * <p>Example: {@code update(@Headers("Cache-Control") String cacheControl)}. Headers take no transform pipeline.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Headers {
	/** Name of a single header; unset binds all headers. */
	String value() default RouteParams.UNSET;
}
