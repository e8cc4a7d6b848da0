package com.obsinity.routeparams.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.springframework.core.annotation.AliasFor;

import com.obsinity.routeparams.model.ParamTransform;

/**
 * Binds the route parameters, or a single one, optionally through a transform pipeline.
 *
 * <pre>
 *   public Cat findOne(@Param("id") String id) { ... }
 * </pre>
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Param {

	/** Name of a single property to extract (shorthand). Unset binds the whole route parameter map. */
	@AliasFor("property")
	String value() default RouteParams.UNSET;

	/** Same as {@link #value()}. */
	@AliasFor("value")
	String property() default RouteParams.UNSET;

	/** Transforms applied left-to-right to the bound value. */
	Class<? extends ParamTransform>[] pipes() default {};
}
