package com.obsinity.routeparams.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean whose methods declare route parameters with {@link Body}, {@link Query}, {@link Param} and friends.
 *
 * <p>At startup every such bean is scanned once and its parameter tables are written to the
 * {@code RouteArgsRegistry}, before any request is served.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RouteHandler {}
