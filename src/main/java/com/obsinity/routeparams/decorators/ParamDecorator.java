package com.obsinity.routeparams.decorators;

import com.obsinity.routeparams.registry.RouteArgsRegistry;

/**
 * A parameter declaration ready to be applied to one position of a handler method.
 *
 * <p>Applying it reads the handler's current table from {@code registry}, folds in one descriptor and writes the
 * result back under the same key.
 */
@FunctionalInterface
public interface ParamDecorator {
	void apply(RouteArgsRegistry registry, Class<?> target, String methodKey, int index);
}
