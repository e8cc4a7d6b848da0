package com.obsinity.routeparams.model;

/**
 * A unit of value conversion or validation applied by the binder to an extracted parameter value.
 *
 * <p>Declarations reference transforms either as ready instances or by type; see {@link TransformRef}. Only the order
 * in which transforms are recorded matters to this library, execution is up to the binder.
 */
@FunctionalInterface
public interface ParamTransform {
	Object transform(Object value, RouteParamDescriptor descriptor);
}
