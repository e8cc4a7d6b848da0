package com.obsinity.routeparams.model;

/**
 * Origin of a value bound into a route handler parameter.
 *
 * <p>The set is closed. The constant name is part of the composite metadata key ({@code "BODY:0"}), so constants must
 * never be renamed.
 */
public enum RouteParamType {
	REQUEST,
	RESPONSE,
	NEXT,
	SESSION,
	FILE,
	FILES,
	HEADERS,
	QUERY,
	BODY,
	PARAM;

	/** True for kinds whose declarations may carry a transform pipeline. */
	public boolean acceptsPipes() {
		return this == QUERY || this == BODY || this == PARAM;
	}
}
