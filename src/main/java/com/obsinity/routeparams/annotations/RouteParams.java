package com.obsinity.routeparams.annotations;

/** Shared constants for the route parameter annotations. */
public final class RouteParams {
	private RouteParams() {}

	/**
	 * Default of every {@code value()} member: "no data, bind the whole source value". Any other string, the empty
	 * string included, is recorded as data.
	 */
	public static final String UNSET = "\0__UNSET__";
}
