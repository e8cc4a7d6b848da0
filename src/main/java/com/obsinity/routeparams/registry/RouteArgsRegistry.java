package com.obsinity.routeparams.registry;

import java.util.Set;

import com.obsinity.routeparams.model.RouteArgsMetadata;

/**
 * Storage slot for route argument metadata, keyed by owning type and method name.
 *
 * <p>Written during handler registration only; the binder reads each handler's table once, after registration has
 * completed. Implementations need plain get/set semantics and no locking beyond safe publication.
 */
public interface RouteArgsRegistry {

	/** Returns the table stored for the handler, or {@code null} when nothing has been declared yet. */
	RouteArgsMetadata get(Class<?> ownerType, String methodKey);

	void set(Class<?> ownerType, String methodKey, RouteArgsMetadata metadata);

	/** Snapshot of the handlers that currently have a table. */
	Set<HandlerKey> handlers();

	default RouteArgsMetadata getOrEmpty(Class<?> ownerType, String methodKey) {
		RouteArgsMetadata current = get(ownerType, methodKey);
		return (current == null) ? RouteArgsMetadata.empty() : current;
	}

	default RouteArgsMetadata get(HandlerKey key) {
		return get(key.ownerType(), key.methodName());
	}
}
