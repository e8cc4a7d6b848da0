package com.obsinity.routeparams.registry;

import java.util.Objects;

/** Stable identity of a handler method: owning type plus method name (overloads share one key). */
public record HandlerKey(Class<?> ownerType, String methodName) {

	public HandlerKey {
		Objects.requireNonNull(ownerType, "ownerType");
		Objects.requireNonNull(methodName, "methodName");
	}

	/** Human-friendly id for logs, e.g. {@code CatsController#create}. */
	public String id() {
		return ownerType.getSimpleName() + "#" + methodName;
	}

	@Override
	public String toString() {
		return id();
	}
}
