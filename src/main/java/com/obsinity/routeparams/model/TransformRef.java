package com.obsinity.routeparams.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reference to one pipeline element: either a ready {@link ParamTransform} instance or a transform type the binder
 * instantiates itself.
 *
 * <p>{@code type} is always set (for instances it is the instance's runtime class); {@code instance} is null for
 * type references.
 */
public record TransformRef(Class<? extends ParamTransform> type, ParamTransform instance) {

	public TransformRef {
		Objects.requireNonNull(type, "type");
		if (instance != null && instance.getClass() != type) {
			throw new IllegalArgumentException(
				"instance of " + instance.getClass().getName() + " does not match type " + type.getName());
		}
	}

	public static TransformRef of(Class<? extends ParamTransform> type) {
		return new TransformRef(type, null);
	}

	public static TransformRef of(ParamTransform instance) {
		Objects.requireNonNull(instance, "instance");
		return new TransformRef(instance.getClass(), instance);
	}

	public boolean isInstance() {
		return instance != null;
	}

	/** Compact form used in logs and JSON dumps: the type name, suffixed with {@code @instance} for instances. */
	@JsonValue
	public String describe() {
		return isInstance() ? type.getName() + "@instance" : type.getName();
	}

	@Override
	public String toString() {
		return "TransformRef[" + describe() + "]";
	}
}
