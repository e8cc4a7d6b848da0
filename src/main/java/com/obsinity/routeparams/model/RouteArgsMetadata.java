package com.obsinity.routeparams.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-handler-method table of parameter descriptors, keyed by {@code "{RouteParamType}:{index}"}.
 *
 * <p>Instances are immutable. {@link #with(RouteParamType, RouteParamDescriptor)} returns a new table holding every
 * existing entry plus the written one; a re-written key keeps its original position and the previous table is left
 * untouched.
 *
 * <p>Two different types may target the same parameter index; resolving that is the binder's business.
 */
public final class RouteArgsMetadata {

	private static final RouteArgsMetadata EMPTY = new RouteArgsMetadata(Map.of());

	// Same digits key() writes: no sign, no leading zeros.
	private static final Pattern INDEX = Pattern.compile("0|[1-9][0-9]*");

	private final Map<String, RouteParamDescriptor> entries;

	private RouteArgsMetadata(Map<String, RouteParamDescriptor> entries) {
		this.entries = entries;
	}

	public static RouteArgsMetadata empty() {
		return EMPTY;
	}

	/** Copies {@code entries}, preserving iteration order. Keys are taken as-is. */
	public static RouteArgsMetadata of(Map<String, RouteParamDescriptor> entries) {
		if (entries == null || entries.isEmpty()) return EMPTY;
		return new RouteArgsMetadata(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
	}

	/** Composite key understood by the binder, e.g. {@code "QUERY:1"}. */
	public static String key(RouteParamType type, int index) {
		return type.name() + ":" + index;
	}

	/**
	 * Splits a composite key back into its parts.
	 *
	 * <p>Accepts exactly what {@link #key(RouteParamType, int)} writes for a non-negative index, so
	 * {@code "BODY:+1"}, {@code "BODY:007"} and {@code "BODY:-1"} are rejected.
	 *
	 * @throws IllegalArgumentException if {@code key} is not of the form {@code "{RouteParamType}:{index}"}
	 */
	public static CompositeKey parseKey(String key) {
		Objects.requireNonNull(key, "key");
		int sep = key.lastIndexOf(':');
		if (sep <= 0 || sep == key.length() - 1) {
			throw new IllegalArgumentException("Malformed route args key '" + key + "'");
		}
		String digits = key.substring(sep + 1);
		if (!INDEX.matcher(digits).matches()) {
			throw new IllegalArgumentException("Malformed index in route args key '" + key + "'");
		}
		try {
			return new CompositeKey(RouteParamType.valueOf(key.substring(0, sep)), Integer.parseInt(digits));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Malformed index in route args key '" + key + "'", e);
		}
	}

	public RouteArgsMetadata with(RouteParamType type, RouteParamDescriptor descriptor) {
		Objects.requireNonNull(type, "type");
		Objects.requireNonNull(descriptor, "descriptor");
		Map<String, RouteParamDescriptor> copy = new LinkedHashMap<>(entries);
		copy.put(key(type, descriptor.index()), descriptor);
		return new RouteArgsMetadata(Collections.unmodifiableMap(copy));
	}

	public RouteParamDescriptor get(RouteParamType type, int index) {
		return entries.get(key(type, index));
	}

	public RouteParamDescriptor get(String key) {
		return entries.get(key);
	}

	public boolean contains(RouteParamType type, int index) {
		return entries.containsKey(key(type, index));
	}

	public Set<String> keys() {
		return entries.keySet();
	}

	@JsonValue
	public Map<String, RouteParamDescriptor> asMap() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return (o instanceof RouteArgsMetadata other) && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return "RouteArgsMetadata" + entries;
	}

	/** Parsed form of a composite key. */
	public record CompositeKey(RouteParamType type, int index) {
		@Override
		public String toString() {
			return key(type, index);
		}
	}
}
