package com.obsinity.routeparams.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.routeparams.model.RouteArgsMetadata;

/** Default {@link RouteArgsRegistry}: one map slot per {@link HandlerKey}. */
public class InMemoryRouteArgsRegistry implements RouteArgsRegistry {

	private static final Logger log = LoggerFactory.getLogger(InMemoryRouteArgsRegistry.class);

	private final Map<HandlerKey, RouteArgsMetadata> slots = new ConcurrentHashMap<>();

	@Override
	public RouteArgsMetadata get(Class<?> ownerType, String methodKey) {
		return slots.get(new HandlerKey(ownerType, methodKey));
	}

	@Override
	public void set(Class<?> ownerType, String methodKey, RouteArgsMetadata metadata) {
		Objects.requireNonNull(metadata, "metadata");
		HandlerKey key = new HandlerKey(ownerType, methodKey);
		RouteArgsMetadata previous = slots.put(key, metadata);
		if (log.isTraceEnabled()) {
			log.trace("REGISTRY: set handler={} keys={} (previous={})",
				key, metadata.keys(), (previous == null ? "-" : previous.keys()));
		}
	}

	@Override
	public Set<HandlerKey> handlers() {
		return Set.copyOf(slots.keySet());
	}

	public int size() {
		return slots.size();
	}
}
