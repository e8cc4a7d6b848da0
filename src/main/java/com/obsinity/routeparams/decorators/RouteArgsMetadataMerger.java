package com.obsinity.routeparams.decorators;

import java.util.Arrays;
import java.util.List;

import com.obsinity.routeparams.model.RouteArgsMetadata;
import com.obsinity.routeparams.model.RouteParamDescriptor;
import com.obsinity.routeparams.model.RouteParamType;
import com.obsinity.routeparams.model.TransformRef;

/** Folds one descriptor into a handler's table without touching the entries already present for other keys. */
public final class RouteArgsMetadataMerger {
	private RouteArgsMetadataMerger() {}

	/**
	 * Returns a new table equal to {@code args} with key {@code "{paramtype}:{index}"} added or overwritten.
	 *
	 * @param args current table; {@code null} is treated as empty. Never mutated.
	 * @param paramtype source of the bound value
	 * @param index parameter position
	 * @param data optional discriminator, may be {@code null}
	 * @param pipes transforms in application order
	 */
	public static RouteArgsMetadata assignMetadata(
			RouteArgsMetadata args, RouteParamType paramtype, int index, Object data, TransformRef... pipes) {
		return assignMetadata(args, paramtype, index, data, (pipes == null) ? List.of() : Arrays.asList(pipes));
	}

	public static RouteArgsMetadata assignMetadata(
			RouteArgsMetadata args, RouteParamType paramtype, int index, Object data, List<TransformRef> pipes) {
		RouteArgsMetadata base = (args == null) ? RouteArgsMetadata.empty() : args;
		return base.with(paramtype, new RouteParamDescriptor(index, data, pipes));
	}
}
