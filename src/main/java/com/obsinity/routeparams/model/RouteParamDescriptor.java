package com.obsinity.routeparams.model;

import java.util.List;

/**
 * Immutable record produced by one parameter declaration.
 *
 * @param index parameter position in the handler signature
 * @param data optional discriminator, typically a property name to pluck; {@code null} means the whole source value
 * @param pipes transforms applied left-to-right to the extracted value
 */
public record RouteParamDescriptor(int index, Object data, List<TransformRef> pipes) {

	public RouteParamDescriptor {
		pipes = (pipes == null) ? List.of() : List.copyOf(pipes);
	}

	public boolean hasData() {
		return data != null;
	}
}
