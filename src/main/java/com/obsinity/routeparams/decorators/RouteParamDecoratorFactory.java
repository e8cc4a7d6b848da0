package com.obsinity.routeparams.decorators;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.routeparams.model.RouteArgsMetadata;
import com.obsinity.routeparams.model.RouteParamType;
import com.obsinity.routeparams.model.TransformRef;
import com.obsinity.routeparams.registry.RouteArgsRegistry;

/**
 * Builds the two flavours of parameter decorator factory.
 *
 * <ul>
 *   <li>{@link #createRouteParamDecorator(RouteParamType)}: optional data, never a pipeline (request, response, next,
 *       session, file(s), headers).
 *   <li>{@link #createPipesRouteParamDecorator(RouteParamType)}: optional property name and/or transform pipeline
 *       (query, body, param). Whether the first argument is data or the first transform is settled by overload:
 *       a {@link String} is data, a {@link TransformRef} is a pipe.
 * </ul>
 */
public final class RouteParamDecoratorFactory {

	private static final Logger log = LoggerFactory.getLogger(RouteParamDecoratorFactory.class);

	private RouteParamDecoratorFactory() {}

	public static SimpleParamDecoratorFactory createRouteParamDecorator(RouteParamType paramtype) {
		return new SimpleParamDecoratorFactory(paramtype);
	}

	public static PipesParamDecoratorFactory createPipesRouteParamDecorator(RouteParamType paramtype) {
		return new PipesParamDecoratorFactory(paramtype);
	}

	/** Common base: one factory is bound to exactly one {@link RouteParamType}. */
	public abstract static sealed class ParamDecoratorFactory
			permits SimpleParamDecoratorFactory, PipesParamDecoratorFactory {
		private final RouteParamType paramtype;

		ParamDecoratorFactory(RouteParamType paramtype) {
			this.paramtype = Objects.requireNonNull(paramtype, "paramtype");
		}

		public RouteParamType paramtype() {
			return paramtype;
		}

		/** Decorator with no data and no pipes. */
		public abstract ParamDecorator create();

		@Override
		public String toString() {
			return getClass().getSimpleName() + "[" + paramtype + "]";
		}
	}

	public static final class SimpleParamDecoratorFactory extends ParamDecoratorFactory {
		SimpleParamDecoratorFactory(RouteParamType paramtype) {
			super(paramtype);
		}

		@Override
		public ParamDecorator create() {
			return create(null);
		}

		public ParamDecorator create(Object data) {
			RouteParamType type = paramtype();
			return (registry, target, key, index) -> store(registry, target, key, index, type, data, List.of());
		}
	}

	public static final class PipesParamDecoratorFactory extends ParamDecoratorFactory {
		PipesParamDecoratorFactory(RouteParamType paramtype) {
			super(paramtype);
		}

		@Override
		public ParamDecorator create() {
			return withData(null, List.of());
		}

		/** Data only; {@code null} binds the whole source value. The empty string is valid data. */
		public ParamDecorator create(String data) {
			return withData(data, List.of());
		}

		/** A string first argument is the data value and {@code pipes} is the whole pipeline. */
		public ParamDecorator create(String data, TransformRef... pipes) {
			return withData(data, Arrays.asList(pipes));
		}

		/**
		 * A transform as first argument is not data: it is prepended back into the pipeline, so the result has no
		 * data and the pipeline {@code [firstPipe, ...pipes]}.
		 */
		public ParamDecorator create(TransformRef firstPipe, TransformRef... pipes) {
			List<TransformRef> paramPipes = new ArrayList<>(pipes.length + 1);
			paramPipes.add(firstPipe);
			paramPipes.addAll(Arrays.asList(pipes));
			return withData(null, paramPipes);
		}

		/** Explicit form with no type inspection: {@code data} is always data, whatever its type. */
		public ParamDecorator withData(Object data, List<TransformRef> pipes) {
			RouteParamType type = paramtype();
			List<TransformRef> paramPipes = (pipes == null) ? List.of() : List.copyOf(pipes);
			return (registry, target, key, index) -> store(registry, target, key, index, type, data, paramPipes);
		}
	}

	/* =========================
	Helpers
	========================= */

	private static void store(
			RouteArgsRegistry registry,
			Class<?> target,
			String methodKey,
			int index,
			RouteParamType paramtype,
			Object data,
			List<TransformRef> pipes) {
		Objects.requireNonNull(registry, "registry");
		Objects.requireNonNull(target, "target");
		Objects.requireNonNull(methodKey, "methodKey");
		// Index range is the binder's concern.

		RouteArgsMetadata args = registry.get(target, methodKey);
		RouteArgsMetadata merged = RouteArgsMetadataMerger.assignMetadata(args, paramtype, index, data, pipes);
		registry.set(target, methodKey, merged);

		log.debug("ROUTE-ARGS: assign handler={}#{} key={} data={} pipes={}",
			target.getSimpleName(), methodKey, RouteArgsMetadata.key(paramtype, index), data, pipes.size());
	}
}
