package com.obsinity.routeparams.builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.PipesParamDecoratorFactory;
import com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.SimpleParamDecoratorFactory;
import com.obsinity.routeparams.decorators.RouteParamDecorators;
import com.obsinity.routeparams.model.ParamTransform;
import com.obsinity.routeparams.model.RouteArgsMetadata;
import com.obsinity.routeparams.model.RouteParamType;
import com.obsinity.routeparams.model.TransformRef;
import com.obsinity.routeparams.registry.HandlerKey;
import com.obsinity.routeparams.registry.RouteArgsRegistry;

/**
 * Explicit registration API for code that declares handler parameters without annotations.
 *
 * <pre>{@code
 * RouteArgsBuilder.forHandler(registry, CatsController.class, "create")
 *     .bind(0).fromBody("role").through(ValidationTransform.class)
 *     .and()
 *     .bind(1).fromRequest();
 * }</pre>
 *
 * <p>Each step is written to the registry as soon as it is called, so a property name and its transforms are stated
 * through separate methods and never inferred from argument types. Calling {@code through(...)} again appends to the
 * pipeline of the same parameter.
 */
public final class RouteArgsBuilder {

	private final RouteArgsRegistry registry;
	private final Class<?> ownerType;
	private final String methodName;

	private RouteArgsBuilder(RouteArgsRegistry registry, Class<?> ownerType, String methodName) {
		this.registry = Objects.requireNonNull(registry, "registry");
		this.ownerType = Objects.requireNonNull(ownerType, "ownerType");
		this.methodName = Objects.requireNonNull(methodName, "methodName");
	}

	public static RouteArgsBuilder forHandler(RouteArgsRegistry registry, Class<?> ownerType, String methodName) {
		return new RouteArgsBuilder(registry, ownerType, methodName);
	}

	/** Selects the parameter at {@code index}; the index is recorded as given and checked by the binder. */
	public ParamBinding bind(int index) {
		return new ParamBinding(index);
	}

	/** Current table for this handler; empty when nothing has been bound yet. */
	public RouteArgsMetadata metadata() {
		return registry.getOrEmpty(ownerType, methodName);
	}

	public HandlerKey handlerKey() {
		return new HandlerKey(ownerType, methodName);
	}

	/** Source selection for one parameter position. */
	public final class ParamBinding {
		private final int index;

		private ParamBinding(int index) {
			this.index = index;
		}

		public RouteArgsBuilder fromRequest() {
			return simple(RouteParamType.REQUEST, null);
		}

		public RouteArgsBuilder fromResponse() {
			return simple(RouteParamType.RESPONSE, null);
		}

		public RouteArgsBuilder fromNext() {
			return simple(RouteParamType.NEXT, null);
		}

		public RouteArgsBuilder fromSession() {
			return simple(RouteParamType.SESSION, null);
		}

		public RouteArgsBuilder fromFile() {
			return simple(RouteParamType.FILE, null);
		}

		public RouteArgsBuilder fromFile(String fileKey) {
			return simple(RouteParamType.FILE, fileKey);
		}

		public RouteArgsBuilder fromFiles() {
			return simple(RouteParamType.FILES, null);
		}

		public RouteArgsBuilder fromHeaders() {
			return simple(RouteParamType.HEADERS, null);
		}

		public RouteArgsBuilder fromHeaders(String name) {
			return simple(RouteParamType.HEADERS, name);
		}

		public PipedBinding fromQuery() {
			return piped(RouteParamType.QUERY, null);
		}

		/** @param property property name or structured key, used as data whatever its type */
		public PipedBinding fromQuery(Object property) {
			return piped(RouteParamType.QUERY, property);
		}

		public PipedBinding fromBody() {
			return piped(RouteParamType.BODY, null);
		}

		public PipedBinding fromBody(Object property) {
			return piped(RouteParamType.BODY, property);
		}

		public PipedBinding fromParam() {
			return piped(RouteParamType.PARAM, null);
		}

		public PipedBinding fromParam(Object property) {
			return piped(RouteParamType.PARAM, property);
		}

		private RouteArgsBuilder simple(RouteParamType type, Object data) {
			SimpleParamDecoratorFactory f = (SimpleParamDecoratorFactory) RouteParamDecorators.factory(type);
			f.create(data).apply(registry, ownerType, methodName, index);
			return RouteArgsBuilder.this;
		}

		private PipedBinding piped(RouteParamType type, Object data) {
			PipedBinding binding = new PipedBinding(type, index, data);
			binding.write();
			return binding;
		}
	}

	/** A query/body/param binding that may still receive transforms. */
	public final class PipedBinding {
		private final RouteParamType type;
		private final int index;
		private final Object data;
		private final List<TransformRef> pipes = new ArrayList<>();

		private PipedBinding(RouteParamType type, int index, Object data) {
			this.type = type;
			this.index = index;
			this.data = data;
		}

		public PipedBinding through(TransformRef... refs) {
			for (TransformRef ref : refs) {
				pipes.add(Objects.requireNonNull(ref, "ref"));
			}
			write();
			return this;
		}

		public PipedBinding through(ParamTransform... transforms) {
			return through(Arrays.stream(transforms).map(TransformRef::of).toArray(TransformRef[]::new));
		}

		@SafeVarargs
		public final PipedBinding through(Class<? extends ParamTransform>... types) {
			return through(Arrays.stream(types).map(TransformRef::of).toArray(TransformRef[]::new));
		}

		/** Back to the handler, to bind another parameter. */
		public RouteArgsBuilder and() {
			return RouteArgsBuilder.this;
		}

		public RouteArgsMetadata metadata() {
			return RouteArgsBuilder.this.metadata();
		}

		private void write() {
			PipesParamDecoratorFactory f = (PipesParamDecoratorFactory) RouteParamDecorators.factory(type);
			f.withData(data, pipes).apply(registry, ownerType, methodName, index);
		}
	}
}
