package com.obsinity.routeparams.decorators;

import static com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.createPipesRouteParamDecorator;
import static com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.createRouteParamDecorator;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.ParamDecoratorFactory;
import com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.PipesParamDecoratorFactory;
import com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.SimpleParamDecoratorFactory;
import com.obsinity.routeparams.model.ParamTransform;
import com.obsinity.routeparams.model.RouteParamType;
import com.obsinity.routeparams.model.TransformRef;

/**
 * The fixed catalog of route parameter decorators, one factory per {@link RouteParamType}.
 *
 * <p>Example, declaring {@code create(@Body("role", ValidationTransform) String role, @Req Request req)}:
 *
 * <pre>{@code
 * RouteParamDecorators.body("role", ValidationTransform.class).apply(registry, CatsController.class, "create", 0);
 * RouteParamDecorators.req().apply(registry, CatsController.class, "create", 1);
 * }</pre>
 *
 * <p>{@code query}, {@code body} and {@code param} take an optional property name followed by transforms; when the
 * first argument is a transform there is no property and it heads the pipeline. Anything that is neither a string
 * nor a transform does not compile. {@code headers} takes a header name only.
 */
public final class RouteParamDecorators {

	private static final SimpleParamDecoratorFactory REQUEST = createRouteParamDecorator(RouteParamType.REQUEST);
	private static final SimpleParamDecoratorFactory RESPONSE = createRouteParamDecorator(RouteParamType.RESPONSE);
	private static final SimpleParamDecoratorFactory NEXT = createRouteParamDecorator(RouteParamType.NEXT);
	private static final SimpleParamDecoratorFactory SESSION = createRouteParamDecorator(RouteParamType.SESSION);
	private static final SimpleParamDecoratorFactory FILE = createRouteParamDecorator(RouteParamType.FILE);
	private static final SimpleParamDecoratorFactory FILES = createRouteParamDecorator(RouteParamType.FILES);
	private static final SimpleParamDecoratorFactory HEADERS = createRouteParamDecorator(RouteParamType.HEADERS);
	private static final PipesParamDecoratorFactory QUERY = createPipesRouteParamDecorator(RouteParamType.QUERY);
	private static final PipesParamDecoratorFactory BODY = createPipesRouteParamDecorator(RouteParamType.BODY);
	private static final PipesParamDecoratorFactory PARAM = createPipesRouteParamDecorator(RouteParamType.PARAM);

	private static final Map<RouteParamType, ParamDecoratorFactory> CATALOG;

	static {
		Map<RouteParamType, ParamDecoratorFactory> m = new EnumMap<>(RouteParamType.class);
		for (ParamDecoratorFactory f : new ParamDecoratorFactory[] {
				REQUEST, RESPONSE, NEXT, SESSION, FILE, FILES, HEADERS, QUERY, BODY, PARAM}) {
			m.put(f.paramtype(), f);
		}
		CATALOG = Collections.unmodifiableMap(m);
	}

	private RouteParamDecorators() {}

	/** Read-only view of every factory, keyed by the type it is bound to. */
	public static Map<RouteParamType, ParamDecoratorFactory> catalog() {
		return CATALOG;
	}

	public static ParamDecoratorFactory factory(RouteParamType type) {
		return CATALOG.get(type);
	}

	/** Injects the underlying platform request object. */
	public static ParamDecorator request() {
		return REQUEST.create();
	}

	/** Alias of {@link #request()}. */
	public static ParamDecorator req() {
		return request();
	}

	/** Injects the underlying platform response object. */
	public static ParamDecorator response() {
		return RESPONSE.create();
	}

	/** Alias of {@link #response()}. */
	public static ParamDecorator res() {
		return response();
	}

	/** Injects the platform's next-callback. */
	public static ParamDecorator next() {
		return NEXT.create();
	}

	public static ParamDecorator session() {
		return SESSION.create();
	}

	public static ParamDecorator uploadedFile() {
		return FILE.create();
	}

	/** Injects a single uploaded file, optionally picked by its form field name. */
	public static ParamDecorator uploadedFile(String fileKey) {
		return FILE.create(fileKey);
	}

	public static ParamDecorator uploadedFiles() {
		return FILES.create();
	}

	public static ParamDecorator headers() {
		return HEADERS.create();
	}

	/** Injects one header, e.g. {@code headers("Cache-Control")}. No transform pipeline. */
	public static ParamDecorator headers(String property) {
		return HEADERS.create(property);
	}

	public static ParamDecorator query() {
		return QUERY.create();
	}

	/**
	 * Injects one property of the query object. The overloads below add a pipeline, given as instances, as types,
	 * or as {@link TransformRef}s when the two are mixed; without a property the whole query object is piped.
	 */
	public static ParamDecorator query(String property) {
		return QUERY.create(property);
	}

	public static ParamDecorator query(String property, TransformRef... pipes) {
		return QUERY.create(property, pipes);
	}

	public static ParamDecorator query(String property, ParamTransform... pipes) {
		return QUERY.create(property, refs(pipes));
	}

	@SafeVarargs
	public static ParamDecorator query(String property, Class<? extends ParamTransform>... pipes) {
		return QUERY.create(property, refs(pipes));
	}

	public static ParamDecorator query(TransformRef firstPipe, TransformRef... pipes) {
		return QUERY.create(firstPipe, pipes);
	}

	public static ParamDecorator query(ParamTransform firstPipe, ParamTransform... pipes) {
		return QUERY.create(TransformRef.of(firstPipe), refs(pipes));
	}

	@SafeVarargs
	public static ParamDecorator query(
			Class<? extends ParamTransform> firstPipe, Class<? extends ParamTransform>... pipes) {
		return QUERY.create(TransformRef.of(firstPipe), refs(pipes));
	}

	public static ParamDecorator body() {
		return BODY.create();
	}

	/**
	 * Injects one property of the request body, e.g. {@code body("role", ValidationTransform.class)}, or with
	 * {@code body(new ValidationTransform())} the whole body through a pipeline.
	 */
	public static ParamDecorator body(String property) {
		return BODY.create(property);
	}

	public static ParamDecorator body(String property, TransformRef... pipes) {
		return BODY.create(property, pipes);
	}

	public static ParamDecorator body(String property, ParamTransform... pipes) {
		return BODY.create(property, refs(pipes));
	}

	@SafeVarargs
	public static ParamDecorator body(String property, Class<? extends ParamTransform>... pipes) {
		return BODY.create(property, refs(pipes));
	}

	public static ParamDecorator body(TransformRef firstPipe, TransformRef... pipes) {
		return BODY.create(firstPipe, pipes);
	}

	public static ParamDecorator body(ParamTransform firstPipe, ParamTransform... pipes) {
		return BODY.create(TransformRef.of(firstPipe), refs(pipes));
	}

	@SafeVarargs
	public static ParamDecorator body(
			Class<? extends ParamTransform> firstPipe, Class<? extends ParamTransform>... pipes) {
		return BODY.create(TransformRef.of(firstPipe), refs(pipes));
	}

	public static ParamDecorator param() {
		return PARAM.create();
	}

	/** Injects a single route parameter such as {@code param("id")}. */
	public static ParamDecorator param(String property) {
		return PARAM.create(property);
	}

	public static ParamDecorator param(String property, TransformRef... pipes) {
		return PARAM.create(property, pipes);
	}

	public static ParamDecorator param(String property, ParamTransform... pipes) {
		return PARAM.create(property, refs(pipes));
	}

	@SafeVarargs
	public static ParamDecorator param(String property, Class<? extends ParamTransform>... pipes) {
		return PARAM.create(property, refs(pipes));
	}

	public static ParamDecorator param(TransformRef firstPipe, TransformRef... pipes) {
		return PARAM.create(firstPipe, pipes);
	}

	public static ParamDecorator param(ParamTransform firstPipe, ParamTransform... pipes) {
		return PARAM.create(TransformRef.of(firstPipe), refs(pipes));
	}

	@SafeVarargs
	public static ParamDecorator param(
			Class<? extends ParamTransform> firstPipe, Class<? extends ParamTransform>... pipes) {
		return PARAM.create(TransformRef.of(firstPipe), refs(pipes));
	}

	private static TransformRef[] refs(ParamTransform[] pipes) {
		return Arrays.stream(pipes).map(TransformRef::of).toArray(TransformRef[]::new);
	}

	private static TransformRef[] refs(Class<? extends ParamTransform>[] pipes) {
		return Arrays.stream(pipes).map(TransformRef::of).toArray(TransformRef[]::new);
	}
}
