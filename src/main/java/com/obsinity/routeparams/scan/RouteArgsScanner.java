package com.obsinity.routeparams.scan;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.MergedAnnotation;
import org.springframework.core.annotation.MergedAnnotations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.obsinity.routeparams.annotations.Body;
import com.obsinity.routeparams.annotations.Headers;
import com.obsinity.routeparams.annotations.Next;
import com.obsinity.routeparams.annotations.Param;
import com.obsinity.routeparams.annotations.Query;
import com.obsinity.routeparams.annotations.Request;
import com.obsinity.routeparams.annotations.Response;
import com.obsinity.routeparams.annotations.RouteParams;
import com.obsinity.routeparams.annotations.Session;
import com.obsinity.routeparams.annotations.UploadedFile;
import com.obsinity.routeparams.annotations.UploadedFiles;
import com.obsinity.routeparams.decorators.ParamDecorator;
import com.obsinity.routeparams.decorators.RouteParamDecoratorFactory.ParamDecoratorFactory;
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
 * Reads route parameter annotations from handler types and writes the resulting tables to a
 * {@link RouteArgsRegistry}.
 *
 * <p>Methods are visited in a stable order (name, then parameter types) and parameters by index, so repeated scans
 * produce identical tables. Aliases ({@code @Req}, {@code @Res}) are found through their meta-annotation.
 *
 * <p>Methods inherited from superclasses are scanned too and recorded under the scanned type; an override replaces the
 * inherited declaration, annotations included. Several binding annotations on one parameter are all recorded, each
 * under its own key, with a warning. Overloads share the method name and so share one table.
 */
public class RouteArgsScanner {

	private static final Logger log = LoggerFactory.getLogger(RouteArgsScanner.class);

	static final String DUMP_JSON_PROPERTY = "obsinity.routeparams.dumpJson";

	private static final Map<Class<? extends Annotation>, RouteParamType> BINDING_ANNOTATIONS;

	static {
		Map<Class<? extends Annotation>, RouteParamType> m = new LinkedHashMap<>();
		m.put(Request.class, RouteParamType.REQUEST);
		m.put(Response.class, RouteParamType.RESPONSE);
		m.put(Next.class, RouteParamType.NEXT);
		m.put(Session.class, RouteParamType.SESSION);
		m.put(UploadedFile.class, RouteParamType.FILE);
		m.put(UploadedFiles.class, RouteParamType.FILES);
		m.put(Headers.class, RouteParamType.HEADERS);
		m.put(Query.class, RouteParamType.QUERY);
		m.put(Body.class, RouteParamType.BODY);
		m.put(Param.class, RouteParamType.PARAM);
		BINDING_ANNOTATIONS = m;
	}

	private final RouteArgsRegistry registry;
	private final ObjectMapper mapper;

	public RouteArgsScanner(RouteArgsRegistry registry, ObjectMapper mapper) {
		this.registry = Objects.requireNonNull(registry, "registry");
		// Use the application's mapper if provided; otherwise create a default.
		this.mapper = ((mapper != null) ? mapper.copy() : new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);
	}

	/** Scans the user classes behind the given beans (AOP proxies are unwrapped). */
	public Set<HandlerKey> scanBeans(Collection<?> beans) {
		Set<HandlerKey> touched = new LinkedHashSet<>();
		Set<Class<?>> seen = new LinkedHashSet<>();
		for (Object bean : beans) {
			Class<?> userClass = AopUtils.getTargetClass(bean);
			if (seen.add(userClass)) {
				touched.addAll(scan(userClass));
			}
		}
		return touched;
	}

	/**
	 * Applies every binding annotation declared on {@code handlerType}'s methods, inherited ones included.
	 *
	 * @return the handlers that received at least one descriptor
	 */
	public Set<HandlerKey> scan(Class<?> handlerType) {
		Objects.requireNonNull(handlerType, "handlerType");

		Set<HandlerKey> touched = new LinkedHashSet<>();
		int descriptors = 0;

		for (Method m : handlerMethodsInOrder(handlerType)) {
			Parameter[] params = m.getParameters();
			int boundInMethod = 0;

			for (int i = 0; i < params.length; i++) {
				List<RouteParamType> boundTypes = new ArrayList<>(1);
				MergedAnnotations merged = MergedAnnotations.from(params[i]);

				for (Map.Entry<Class<? extends Annotation>, RouteParamType> e : BINDING_ANNOTATIONS.entrySet()) {
					MergedAnnotation<? extends Annotation> ma = merged.get(e.getKey());
					if (!ma.isPresent()) continue;

					decoratorFor(handlerType, m, e.getValue(), ma).apply(registry, handlerType, m.getName(), i);
					boundTypes.add(e.getValue());
				}

				if (boundTypes.size() > 1) {
					log.warn("ROUTE-ARGS: {}parameter {} is bound from several sources {}; the binder decides",
						handlerPrefix(handlerType, m), i, boundTypes);
				}
				boundInMethod += boundTypes.size();
			}

			if (boundInMethod > 0) {
				descriptors += boundInMethod;
				if (!touched.add(new HandlerKey(handlerType, m.getName()))) {
					log.debug("ROUTE-ARGS: {}overload shares the table of an earlier method with the same name",
						handlerPrefix(handlerType, m));
				}
			}
		}

		log.info("ROUTE-ARGS: scanned {} handlers={} descriptors={}",
			handlerType.getSimpleName(), touched.size(), descriptors);
		dumpIfDebug(touched);
		return touched;
	}

	/* =========================
	Annotation -> decorator
	========================= */

	private static ParamDecorator decoratorFor(
			Class<?> handlerType, Method m, RouteParamType type, MergedAnnotation<? extends Annotation> ma) {
		ParamDecoratorFactory factory = RouteParamDecorators.factory(type);
		String data = dataOrNull(ma);

		if (factory instanceof PipesParamDecoratorFactory pipes) {
			return pipes.withData(data, readPipes(handlerType, m, ma));
		}
		return ((SimpleParamDecoratorFactory) factory).create(data);
	}

	private static String dataOrNull(MergedAnnotation<? extends Annotation> ma) {
		if (ma.getValue("value").isEmpty()) return null;
		String v = ma.getString("value");
		return RouteParams.UNSET.equals(v) ? null : v;
	}

	@SuppressWarnings("unchecked")
	private static List<TransformRef> readPipes(
			Class<?> handlerType, Method m, MergedAnnotation<? extends Annotation> ma) {
		if (ma.getValue("pipes").isEmpty()) return List.of();
		Class<?>[] types = ma.getClassArray("pipes");

		List<TransformRef> refs = new ArrayList<>(types.length);
		for (Class<?> t : types) {
			if (!ParamTransform.class.isAssignableFrom(t)
					|| t.isInterface()
					|| Modifier.isAbstract(t.getModifiers())) {
				throw new IllegalStateException(handlerPrefix(handlerType, m) + "@"
					+ ma.getType().getSimpleName() + ".pipes must name concrete ParamTransform types, got "
					+ t.getName());
			}
			refs.add(TransformRef.of((Class<? extends ParamTransform>) t));
		}
		return refs;
	}

	/* =========================
	Utils
	========================= */

	/**
	 * Methods of {@code c} and of its superclasses up to {@code Object}, ordered by name then parameter types.
	 * A superclass method that {@code c} (or a closer superclass) overrides is left out, along with private
	 * superclass methods, which are not inherited.
	 */
	static List<Method> handlerMethodsInOrder(Class<?> c) {
		Set<String> seen = new HashSet<>();
		List<Method> methods = new ArrayList<>();
		for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
			for (Method m : k.getDeclaredMethods()) {
				if (k != c && Modifier.isPrivate(m.getModifiers())) continue;
				// bridges are not scanned but still mark the erased signature as overridden
				if (seen.add(m.getName() + Arrays.toString(m.getParameterTypes()))
						&& !m.isBridge() && !m.isSynthetic()) {
					methods.add(m);
				}
			}
		}
		methods.sort(Comparator.comparing(Method::getName)
			.thenComparing(m -> Arrays.toString(m.getParameterTypes())));
		return methods;
	}

	private static String handlerPrefix(Class<?> handlerType, Method m) {
		return "handler [" + handlerType.getSimpleName() + "#" + m.getName() + "]: ";
	}

	private void dumpIfDebug(Set<HandlerKey> touched) {
		if (!log.isDebugEnabled() || touched.isEmpty() || !dumpJsonEnabled()) return;
		log.debug("ROUTE-ARGS: tables:\n{}", renderTables(touched));
	}

	static boolean dumpJsonEnabled() {
		return Boolean.parseBoolean(System.getProperty(DUMP_JSON_PROPERTY, "true"));
	}

	/** Pretty JSON of the handlers' current tables, keyed by {@code Type#method}. */
	String renderTables(Set<HandlerKey> handlers) {
		Map<String, RouteArgsMetadata> table = new LinkedHashMap<>();
		for (HandlerKey key : handlers) {
			table.put(key.id(), registry.getOrEmpty(key.ownerType(), key.methodName()));
		}
		try {
			return mapper.writeValueAsString(table);
		} catch (JsonProcessingException e) {
			// Fallback to toString() if serialization fails (e.g. an exotic data key)
			log.debug("ROUTE-ARGS: JSON dump failed, using toString(): {}", e.getOriginalMessage());
			return String.valueOf(table);
		}
	}
}
