package com.obsinity.routeparams.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsinity.routeparams.annotations.Body;
import com.obsinity.routeparams.annotations.Headers;
import com.obsinity.routeparams.annotations.Next;
import com.obsinity.routeparams.annotations.Param;
import com.obsinity.routeparams.annotations.Query;
import com.obsinity.routeparams.annotations.Req;
import com.obsinity.routeparams.annotations.Request;
import com.obsinity.routeparams.annotations.Res;
import com.obsinity.routeparams.annotations.Session;
import com.obsinity.routeparams.annotations.UploadedFile;
import com.obsinity.routeparams.annotations.UploadedFiles;
import com.obsinity.routeparams.decorators.RouteParamDecorators;
import com.obsinity.routeparams.model.ParamTransform;
import com.obsinity.routeparams.model.RouteArgsMetadata;
import com.obsinity.routeparams.model.RouteParamDescriptor;
import com.obsinity.routeparams.model.RouteParamType;
import com.obsinity.routeparams.model.TransformRef;
import com.obsinity.routeparams.registry.HandlerKey;
import com.obsinity.routeparams.registry.InMemoryRouteArgsRegistry;
import com.obsinity.routeparams.support.TestTransforms.ParseIntTransform;
import com.obsinity.routeparams.support.TestTransforms.TrimTransform;
import com.obsinity.routeparams.support.TestTransforms.ValidationTransform;

class RouteArgsScannerTest {

	/** Handler declared with annotations. */
	static class CatsController {
		public void create(@Body(value = "role", pipes = ValidationTransform.class) String role, @Req Object req) {}

		public void find(
				@Query(property = "limit", pipes = {TrimTransform.class, ParseIntTransform.class}) int limit,
				@Param("id") String id,
				@Headers("Cache-Control") String cacheControl,
				@Res Object res) {}

		public void upload(
				@UploadedFile("avatar") Object file,
				@UploadedFiles Object files,
				@Session Object session,
				@Next Object next,
				@Request Object req) {}

		public void whole(@Body Object body, @Query(pipes = TrimTransform.class) Object query, @Param("") String p) {}

		public void shared(@Query("a") @Param("id") String value) {}

		public void plain(String notBound) {}
	}

	static class BadPipes {
		public void broken(@Body(pipes = ParamTransform.class) Object body) {}
	}

	public interface Greeter {
		String greet(String name);
	}

	public static class GreeterHandler implements Greeter {
		@Override
		public String greet(@Query("name") String name) {
			return "hi " + name;
		}
	}

	static class BaseCrudController<T> {
		public void find(@Query("q") String q) {}

		public void list(@Body Object filter) {}

		public void save(@Body("entity") T entity) {}

		private void audit(@Headers("X-User") String user) {}
	}

	static class DogsController extends BaseCrudController<String> {
		@Override
		public void list(Object filter) {}

		@Override
		public void save(@Param("name") String entity) {}

		public void adopt(@Param("id") String id) {}
	}

	private InMemoryRouteArgsRegistry registry;
	private RouteArgsScanner scanner;

	@BeforeEach
	void setUp() {
		registry = spy(new InMemoryRouteArgsRegistry());
		scanner = new RouteArgsScanner(registry, new ObjectMapper());
	}

	@Test
	@DisplayName("Scanning returns every method that declared at least one binding")
	void touchedHandlers() {
		Set<HandlerKey> keys = scanner.scan(CatsController.class);

		assertThat(keys).extracting(HandlerKey::methodName)
			.containsExactly("create", "find", "shared", "upload", "whole");
		verify(registry, never()).set(eq(CatsController.class), eq("plain"), any());
	}

	@Test
	@DisplayName("Annotation tables equal the tables built with the decorator catalog")
	void annotationsMatchCatalog() {
		scanner.scan(CatsController.class);

		InMemoryRouteArgsRegistry expected = new InMemoryRouteArgsRegistry();
		RouteParamDecorators.body("role", ValidationTransform.class).apply(expected, CatsController.class, "create", 0);
		RouteParamDecorators.req().apply(expected, CatsController.class, "create", 1);

		assertThat(registry.get(CatsController.class, "create"))
			.isEqualTo(expected.get(CatsController.class, "create"));
	}

	@Test
	void pipelineKindsReadPropertyAliasAndPipes() {
		scanner.scan(CatsController.class);
		RouteArgsMetadata find = registry.get(CatsController.class, "find");

		assertThat(find.keys()).containsExactly("QUERY:0", "PARAM:1", "HEADERS:2", "RESPONSE:3");
		assertThat(find.get("QUERY:0")).isEqualTo(new RouteParamDescriptor(0, "limit",
			List.of(TransformRef.of(TrimTransform.class), TransformRef.of(ParseIntTransform.class))));
		assertThat(find.get("PARAM:1")).isEqualTo(new RouteParamDescriptor(1, "id", List.of()));
		assertThat(find.get("HEADERS:2")).isEqualTo(new RouteParamDescriptor(2, "Cache-Control", List.of()));
		assertThat(find.get("RESPONSE:3")).isEqualTo(new RouteParamDescriptor(3, null, List.of()));
	}

	@Test
	void simpleKinds() {
		scanner.scan(CatsController.class);
		RouteArgsMetadata upload = registry.get(CatsController.class, "upload");

		assertThat(upload.keys()).containsExactly("FILE:0", "FILES:1", "SESSION:2", "NEXT:3", "REQUEST:4");
		assertThat(upload.get("FILE:0").data()).isEqualTo("avatar");
		assertThat(upload.get("FILES:1").data()).isNull();
	}

	@Test
	@DisplayName("Unset value means whole source; empty string is recorded as data")
	void unsetVersusEmpty() {
		scanner.scan(CatsController.class);
		RouteArgsMetadata whole = registry.get(CatsController.class, "whole");

		assertThat(whole.get("BODY:0")).isEqualTo(new RouteParamDescriptor(0, null, List.of()));
		assertThat(whole.get("QUERY:1"))
			.isEqualTo(new RouteParamDescriptor(1, null, List.of(TransformRef.of(TrimTransform.class))));
		assertThat(whole.get("PARAM:2").data()).isEqualTo("");
	}

	@Test
	@DisplayName("Several sources on one parameter are all recorded")
	void sharedIndex() {
		scanner.scan(CatsController.class);
		RouteArgsMetadata shared = registry.get(CatsController.class, "shared");

		assertThat(shared.asMap()).containsOnlyKeys("QUERY:0", "PARAM:0");
		verify(registry, atLeastOnce()).set(eq(CatsController.class), eq("shared"), any());
	}

	@Test
	@DisplayName("Abstract pipe types are a configuration error")
	void abstractPipeRejected() {
		assertThatThrownBy(() -> scanner.scan(BadPipes.class))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("BadPipes#broken")
			.hasMessageContaining("@Body.pipes");
	}

	@Test
	@DisplayName("Rescanning the same type yields identical tables")
	void rescanIsStable() {
		scanner.scan(CatsController.class);
		Map<String, RouteArgsMetadata> first = Map.of(
			"find", registry.get(CatsController.class, "find"),
			"whole", registry.get(CatsController.class, "whole"));

		scanner.scan(CatsController.class);

		assertThat(registry.get(CatsController.class, "find")).isEqualTo(first.get("find"));
		assertThat(registry.get(CatsController.class, "whole")).isEqualTo(first.get("whole"));
	}

	@Test
	@DisplayName("AOP proxies are scanned through their target class")
	void scanBeansUnwrapsProxies() {
		ProxyFactory pf = new ProxyFactory(new GreeterHandler());
		pf.setProxyTargetClass(true);
		Object proxy = pf.getProxy();

		Set<HandlerKey> keys = scanner.scanBeans(List.of(proxy, new GreeterHandler()));

		assertThat(keys).containsExactly(new HandlerKey(GreeterHandler.class, "greet"));
		assertThat(registry.get(GreeterHandler.class, "greet").get("QUERY:0").data()).isEqualTo("name");
	}

	@Test
	@DisplayName("Inherited handler methods are recorded under the scanned subclass")
	void inheritedMethodsAreScanned() {
		Set<HandlerKey> keys = scanner.scan(DogsController.class);

		assertThat(keys).extracting(HandlerKey::methodName).containsExactly("adopt", "find", "save");
		assertThat(keys).allSatisfy(k -> assertThat(k.ownerType()).isEqualTo(DogsController.class));
		assertThat(registry.get(DogsController.class, "find").get("QUERY:0"))
			.isEqualTo(new RouteParamDescriptor(0, "q", List.of()));
		assertThat(registry.get(BaseCrudController.class, "find")).isNull();
	}

	@Test
	@DisplayName("An override replaces the inherited declaration, generic ones included")
	void overridesWinOverInheritedDeclarations() {
		scanner.scan(DogsController.class);

		assertThat(registry.get(DogsController.class, "list")).isNull();
		assertThat(registry.get(DogsController.class, "save").keys()).containsExactly("PARAM:0");
		assertThat(registry.get(DogsController.class, "save").get("PARAM:0").data()).isEqualTo("name");
		assertThat(registry.get(DogsController.class, "audit")).isNull();
	}

	@Test
	@DisplayName("Table dump renders pretty JSON keyed by Type#method")
	void renderTablesAsJson() {
		Set<HandlerKey> keys = scanner.scan(CatsController.class);

		String json = scanner.renderTables(keys);

		assertThat(json).contains("\"CatsController#create\"", "\"BODY:0\"", "\"role\"",
			ValidationTransform.class.getName());
		assertThat(json).contains(System.lineSeparator());
	}

	@Test
	@DisplayName("Table dump falls back to toString() when a data value cannot be serialised")
	void renderTablesFallsBackToToString() {
		Object opaque = new Object();
		registry.set(CatsController.class, "create", RouteArgsMetadata.empty()
			.with(RouteParamType.BODY, new RouteParamDescriptor(5, opaque, List.of())));

		String dump = scanner.renderTables(Set.of(new HandlerKey(CatsController.class, "create")));

		assertThat(dump).startsWith("{CatsController#create=RouteArgsMetadata{BODY:5=");
		assertThat(dump).contains(opaque.toString());
	}

	@Test
	@DisplayName("obsinity.routeparams.dumpJson switches the table dump off")
	void dumpJsonProperty() {
		String previous = System.getProperty(RouteArgsScanner.DUMP_JSON_PROPERTY);
		try {
			System.clearProperty(RouteArgsScanner.DUMP_JSON_PROPERTY);
			assertThat(RouteArgsScanner.dumpJsonEnabled()).isTrue();

			System.setProperty(RouteArgsScanner.DUMP_JSON_PROPERTY, "false");
			assertThat(RouteArgsScanner.dumpJsonEnabled()).isFalse();
			assertThat(scanner.scan(CatsController.class)).isNotEmpty();
		} finally {
			if (previous == null) {
				System.clearProperty(RouteArgsScanner.DUMP_JSON_PROPERTY);
			} else {
				System.setProperty(RouteArgsScanner.DUMP_JSON_PROPERTY, previous);
			}
		}
	}
}
