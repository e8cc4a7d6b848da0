package com.obsinity.routeparams.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.obsinity.routeparams.model.RouteArgsMetadata;
import com.obsinity.routeparams.model.RouteParamDescriptor;
import com.obsinity.routeparams.model.RouteParamType;

class InMemoryRouteArgsRegistryTest {

	static class OrdersController {}

	static class InvoicesController {}

	private final InMemoryRouteArgsRegistry registry = new InMemoryRouteArgsRegistry();

	@Test
	void absentSlotReadsAsNullOrEmpty() {
		assertThat(registry.get(OrdersController.class, "list")).isNull();
		assertThat(registry.getOrEmpty(OrdersController.class, "list")).isSameAs(RouteArgsMetadata.empty());
		assertThat(registry.handlers()).isEmpty();
	}

	@Test
	void slotsAreKeyedByTypeAndMethodName() {
		RouteArgsMetadata table = RouteArgsMetadata.empty()
			.with(RouteParamType.QUERY, new RouteParamDescriptor(0, "page", List.of()));

		registry.set(OrdersController.class, "list", table);

		assertThat(registry.get(OrdersController.class, "list")).isSameAs(table);
		assertThat(registry.get(new HandlerKey(OrdersController.class, "list"))).isSameAs(table);
		assertThat(registry.get(InvoicesController.class, "list")).isNull();
		assertThat(registry.get(OrdersController.class, "show")).isNull();
		assertThat(registry.handlers()).containsExactly(new HandlerKey(OrdersController.class, "list"));
		assertThat(registry.size()).isEqualTo(1);
	}

	@Test
	void handlersIsASnapshot() {
		registry.set(OrdersController.class, "list", RouteArgsMetadata.empty());
		var snapshot = registry.handlers();

		registry.set(OrdersController.class, "show", RouteArgsMetadata.empty());

		assertThat(snapshot).hasSize(1);
		assertThat(registry.handlers()).hasSize(2);
	}

	@Test
	void nullMetadataIsRejected() {
		assertThatThrownBy(() -> registry.set(OrdersController.class, "list", null))
			.isInstanceOf(NullPointerException.class);
	}

	@Test
	void handlerKeyId() {
		assertThat(new HandlerKey(OrdersController.class, "list")).hasToString("OrdersController#list");
	}
}
