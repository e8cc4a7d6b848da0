package com.obsinity.routeparams.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import java.util.Map;
import java.util.Set;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsinity.routeparams.annotations.RouteHandler;
import com.obsinity.routeparams.registry.HandlerKey;
import com.obsinity.routeparams.registry.InMemoryRouteArgsRegistry;
import com.obsinity.routeparams.registry.RouteArgsRegistry;
import com.obsinity.routeparams.scan.RouteArgsScanner;

/**
 * Wires the registry and scanner, then scans every {@link RouteHandler} bean once all singletons exist, so the
 * parameter tables are complete before the application starts serving.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class AutoConfiguration {

	private static final Logger log = LoggerFactory.getLogger(AutoConfiguration.class);

	private final ListableBeanFactory beanFactory;

	@Bean
	@ConditionalOnMissingBean(RouteArgsRegistry.class)
	public InMemoryRouteArgsRegistry routeArgsRegistry() {
		return new InMemoryRouteArgsRegistry();
	}

	@Bean
	@ConditionalOnMissingBean
	public RouteArgsScanner routeArgsScanner(RouteArgsRegistry registry, ObjectProvider<ObjectMapper> mapper) {
		return new RouteArgsScanner(registry, mapper.getIfAvailable());
	}

	@Bean
	public SmartInitializingSingleton routeHandlerRegistration(RouteArgsScanner scanner) {
		return () -> {
			Map<String, Object> handlers = beanFactory.getBeansWithAnnotation(RouteHandler.class);
			Set<HandlerKey> keys = scanner.scanBeans(handlers.values());
			log.info("ROUTE-ARGS: registered {} route handler beans, {} handler methods", handlers.size(), keys.size());
		};
	}
}
