// Part of Relay: https://relay.machinezoo.com
/**
 * Relay composes analysis pipelines from configurable computation units with optional content-addressable caching.
 * <p>
 * The main package {@link com.machinezoo.relay} contains the declarative field framework.
 * Computation units and pipelines are in {@link com.machinezoo.relay.units}.
 * Cache storage backends are in {@link com.machinezoo.relay.storage}.
 */
module com.machinezoo.relay {
	exports com.machinezoo.relay;
	exports com.machinezoo.relay.units;
	exports com.machinezoo.relay.units.flow;
	exports com.machinezoo.relay.storage;
	exports com.machinezoo.relay.hashing;
	exports com.machinezoo.relay.arrays;
	requires com.machinezoo.stagean;
	requires com.machinezoo.noexception;
	requires org.slf4j;
	requires com.google.common;
	requires com.google.gson;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
}
