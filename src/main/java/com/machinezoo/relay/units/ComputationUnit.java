// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units;

import java.lang.invoke.*;
import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.storage.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Caching is transparent. Units compute the same output with or without cache, only faster with it.
 * This is why storage that cannot accept writes is ignored silently while all other storage errors propagate.
 *
 * Cache key includes identifying metadata, so units with different configuration do not share entries.
 * Fields that affect the output should be declared as identifiers.
 */
/**
 * Configurable step of computation.
 * Subclasses implement {@link #operation(Object)}. Callers use {@link #invoke(Object)},
 * which consults {@link #CACHE} before running the operation and stores the result there afterwards.
 * Units flagged with {@link #IS_CHECKPOINT} remember their last output in {@link #checkpointData()}.
 * Units flagged with {@link #IS_OUTPUT} contribute to the output of the enclosing {@link Pipeline}.
 *
 * @see FunctionUnit
 * @see Pipeline
 */
@DraftDocs("examples of custom units")
public abstract class ComputationUnit extends FieldContainer {
	private static final Logger logger = LoggerFactory.getLogger(ComputationUnit.class);
	private static final Timer timer = Metrics.timer("relay.unit.operations");
	private static final Counter hits = Metrics.counter("relay.cache.hits");
	private static final Counter misses = Metrics.counter("relay.cache.misses");
	public static final FieldSpec<Boolean> IS_OUTPUT = FieldSpec.builder("isOutput", Boolean.class).fallback(false).build();
	public static final FieldSpec<Boolean> IS_CHECKPOINT = FieldSpec.builder("isCheckpoint", Boolean.class).fallback(false).build();
	public static final FieldSpec<DataStorage> CACHE = FieldSpec.builder("cache", DataStorage.class).fallback(new DisabledStorage()).build();
	static {
		DeclarationRegistry.declare(ComputationUnit.class, IS_OUTPUT, IS_CHECKPOINT, CACHE);
	}
	private Object checkpointData;
	/**
	 * Gets output of the last invocation if this unit is a checkpoint.
	 *
	 * @return last output or {@code null} if this unit was not invoked as a checkpoint yet
	 */
	public Object checkpointData() {
		return checkpointData;
	}
	protected ComputationUnit(Arguments arguments) {
		super(arguments);
	}
	/**
	 * Computes output of this unit without consulting the cache.
	 *
	 * @param input
	 *            input data
	 * @return output data
	 */
	protected abstract Object operation(Object input);
	/**
	 * Computes output of this unit, possibly reusing cached result.
	 *
	 * @param input
	 *            input data
	 * @return output data
	 */
	public Object invoke(Object input) {
		var cache = get(CACHE);
		var metadata = identifyingMetadata();
		Span span = GlobalTracer.get().buildSpan("relay.invoke")
			.withTag("component", "relay")
			.withTag("unit", getClass().getName())
			.start();
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			Object output;
			try {
				output = cache.read(input, metadata);
				hits.increment();
				span.setTag("cached", true);
				logger.debug("Cache hit in {}.", this);
			} catch (NoDataSourceException ex) {
				if (cache.backed()) {
					misses.increment();
					logger.debug("Cache miss in {}: {}", this, ex.getMessage());
				}
				var sample = Timer.start(Clock.SYSTEM);
				output = operation(input);
				sample.stop(timer);
				try {
					cache.write(output, input, metadata);
				} catch (NoDataSinkException sink) {
					logger.debug("Result of {} not cached: {}", this, sink.getMessage());
				}
			}
			if (get(IS_CHECKPOINT))
				checkpointData = output;
			return output;
		} finally {
			span.finish();
		}
	}
	/**
	 * Gets metadata that distinguishes cache entries of this unit from entries of differently configured units.
	 * Metadata consists of class name under key {@code name} followed by values of identifier fields in declaration order.
	 */
	public Map<String, Object> identifyingMetadata() {
		var metadata = new LinkedHashMap<String, Object>();
		metadata.put("name", getClass().getName());
		for (var field : collect(FieldSpec.class).values())
			if (field.identifier())
				metadata.put(field.name(), cell((FieldSpec<?>)field).value());
		return metadata;
	}
	/**
	 * Creates copy of this unit with the same field values and the same checkpoint data.
	 */
	@Override
	public ComputationUnit copy() {
		return (ComputationUnit)super.copy();
	}
	@Override
	public ComputationUnit at(Map<String, ?> overrides) {
		return (ComputationUnit)super.at(overrides);
	}
	static boolean callable(Object value) {
		return value instanceof Function || value instanceof BiFunction || value instanceof MethodHandle;
	}
	/**
	 * Converts value to computation unit.
	 * Units are returned unchanged. Functions are wrapped in {@link FunctionUnit}.
	 * Instance defaults of the resulting unit are then updated with the given defaults.
	 *
	 * @param value
	 *            unit, {@link Function}, {@link BiFunction}, or {@link MethodHandle}
	 * @param defaults
	 *            instance defaults to apply to the unit
	 * @return computation unit
	 * @throws FieldTypeException
	 *             if the value is neither unit nor function
	 */
	public static ComputationUnit ensure(Object value, Map<String, ?> defaults) {
		ComputationUnit unit;
		if (value instanceof ComputationUnit existing)
			unit = existing;
		else if (callable(value))
			unit = new FunctionUnit(value);
		else
			throw new FieldTypeException("Value " + value + " is neither computation unit nor function.");
		unit.updateDefaults(defaults);
		return unit;
	}
	public static ComputationUnit ensure(Object value) {
		return ensure(value, Map.of());
	}
}
