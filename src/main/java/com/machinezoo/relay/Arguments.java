// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Constructor arguments of a {@link FieldContainer}.
 * Positional values are matched with positional fields in declaration order.
 * Named values are matched with fields by name.
 * Instances are immutable. Method {@link #with(String, Object)} returns a modified copy.
 */
@StubDocs
public final class Arguments {
	private static final Arguments NONE = new Arguments(List.of(), Map.of());
	private final List<Object> positional;
	private final Map<String, Object> named;
	private Arguments(List<Object> positional, Map<String, Object> named) {
		this.positional = Collections.unmodifiableList(positional);
		this.named = Collections.unmodifiableMap(named);
	}
	public static Arguments none() {
		return NONE;
	}
	/*
	 * Nulls are allowed in both positional and named values. They leave the field unset.
	 */
	public static Arguments of(Object... positional) {
		return new Arguments(new ArrayList<>(Arrays.asList(positional)), new LinkedHashMap<>());
	}
	public static Arguments named(Map<String, ?> named) {
		return new Arguments(new ArrayList<>(), new LinkedHashMap<>(named));
	}
	public Arguments with(String name, Object value) {
		Objects.requireNonNull(name);
		var extended = new LinkedHashMap<>(named);
		extended.put(name, value);
		return new Arguments(positional, extended);
	}
	public List<Object> positional() {
		return positional;
	}
	public Map<String, Object> named() {
		return named;
	}
	@Override
	public String toString() {
		return "Arguments(" + positional + ", " + named + ")";
	}
}
