// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import static java.util.stream.Collectors.*;
import java.lang.invoke.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Field specification is immutable. Per-instance state lives in ValueCell.
 *
 * Type constraint is a closed set of classes checked with Class.isInstance().
 * Primitive classes are mapped to their wrappers, because values are always boxed.
 */
/**
 * Typed, defaultable field declared on a {@link FieldContainer} class.
 * Field resolves its value through three levels: explicit value, instance default, and fallback declared here.
 * Fields are usually declared as {@code public static final} constants and registered via {@link DeclarationRegistry}.
 * <p>
 * Mandatory fields have no fallback. Reading them while unset throws {@link MandatoryFieldException}.
 * Positional fields can be initialized with positional constructor arguments.
 * Identifier fields become part of identifying metadata used as a cache key.
 *
 * @param <T>
 *            type of the field's value
 * @see ValueCell
 * @see FieldContainer
 */
@DraftDocs("examples")
public class FieldSpec<T> implements Declaration {
	/*
	 * Lambdas may target any functional interface and method handles are not functional interfaces at all.
	 * Fields typed as Function accept these other callable kinds as well.
	 */
	private static final List<Class<?>> FUNCTION_KINDS = List.of(Function.class, BiFunction.class, MethodHandle.class);
	private final String name;
	@Override
	public String name() {
		return name;
	}
	private final List<Class<?>> types;
	public List<Class<?>> types() {
		return types;
	}
	private final T fallback;
	public T fallback() {
		return fallback;
	}
	private final boolean mandatory;
	public boolean mandatory() {
		return mandatory;
	}
	private final boolean positional;
	public boolean positional() {
		return positional;
	}
	private final boolean identifier;
	public boolean identifier() {
		return identifier;
	}
	protected FieldSpec(Builder<T> builder) {
		name = Objects.requireNonNull(builder.name);
		if (name.isEmpty())
			throw new IllegalArgumentException("Field name must not be empty.");
		if (builder.types.isEmpty())
			throw new FieldTypeException("Field '" + name + "' must have at least one type.");
		var accepted = new ArrayList<Class<?>>();
		for (var type : builder.types)
			accepted.add(wrap(Objects.requireNonNull(type)));
		if (accepted.contains(Function.class))
			for (var kind : FUNCTION_KINDS)
				if (!accepted.contains(kind))
					accepted.add(kind);
		types = List.copyOf(accepted);
		mandatory = builder.mandatory;
		positional = builder.positional;
		identifier = builder.identifier;
		fallback = mandatory ? null : coerce(builder.fallback);
		if (fallback != null && !accepts(fallback))
			throw new FieldTypeException("Default value " + fallback + " of field '" + name + "' is not of type " + describeTypes() + ".");
	}
	private static Class<?> wrap(Class<?> type) {
		if (!type.isPrimitive())
			return type;
		return MethodType.methodType(type).wrap().returnType();
	}
	/**
	 * Checks whether the value satisfies type constraint of this field.
	 * Absent ({@code null}) value is always accepted.
	 */
	public boolean accepts(Object value) {
		if (value == null)
			return true;
		for (var type : types)
			if (type.isInstance(value))
				return true;
		return false;
	}
	/**
	 * Converts assigned value to the representation stored in the field.
	 * The default implementation returns the value unchanged. Subclasses can convert compatible values.
	 *
	 * @param value
	 *            assigned value, possibly {@code null}
	 * @return converted value
	 */
	@SuppressWarnings("unchecked")
	protected T coerce(Object value) {
		return (T)value;
	}
	/**
	 * Creates per-instance storage for this field.
	 * Subclasses may return a specialized cell.
	 */
	protected ValueCell<T> cell() {
		return new ValueCell<>(this);
	}
	String describeTypes() {
		if (types.size() == 1)
			return types.get(0).getName();
		return types.stream().map(Class::getName).collect(joining(", ", "(", ")"));
	}
	@Override
	public String toString() {
		return "FieldSpec(" + name + ": " + describeTypes() + (mandatory ? ", mandatory" : fallback != null ? " = " + fallback : "") + ")";
	}
	public static <T> Builder<T> builder(String name, Class<T> type) {
		return new Builder<T>(name, List.<Class<?>>of(type));
	}
	/**
	 * Starts declaration of field that accepts values of any of the listed types.
	 */
	public static Builder<Object> anyOf(String name, Class<?>... types) {
		return new Builder<Object>(name, List.of(types));
	}
	/**
	 * Builder for {@link FieldSpec}.
	 *
	 * @param <T>
	 *            type of the field's value
	 */
	public static class Builder<T> {
		private final String name;
		private final List<Class<?>> types = new ArrayList<>();
		private Object fallback;
		private boolean mandatory;
		private boolean positional;
		private boolean identifier;
		protected Builder(String name, List<Class<?>> types) {
			this.name = name;
			this.types.addAll(types);
		}
		/**
		 * Accepts another type besides the primary one.
		 * The alternative type should be assignable to {@code T} or callers will fail reading the field.
		 */
		public Builder<T> or(Class<?> type) {
			types.add(type);
			return this;
		}
		public Builder<T> fallback(Object fallback) {
			this.fallback = fallback;
			return this;
		}
		public Builder<T> mandatory() {
			mandatory = true;
			return this;
		}
		public Builder<T> positional() {
			positional = true;
			return this;
		}
		public Builder<T> identifier() {
			identifier = true;
			return this;
		}
		protected Object fallback() {
			return fallback;
		}
		public FieldSpec<T> build() {
			return new FieldSpec<>(this);
		}
	}
}
