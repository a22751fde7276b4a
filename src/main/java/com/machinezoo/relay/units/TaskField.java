// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units;

import java.util.*;
import java.util.function.*;
import com.machinezoo.relay.*;
import com.machinezoo.stagean.*;

/*
 * Default unit is created once when the field is declared and shared by all pipelines that do not override it.
 * Configuration passed to defaults() lands on instance defaults of that shared unit,
 * so it can still be overridden by explicit values.
 */
/**
 * Field of a {@link Pipeline} holding one of its {@link ComputationUnit}s.
 * Values assigned to the field are converted with {@link ComputationUnit#ensure(Object)},
 * so plain functions can be used wherever a unit is expected.
 * When no default is given, the field defaults to identity {@link FunctionUnit}.
 *
 * @param <U>
 *            type of units accepted by this field
 * @see TaskCell
 */
@StubDocs
public class TaskField<U extends ComputationUnit> extends FieldSpec<U> {
	private final Class<U> unitType;
	public Class<U> unitType() {
		return unitType;
	}
	private TaskField(Builder<U> builder) {
		super(builder);
		unitType = builder.unitType;
	}
	@Override
	@SuppressWarnings("unchecked")
	protected U coerce(Object value) {
		if (value == null)
			return null;
		return (U)ComputationUnit.ensure(value);
	}
	@Override
	protected TaskCell<U> cell() {
		return new TaskCell<>(this);
	}
	public static <U extends ComputationUnit> Builder<U> task(String name, Class<U> type) {
		return new Builder<>(name, type);
	}
	/**
	 * Builder for {@link TaskField}.
	 *
	 * @param <U>
	 *            type of units accepted by the field
	 */
	public static class Builder<U extends ComputationUnit> extends FieldSpec.Builder<U> {
		private final Class<U> unitType;
		private Map<String, ?> defaults = Map.of();
		Builder(String name, Class<U> type) {
			super(name, List.of(checked(type)));
			unitType = type;
			super.fallback(Function.identity());
		}
		private static Class<?> checked(Class<?> type) {
			if (!ComputationUnit.class.isAssignableFrom(type))
				throw new FieldTypeException("Type " + type.getName() + " is not a computation unit.");
			return type;
		}
		/**
		 * Sets instance defaults of the default unit, for example {@code Map.of("isOutput", true)}.
		 */
		public Builder<U> defaults(Map<String, ?> defaults) {
			this.defaults = Map.copyOf(defaults);
			return this;
		}
		@Override
		public Builder<U> fallback(Object fallback) {
			super.fallback(fallback);
			return this;
		}
		@Override
		public Builder<U> or(Class<?> type) {
			super.or(checked(type));
			return this;
		}
		@Override
		public Builder<U> mandatory() {
			super.mandatory();
			return this;
		}
		@Override
		public Builder<U> positional() {
			super.positional();
			return this;
		}
		@Override
		public Builder<U> identifier() {
			super.identifier();
			return this;
		}
		@Override
		public TaskField<U> build() {
			if (fallback() != null)
				super.fallback(ComputationUnit.ensure(fallback(), defaults));
			return new TaskField<>(this);
		}
	}
}
