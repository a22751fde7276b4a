// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import static java.util.stream.Collectors.*;
import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Cells are created lazily on first access, so instances that never touch most of their fields stay small.
 * Values set during construction go through the same cells and the same checks as values set later.
 */
/**
 * Base class for objects configured through declared {@link FieldSpec}s.
 * Constructor wires {@link Arguments} to fields:
 * positional values go to positional fields in declaration order and named values go to fields of the same name.
 * Named values that do not match any field are passed to {@link #acceptUnknown(Map)}, which rejects them by default.
 * <p>
 * Subclasses declare their fields as static constants and register them with {@link DeclarationRegistry}.
 * Fields of parent classes are inherited.
 *
 * @see FieldSpec
 * @see ValueCell
 */
@DraftApi("typed accessor generation")
public abstract class FieldContainer implements Cloneable {
	private Map<String, ValueCell<?>> cells = new HashMap<>();
	protected FieldContainer(Arguments arguments) {
		Objects.requireNonNull(arguments);
		var positionalFields = collect(FieldSpec.class).values().stream()
			.filter(FieldSpec::positional)
			.collect(toList());
		var positional = arguments.positional();
		if (positional.size() > positionalFields.size())
			throw new IllegalArgumentException("Expected at most " + positionalFields.size() + " positional arguments, got " + positional.size() + ".");
		var assigned = new LinkedHashMap<String, Object>();
		for (int i = 0; i < positional.size(); ++i)
			assigned.put(positionalFields.get(i).name(), positional.get(i));
		var unknown = new LinkedHashMap<String, Object>();
		for (var entry : arguments.named().entrySet()) {
			if (assigned.containsKey(entry.getKey()))
				throw new IllegalArgumentException("Argument '" + entry.getKey() + "' was specified as both positional and named argument.");
			if (registry().contains(entry.getKey()) && registry().get(entry.getKey()) instanceof FieldSpec)
				assigned.put(entry.getKey(), entry.getValue());
			else
				unknown.put(entry.getKey(), entry.getValue());
		}
		acceptUnknown(unknown);
		for (var entry : assigned.entrySet())
			if (entry.getValue() != null)
				cell(entry.getKey()).value(entry.getValue());
	}
	/**
	 * Handles named constructor arguments that do not match any declared field.
	 * Subclasses taking extra named arguments should consume them here and pass the rest to super implementation.
	 * This method runs during construction of the base class, so overrides must not rely on initialized instance fields.
	 *
	 * @param unknown
	 *            named arguments not matching any field
	 * @throws IllegalArgumentException
	 *             if there are any unknown arguments
	 */
	protected void acceptUnknown(Map<String, Object> unknown) {
		if (!unknown.isEmpty())
			throw new IllegalArgumentException("Unknown arguments for " + getClass().getSimpleName() + ": " + unknown.keySet());
	}
	public DeclarationRegistry registry() {
		return DeclarationRegistry.of(getClass());
	}
	@SuppressWarnings("unchecked")
	public <T> ValueCell<T> cell(FieldSpec<T> field) {
		var declared = registry().get(FieldSpec.class, field.name());
		if (declared != field)
			throw new IllegalArgumentException("Field '" + field.name() + "' is not declared on " + getClass().getName() + ".");
		return (ValueCell<T>)cells.computeIfAbsent(field.name(), n -> field.cell());
	}
	public ValueCell<?> cell(String name) {
		return cell(registry().get(FieldSpec.class, name));
	}
	public <T> T get(FieldSpec<T> field) {
		return cell(field).value();
	}
	public void set(FieldSpec<?> field, Object value) {
		cell(field).value(value);
	}
	public void clear(FieldSpec<?> field) {
		cell(field).clear();
	}
	/**
	 * Lists declared fields of the given kind in declaration order.
	 */
	@SuppressWarnings("rawtypes")
	public <F extends FieldSpec> Map<String, F> collect(Class<F> kind) {
		return registry().collect(kind);
	}
	/**
	 * Gets effective values of declared fields of the given kind.
	 *
	 * @throws MandatoryFieldException
	 *             if any of the fields is unset
	 */
	@SuppressWarnings("rawtypes")
	public Map<String, Object> collectValues(Class<? extends FieldSpec> kind) {
		var values = new LinkedHashMap<String, Object>();
		for (var field : collect(kind).values())
			values.put(field.name(), cell((FieldSpec<?>)field).value());
		return values;
	}
	/**
	 * Gets effective values of all fields that are not absent.
	 */
	public Map<String, Object> fieldValues() {
		var values = new LinkedHashMap<String, Object>();
		for (var field : collect(FieldSpec.class).values()) {
			var cell = cell((FieldSpec<?>)field);
			if (!cell.absent())
				values.put(field.name(), cell.value());
		}
		return values;
	}
	public void resetDefaults() {
		for (var cell : cells.values())
			cell.clearDefault();
	}
	/**
	 * Sets instance defaults of the named fields.
	 *
	 * @throws IllegalArgumentException
	 *             if any name does not refer to a declared field
	 */
	public void updateDefaults(Map<String, ?> defaults) {
		for (var name : defaults.keySet())
			if (!(registry().contains(name) && registry().get(name) instanceof FieldSpec))
				throw new IllegalArgumentException("'" + name + "' is not a field of " + getClass().getSimpleName() + ".");
		for (var entry : defaults.entrySet())
			cell(entry.getKey()).defaultValue(entry.getValue());
	}
	/**
	 * Creates shallow copy of this container.
	 * Cells are duplicated, so that changing fields of the copy does not affect the original.
	 * Field values themselves are shared.
	 */
	protected FieldContainer copy() {
		try {
			var copy = (FieldContainer)super.clone();
			copy.cells = new HashMap<>();
			for (var entry : cells.entrySet())
				copy.cells.put(entry.getKey(), entry.getValue().copy());
			return copy;
		} catch (CloneNotSupportedException ex) {
			throw new AssertionError(ex);
		}
	}
	/**
	 * Creates copy of this container with the given instance defaults.
	 * Explicit values of the copy are kept, so overrides only apply to fields that are not explicitly set.
	 *
	 * @throws IllegalArgumentException
	 *             if any name does not refer to a declared field
	 */
	public FieldContainer at(Map<String, ?> overrides) {
		var copy = copy();
		copy.updateDefaults(overrides);
		return copy;
	}
	@Override
	public String toString() {
		return fieldValues().entrySet().stream()
			.map(e -> e.getKey() + "=" + e.getValue())
			.collect(joining(", ", getClass().getSimpleName() + "(", ")"));
	}
}
