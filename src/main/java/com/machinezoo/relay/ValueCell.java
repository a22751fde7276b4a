// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Cells are not synchronized. Container instances are confined to one thread at a time.
 */
/**
 * Per-instance storage of one {@link FieldSpec}.
 * Effective value is the explicit value if set, otherwise instance default if set, otherwise {@link FieldSpec#fallback()}.
 * Every assignment is checked against the field's type constraint. Failed assignment leaves the cell unchanged.
 * Absent values are represented by {@code null}, so assigning {@code null} is the same as clearing the level.
 *
 * @param <T>
 *            type of the field's value
 */
@StubDocs
public class ValueCell<T> implements Cloneable {
	private final FieldSpec<T> field;
	public FieldSpec<T> field() {
		return field;
	}
	private T explicit;
	private T preset;
	protected ValueCell(FieldSpec<T> field) {
		this.field = Objects.requireNonNull(field);
	}
	/**
	 * Gets the effective value of the field.
	 *
	 * @return explicit value, instance default, or field fallback, whichever comes first
	 * @throws MandatoryFieldException
	 *             if all three levels are absent
	 */
	public T value() {
		if (explicit != null)
			return explicit;
		var fallen = defaultValue();
		if (fallen == null)
			throw new MandatoryFieldException("Field '" + field.name() + "' is mandatory, yet it has been accessed without being set.");
		return fallen;
	}
	public void value(Object value) {
		explicit = check(value);
	}
	public void clear() {
		explicit = null;
	}
	/**
	 * Gets instance default, falling back to {@link FieldSpec#fallback()}.
	 * Unlike {@link #value()}, this method returns {@code null} when nothing is set.
	 */
	public T defaultValue() {
		return preset != null ? preset : field.fallback();
	}
	public void defaultValue(Object value) {
		preset = check(value);
	}
	public void clearDefault() {
		preset = null;
	}
	public T fallback() {
		return field.fallback();
	}
	/**
	 * Checks whether reading this cell would throw {@link MandatoryFieldException}.
	 */
	public boolean absent() {
		return explicit == null && defaultValue() == null;
	}
	/*
	 * Coercion happens before the type check, so that coerced values are checked too.
	 * Nothing is assigned until the check passes.
	 */
	private T check(Object value) {
		var coerced = field.coerce(value);
		if (!field.accepts(coerced))
			throw new FieldTypeException("Value " + coerced + " of field '" + field.name() + "' is not of type " + field.describeTypes() + ".");
		return coerced;
	}
	@SuppressWarnings("unchecked")
	protected ValueCell<T> copy() {
		try {
			return (ValueCell<T>)super.clone();
		} catch (CloneNotSupportedException ex) {
			throw new AssertionError(ex);
		}
	}
	@Override
	public String toString() {
		var shown = explicit != null ? explicit : defaultValue();
		return field.name() + " = " + shown;
	}
}
