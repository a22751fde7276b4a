// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units;

import com.machinezoo.relay.*;

/**
 * Storage of one {@link TaskField} in a {@link Pipeline}.
 * Assigned functions are wrapped in {@link FunctionUnit} before the type check.
 *
 * @param <U>
 *            type of units held by the cell
 */
public class TaskCell<U extends ComputationUnit> extends ValueCell<U> {
	TaskCell(TaskField<U> field) {
		super(field);
	}
	@Override
	public TaskField<U> field() {
		return (TaskField<U>)super.field();
	}
	public Object invoke(Object input) {
		return value().invoke(input);
	}
	@Override
	public String toString() {
		return field().name() + ": " + (absent() ? "unset" : value());
	}
}
