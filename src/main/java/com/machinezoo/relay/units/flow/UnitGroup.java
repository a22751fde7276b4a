// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units.flow;

import java.util.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.units.*;
import com.machinezoo.stagean.*;

/*
 * Functions are wrapped once when children are assigned, so wrapped children keep their state between invocations.
 */
/**
 * Computation unit that combines other units.
 * Children may be given as units or as functions, which are wrapped in {@link FunctionUnit}.
 */
@StubDocs
public abstract class UnitGroup extends ComputationUnit {
	@SuppressWarnings("rawtypes")
	private static class ChildrenField extends FieldSpec<List> {
		ChildrenField(FieldSpec.Builder<List> builder) {
			super(builder);
		}
		@Override
		protected List coerce(Object value) {
			if (value == null)
				return null;
			if (!(value instanceof List<?> list))
				throw new FieldTypeException("Children of a unit group must be a list, got " + value + ".");
			var units = new ArrayList<ComputationUnit>();
			for (var child : list)
				units.add(ComputationUnit.ensure(child));
			return Collections.unmodifiableList(units);
		}
	}
	@SuppressWarnings("rawtypes")
	public static final FieldSpec<List> CHILDREN = new ChildrenField(FieldSpec.builder("children", List.class)
		.mandatory()
		.positional());
	static {
		DeclarationRegistry.declare(UnitGroup.class, CHILDREN);
	}
	protected UnitGroup(Arguments arguments) {
		super(arguments);
	}
	/**
	 * Gets children of this group. Functions among the assigned children are already wrapped in units.
	 */
	@SuppressWarnings("unchecked")
	public List<ComputationUnit> children() {
		return get(CHILDREN);
	}
}
