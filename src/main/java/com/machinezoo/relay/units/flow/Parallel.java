// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units.flow;

import java.util.*;
import com.machinezoo.relay.*;

/*
 * Children run one after another on the calling thread. The group is parallel only in its data flow.
 */
/**
 * Group that gives every child its own input and collects their outputs into a list.
 * List input is split among children, one element per child.
 * Any other input, or any input when {@link #BROADCAST} is set, is passed to every child whole.
 */
public class Parallel extends UnitGroup {
	public static final FieldSpec<Boolean> BROADCAST = FieldSpec.builder("broadcast", Boolean.class).fallback(false).build();
	static {
		DeclarationRegistry.declare(Parallel.class, BROADCAST);
	}
	public Parallel(Arguments arguments) {
		super(arguments);
	}
	public Parallel(List<?> children) {
		this(Arguments.of(children));
	}
	@Override
	protected Object operation(Object input) {
		var children = children();
		List<?> elements;
		if (get(BROADCAST) || !(input instanceof List))
			elements = Collections.nCopies(children.size(), input);
		else
			elements = (List<?>)input;
		if (elements.size() != children.size())
			throw new IllegalArgumentException("Number of data elements and children does not match.");
		var outputs = new ArrayList<Object>();
		for (int i = 0; i < children.size(); ++i)
			outputs.add(children.get(i).invoke(elements.get(i)));
		return Collections.unmodifiableList(outputs);
	}
}
