// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units.flow;

import java.util.*;
import com.machinezoo.relay.*;

/**
 * Group that feeds input to the first child and output of every child to the next one.
 * Output of the last child is the output of the group.
 */
public class Sequential extends UnitGroup {
	public Sequential(Arguments arguments) {
		super(arguments);
	}
	public Sequential(List<?> children) {
		this(Arguments.of(children));
	}
	@Override
	protected Object operation(Object input) {
		var data = input;
		for (var child : children())
			data = child.invoke(data);
		return data;
	}
}
