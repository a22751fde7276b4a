// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units.flow;

import java.util.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.units.*;

/**
 * Unit that picks elements of list input by index and arranges them into nested lists.
 * Indices are integers or lists of indices, so that output has the same nesting as {@link #INDICES}.
 * The same index may appear repeatedly. Negative indices count from the end.
 * Input other than a list is treated as a list containing only the input.
 */
public class Shaper extends ComputationUnit {
	@SuppressWarnings("rawtypes")
	public static final FieldSpec<List> INDICES = FieldSpec.builder("indices", List.class)
		.mandatory()
		.positional()
		.identifier()
		.build();
	static {
		DeclarationRegistry.declare(Shaper.class, INDICES);
	}
	public Shaper(Arguments arguments) {
		super(arguments);
	}
	public Shaper(List<?> indices) {
		this(Arguments.of(indices));
	}
	@Override
	protected Object operation(Object input) {
		var data = input instanceof List<?> list ? list : Collections.singletonList(input);
		return extract(data, get(INDICES));
	}
	private static List<Object> extract(List<?> data, List<?> indices) {
		var extracted = new ArrayList<Object>();
		for (var index : indices) {
			if (index instanceof List<?> nested)
				extracted.add(extract(data, nested));
			else if (index instanceof Integer position) {
				int resolved = position < 0 ? data.size() + position : position;
				if (resolved < 0 || resolved >= data.size())
					throw new IllegalArgumentException("An invalid index was used to index the input data: " + position);
				extracted.add(data.get(resolved));
			} else
				throw new IllegalArgumentException("Index must be an integer or a list of indices: " + index);
		}
		return Collections.unmodifiableList(extracted);
	}
}
