// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units;

import java.lang.invoke.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.relay.*;

/**
 * Computation unit that delegates to a function.
 * Plain functions assigned to {@link TaskField}s are wrapped in this unit.
 * When {@link #BIND_SELF} is set, the function receives the unit itself as its first parameter,
 * which gives it access to fields of the unit.
 */
public class FunctionUnit extends ComputationUnit {
	/**
	 * {@link Function} taking the input or, when {@link #BIND_SELF} is set, {@link BiFunction} taking the unit and the input.
	 * {@link MethodHandle}s are accepted in both cases.
	 */
	public static final FieldSpec<Object> FUNCTION = FieldSpec.anyOf("function", Function.class)
		.fallback(Function.identity())
		.positional()
		.build();
	public static final FieldSpec<Boolean> BIND_SELF = FieldSpec.builder("bindSelf", Boolean.class).fallback(false).build();
	static {
		DeclarationRegistry.declare(FunctionUnit.class, FUNCTION, BIND_SELF);
	}
	public FunctionUnit(Arguments arguments) {
		super(arguments);
	}
	public FunctionUnit(Object function) {
		this(Arguments.of(function));
	}
	public FunctionUnit() {
		this(Arguments.none());
	}
	@Override
	@SuppressWarnings("unchecked")
	protected Object operation(Object input) {
		var function = get(FUNCTION);
		boolean bound = get(BIND_SELF);
		if (function instanceof MethodHandle handle)
			return bound ? call(handle, this, input) : call(handle, input);
		if (bound) {
			if (!(function instanceof BiFunction))
				throw new IllegalStateException("Bound function must take the unit and the input.");
			return ((BiFunction<Object, Object, Object>)function).apply(this, input);
		}
		if (!(function instanceof Function))
			throw new IllegalStateException("Function taking two parameters requires " + BIND_SELF.name() + " to be set.");
		return ((Function<Object, Object>)function).apply(input);
	}
	private static Object call(MethodHandle handle, Object... arguments) {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (RuntimeException | Error ex) {
			throw ex;
		} catch (Throwable ex) {
			throw new CompletionException(ex);
		}
	}
}
