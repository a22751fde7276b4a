// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units.flow;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.units.*;

public class SequentialTest {
	static Function<Object, Object> prepend(String prefix) {
		return x -> prefix + x;
	}
	@Test
	public void chain() {
		var group = new Sequential(List.of(prepend("a"), prepend("b"), prepend("c"), prepend("d")));
		assertEquals("dcba=", group.invoke("="));
	}
	@Test
	public void units() {
		var group = new Sequential(List.of(new FunctionUnit(prepend("x")), prepend("y")));
		assertEquals(2, group.children().size());
		assertEquals("yx", group.invoke(""));
	}
	@Test
	public void wrappedOnce() {
		var group = new Sequential(List.of(prepend("x"), prepend("y")));
		assertSame(group.children().get(1), group.children().get(1));
		// Wrapped functions keep their configuration and checkpoint data.
		group.children().get(1).set(ComputationUnit.IS_CHECKPOINT, true);
		group.invoke("");
		assertEquals("yx", group.children().get(1).checkpointData());
	}
	@Test
	public void invalidChildren() {
		assertThrows(FieldTypeException.class, () -> new Sequential(List.of(prepend("x"), "not a unit")));
		assertThrows(FieldTypeException.class, () -> new Sequential(Arguments.of("not a list")));
	}
	@Test
	public void empty() {
		assertEquals("same", new Sequential(List.of()).invoke("same"));
	}
	@Test
	public void childrenRequired() {
		var group = new Sequential(Arguments.none());
		assertThrows(MandatoryFieldException.class, () -> group.invoke("x"));
	}
}
