// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.storage.*;

public class PipelineTest {
	static Function<Object, Object> add(int amount) {
		return x -> (Integer)x + amount;
	}
	static Function<Object, Object> multiply(int factor) {
		return x -> (Integer)x * factor;
	}
	public static class Arithmetic extends Pipeline {
		public static final TaskField<ComputationUnit> INCREMENT = TaskField.task("increment", ComputationUnit.class).fallback(add(1)).build();
		public static final TaskField<ComputationUnit> DOUBLE = TaskField.task("double", ComputationUnit.class).fallback(multiply(2)).build();
		public static final TaskField<ComputationUnit> DECREMENT = TaskField.task("decrement", ComputationUnit.class).fallback(add(-1)).build();
		static {
			DeclarationRegistry.declare(Arithmetic.class, INCREMENT, DOUBLE, DECREMENT);
		}
		public Arithmetic(Arguments arguments) {
			super(arguments);
		}
		public Arithmetic() {
			this(Arguments.none());
		}
	}
	public static class Flagged extends Pipeline {
		public static final TaskField<ComputationUnit> FIRST = TaskField.task("first", ComputationUnit.class)
			.fallback(add(2))
			.defaults(Map.of("isOutput", true))
			.build();
		public static final TaskField<ComputationUnit> SECOND = TaskField.task("second", ComputationUnit.class)
			.fallback(multiply(2))
			.defaults(Map.of("isOutput", true))
			.build();
		static {
			DeclarationRegistry.declare(Flagged.class, FIRST, SECOND);
		}
		public Flagged(Arguments arguments) {
			super(arguments);
		}
	}
	public static class Extended extends Arithmetic {
		public static final TaskField<ComputationUnit> SQUARE = TaskField.task("square", ComputationUnit.class)
			.fallback((Function<Object, Object>)x -> (Integer)x * (Integer)x)
			.build();
		public static final TaskField<ComputationUnit> DOUBLE = TaskField.task("double", ComputationUnit.class).fallback(multiply(3)).build();
		static {
			DeclarationRegistry.declare(Extended.class, SQUARE, DOUBLE);
		}
		public Extended(Arguments arguments) {
			super(arguments);
		}
	}
	static FunctionUnit flagged(Function<Object, Object> function, String flag) {
		return new FunctionUnit(Arguments.of(function).with(flag, true));
	}
	@Test
	public void lastOutput() {
		// Without flagged tasks, output of the last task is returned.
		assertEquals(11, new Arithmetic().invoke(5));
	}
	@Test
	public void singleOutput() {
		var pipeline = new Arithmetic(Arguments.of().with("double", flagged(multiply(2), "isOutput")));
		assertEquals(12, pipeline.invoke(5));
	}
	@Test
	public void multipleOutputs() {
		var pipeline = new Arithmetic(Arguments.of()
			.with("increment", flagged(add(1), "isOutput"))
			.with("decrement", flagged(add(-1), "isOutput")));
		assertEquals(List.of(6, 11), pipeline.invoke(5));
	}
	@Test
	public void declaredOutputs() {
		assertEquals(List.of(7, 14), new Flagged(Arguments.none()).invoke(5));
	}
	@Test
	public void replaceTask() {
		var pipeline = new Arithmetic();
		// Plain functions are wrapped in units when assigned.
		pipeline.set(Arithmetic.DOUBLE, multiply(10));
		assertThat(pipeline.get(Arithmetic.DOUBLE), instanceOf(FunctionUnit.class));
		assertEquals(59, pipeline.invoke(5));
		pipeline.clear(Arithmetic.DOUBLE);
		assertEquals(11, pipeline.invoke(5));
		assertThrows(FieldTypeException.class, () -> pipeline.set(Arithmetic.DOUBLE, "not a task"));
	}
	@Test
	public void inheritance() {
		var pipeline = new Extended(Arguments.none());
		// Overridden task keeps its position, new task is appended.
		assertThat(pipeline.tasks().keySet(), contains("increment", "double", "decrement", "square"));
		assertEquals(289, pipeline.invoke(5));
	}
	@Test
	public void checkpoint() {
		var counter = new AtomicInteger();
		Function<Object, Object> counted = x -> {
			counter.incrementAndGet();
			return (Integer)x + 1;
		};
		var pipeline = new Arithmetic(Arguments.of()
			.with("increment", counted)
			.with("double", flagged(multiply(2), "isCheckpoint")));
		assertThat(pipeline.checkpointUnits().keySet(), contains("double", "decrement"));
		var full = pipeline.invoke(5);
		assertEquals(11, full);
		// Resuming reruns only tasks after the checkpoint.
		assertEquals(full, pipeline.resumeFromCheckpoint());
		assertEquals(1, counter.get());
	}
	@Test
	public void lastCheckpointWins() {
		var pipeline = new Arithmetic(Arguments.of()
			.with("increment", flagged(add(1), "isCheckpoint"))
			.with("double", flagged(multiply(2), "isCheckpoint")));
		assertThat(pipeline.checkpointUnits().keySet(), contains("double", "decrement"));
	}
	@Test
	public void checkpointErrors() {
		var none = assertThrows(IllegalStateException.class, () -> new Arithmetic().checkpointUnits());
		assertEquals("No checkpoints were defined.", none.getMessage());
		var pipeline = new Arithmetic(Arguments.of().with("double", flagged(multiply(2), "isCheckpoint")));
		var unrun = assertThrows(IllegalStateException.class, pipeline::resumeFromCheckpoint);
		assertThat(unrun.getMessage(), containsString("must be run first"));
	}
	@Test
	public void cachedTask(@TempDir Path temp) {
		var counter = new AtomicInteger();
		Function<Object, Object> counted = x -> {
			counter.incrementAndGet();
			return (Integer)x * 2;
		};
		try (var storage = new AppendLogStorage(temp.resolve("tasks.log"), OpenMode.WRITE)) {
			var unit = new FunctionUnit(Arguments.of(counted).with("cache", storage));
			var pipeline = new Arithmetic(Arguments.of().with("double", unit));
			assertEquals(11, pipeline.invoke(5));
			assertEquals(11, pipeline.invoke(5));
			assertEquals(1, counter.get());
		}
	}
	@Test
	public void string() {
		var text = new Arithmetic().toString();
		assertThat(text, startsWith("Arithmetic("));
		assertThat(text, containsString("increment: FunctionUnit("));
		assertThat(text, containsString("decrement: "));
	}
}
