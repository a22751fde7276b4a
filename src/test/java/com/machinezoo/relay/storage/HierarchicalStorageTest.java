// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;
import com.google.gson.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.arrays.*;
import com.machinezoo.relay.units.*;

public class HierarchicalStorageTest {
	@TempDir
	Path temp;
	@Test
	public void layout() throws IOException {
		var root = temp.resolve("store");
		try (var storage = new HierarchicalStorage(root, OpenMode.WRITE)) {
			var metadata = new LinkedHashMap<String, Object>();
			metadata.put("name", "unit");
			metadata.put("factor", 3);
			var output = List.of(NumericArray.of(1.0, 2.0), List.of(NumericArray.of(3, 4), "label"));
			var input = NumericArray.of(0.5);
			storage.write(output, input, metadata);
			var key = storage.resolve(input, metadata);
			assertThat(key, matchesPattern("[0-9a-f]{32}"));
			var group = root.resolve(key);
			// Lists become directories with zero-padded indices.
			assertTrue(Files.isRegularFile(group.resolve("data/000")));
			assertTrue(Files.isDirectory(group.resolve("data/001")));
			assertTrue(Files.isRegularFile(group.resolve("data/001/000")));
			assertTrue(Files.isRegularFile(group.resolve("data/001/001")));
			var meta = JsonParser.parseString(Files.readString(group.resolve("meta"))).getAsJsonObject();
			assertEquals("unit", meta.get("name").getAsString());
			assertEquals(3, meta.get("factor").getAsInt());
			// Hash trees mirror list structure.
			var hashes = JsonParser.parseString(Files.readString(group.resolve("output"))).getAsJsonArray();
			assertEquals(2, hashes.size());
			assertEquals(2, hashes.get(1).getAsJsonArray().size());
			assertTrue(JsonParser.parseString(Files.readString(group.resolve("input"))).isJsonPrimitive());
			assertEquals(output, storage.read(input, metadata));
		}
	}
	@Test
	public void keyed() {
		try (var storage = new HierarchicalStorage(temp.resolve("store"), OpenMode.WRITE)) {
			storage.put("weights", NumericArray.of(1f, 2f, 3f).reshape(3, 1));
			storage.put("count", 7L);
			assertTrue(storage.contains("weights"));
			assertFalse(storage.contains("bias"));
			assertEquals(NumericArray.of(1f, 2f, 3f).reshape(3, 1), storage.get("weights"));
			assertEquals(7L, storage.get("count"));
			assertThat(storage.keys(), contains("count", "weights"));
			assertThrows(NoDataSourceException.class, () -> storage.get("bias"));
			// Overwriting replaces the whole entry.
			storage.put("weights", List.of(NumericArray.of(1)));
			assertEquals(List.of(NumericArray.of(1)), storage.get("weights"));
		}
	}
	@Test
	public void modes() {
		var root = temp.resolve("store");
		assertThrows(UncheckedIOException.class, () -> new HierarchicalStorage(root, OpenMode.READ));
		try (var storage = new HierarchicalStorage(root, OpenMode.WRITE)) {
			storage.put("kept", 1);
		}
		try (var storage = new HierarchicalStorage(root, OpenMode.APPEND)) {
			storage.put("added", 2);
			assertThat(storage.keys(), contains("added", "kept"));
		}
		try (var storage = new HierarchicalStorage(root, OpenMode.READ)) {
			assertEquals(1, storage.get("kept"));
			assertThrows(NoDataSinkException.class, () -> storage.put("new", 3));
		}
		// Write mode discards previous entries.
		try (var storage = new HierarchicalStorage(root, OpenMode.WRITE)) {
			assertThat(storage.keys(), empty());
		}
	}
	@Test
	public void unsupported() {
		try (var storage = new HierarchicalStorage(temp.resolve("store"), OpenMode.WRITE)) {
			assertThrows(IllegalArgumentException.class, () -> storage.put("map", Map.of("a", 1)));
			// Rejected values leave nothing behind.
			assertFalse(storage.contains("map"));
			assertThrows(NoDataSourceException.class, () -> storage.get("map"));
			assertFalse(Files.exists(temp.resolve("store/map")));
			assertThrows(IllegalArgumentException.class, () -> storage.put("nested", List.of(1, List.of("a", new Object()))));
			assertFalse(storage.contains("nested"));
			// Previous entry survives a rejected overwrite.
			storage.put("kept", "value");
			assertThrows(IllegalArgumentException.class, () -> storage.put("kept", List.of(Map.of())));
			assertEquals("value", storage.get("kept"));
			assertThat(storage.keys(), contains("kept"));
			assertThrows(IllegalArgumentException.class, () -> storage.put("../escape", 1));
		}
	}
	@Test
	public void incomplete() throws IOException {
		var root = temp.resolve("store");
		try (var storage = new HierarchicalStorage(root, OpenMode.WRITE)) {
			Files.createDirectories(root.resolve("partial"));
			Files.writeString(root.resolve("partial/meta"), "{}");
			assertFalse(storage.contains("partial"));
			assertThrows(NoDataSourceException.class, () -> storage.get("partial"));
			assertThat(storage.keys(), empty());
			storage.put("partial", 5);
			assertEquals(5, storage.get("partial"));
		}
	}
	@Test
	public void uncacheableOutput() {
		try (var storage = new HierarchicalStorage(temp.resolve("store"), OpenMode.WRITE)) {
			Function<Object, Object> function = x -> Map.of("input", x);
			var unit = new FunctionUnit(Arguments.of(function).with("cache", storage));
			// Every invocation fails the same way, because nothing is left in the cache.
			assertThrows(IllegalArgumentException.class, () -> unit.invoke(1));
			assertThrows(IllegalArgumentException.class, () -> unit.invoke(1));
			assertThat(storage.keys(), empty());
		}
	}
	@Test
	public void longList() {
		try (var storage = new HierarchicalStorage(temp.resolve("store"), OpenMode.WRITE)) {
			var values = new ArrayList<Object>();
			for (int i = 0; i < 1005; ++i)
				values.add(i);
			storage.put("long", values);
			assertEquals(values, storage.get("long"));
		}
	}
	@Test
	public void closed() {
		var storage = new HierarchicalStorage(temp.resolve("store"), OpenMode.WRITE);
		var bound = storage.at("key");
		storage.close();
		assertFalse(storage.backed());
		assertThrows(IllegalStateException.class, () -> storage.get("key"));
		// Rebound copies share the closed state.
		assertFalse(bound.backed());
		assertThrows(IllegalStateException.class, bound::exists);
		assertThrows(IllegalStateException.class, storage::keys);
	}
}
