// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.arrays.*;

public class AppendLogStorageTest {
	@TempDir
	Path temp;
	@Test
	public void keyed() {
		try (var storage = new AppendLogStorage(temp.resolve("data.log"), OpenMode.WRITE)) {
			assertTrue(storage.backed());
			storage.put("first", 1);
			storage.put("second", List.of("a", "b"));
			assertTrue(storage.contains("first"));
			assertFalse(storage.contains("third"));
			assertEquals(1, storage.get("first"));
			assertEquals(List.of("a", "b"), storage.get("second"));
			assertThat(storage.keys(), contains("first", "second"));
			var missing = assertThrows(NoDataSourceException.class, () -> storage.get("third"));
			assertEquals("Key: 'third' does not exist.", missing.getMessage());
		}
	}
	@Test
	public void reopen() {
		var path = temp.resolve("data.log");
		try (var storage = new AppendLogStorage(path, OpenMode.WRITE)) {
			storage.put("array", NumericArray.of(1.0, 2.0).reshape(1, 2));
			storage.put("value", "old");
			// Later record replaces the earlier one.
			storage.put("value", "new");
		}
		try (var storage = new AppendLogStorage(path, OpenMode.READ)) {
			assertEquals(NumericArray.of(1.0, 2.0).reshape(1, 2), storage.get("array"));
			assertEquals("new", storage.get("value"));
			assertThat(storage.keys(), contains("array", "value"));
			assertThrows(NoDataSinkException.class, () -> storage.put("value", "newer"));
		}
	}
	@Test
	public void append() {
		var path = temp.resolve("data.log");
		try (var storage = new AppendLogStorage(path, OpenMode.WRITE)) {
			storage.put("first", 1);
		}
		try (var storage = new AppendLogStorage(path, OpenMode.APPEND)) {
			storage.put("second", 2);
			assertThat(storage.keys(), contains("first", "second"));
			storage.put("third", 3);
			assertEquals(3, storage.get("third"));
		}
		// Write mode starts from scratch.
		try (var storage = new AppendLogStorage(path, OpenMode.WRITE)) {
			assertThat(storage.keys(), empty());
		}
	}
	@Test
	public void hashed() {
		try (var storage = new AppendLogStorage(temp.resolve("data.log"), OpenMode.WRITE)) {
			var metadata = Map.of("name", "unit");
			assertThrows(NoDataSourceException.class, () -> storage.read(5, metadata));
			storage.write(10, 5, metadata);
			assertEquals(10, storage.read(5, metadata));
			assertThrows(NoDataSourceException.class, () -> storage.read(6, metadata));
			assertEquals(storage.resolve(5, metadata), storage.keys().get(0));
		}
	}
	@Test
	public void missingFile() {
		assertThrows(UncheckedIOException.class, () -> new AppendLogStorage(temp.resolve("missing.log"), OpenMode.READ));
	}
	@Test
	public void closed() {
		var storage = new AppendLogStorage(temp.resolve("data.log"), OpenMode.WRITE);
		var rebound = storage.at("key");
		storage.close();
		assertFalse(storage.backed());
		// Rebound copies share the file.
		assertFalse(rebound.backed());
		assertThrows(IllegalStateException.class, () -> storage.put("key", 1));
		assertThrows(IllegalStateException.class, storage::keys);
	}
	@Test
	public void keyRequired() {
		try (var storage = new AppendLogStorage(temp.resolve("data.log"), OpenMode.WRITE)) {
			assertThrows(MandatoryFieldException.class, storage::exists);
		}
	}
	@Test
	public void modes() {
		assertEquals(OpenMode.READ, OpenMode.parse("r"));
		assertEquals(OpenMode.WRITE, OpenMode.parse("w"));
		assertEquals(OpenMode.APPEND, OpenMode.parse("a"));
		assertThrows(IllegalArgumentException.class, () -> OpenMode.parse("x"));
	}
}
