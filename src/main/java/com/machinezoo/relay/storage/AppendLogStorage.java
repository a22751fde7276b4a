// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

import java.io.*;
import java.nio.*;
import java.nio.file.*;
import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.relay.*;
import com.machinezoo.stagean.*;

/*
 * Log file is a sequence of records, each consisting of 4-byte big-endian length and Java-serialized entry.
 * Every record is serialized with its own ObjectOutputStream, because serialization streams cannot be concatenated.
 *
 * Later records override earlier records with the same key. The file is never compacted.
 */
/**
 * Cache storage that appends entries to a log file.
 * The whole log is read into memory on the first query. Subsequent queries are served from memory.
 * Stored values must be serializable.
 */
@DraftCode("compaction")
public class AppendLogStorage extends DataStorage {
	private static final Logger logger = LoggerFactory.getLogger(AppendLogStorage.class);
	record LogEntry(String key, Object data) implements Serializable {
	}
	/*
	 * Shared by all copies created by at().
	 */
	private static class Journal {
		final Path path;
		final OpenMode mode;
		DataOutputStream output;
		Map<String, Object> entries;
		boolean closed;
		Journal(Path path, OpenMode mode) {
			this.path = path;
			this.mode = mode;
		}
	}
	private final Journal journal;
	public AppendLogStorage(Path path, OpenMode mode, Arguments arguments) {
		super(arguments);
		Objects.requireNonNull(path);
		Objects.requireNonNull(mode);
		journal = new Journal(path, mode);
		switch (mode) {
			case READ -> {
				if (!Files.isRegularFile(path))
					throw new UncheckedIOException(new NoSuchFileException(path.toString()));
			}
			case WRITE -> {
				journal.output = open(StandardOpenOption.TRUNCATE_EXISTING);
				journal.entries = new LinkedHashMap<>();
			}
			case APPEND -> journal.output = open(StandardOpenOption.APPEND);
		}
	}
	public AppendLogStorage(Path path, OpenMode mode) {
		this(path, mode, Arguments.none());
	}
	private DataOutputStream open(StandardOpenOption option) {
		var path = journal.path;
		return Exceptions.sneak().get(() -> {
			if (path.getParent() != null)
				Files.createDirectories(path.getParent());
			return new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, option)));
		});
	}
	public Path path() {
		return journal.path;
	}
	public OpenMode mode() {
		return journal.mode;
	}
	private void ensureOpen() {
		if (journal.closed)
			throw new IllegalStateException("Storage " + journal.path + " is closed.");
	}
	private Map<String, Object> entries() {
		ensureOpen();
		if (journal.entries == null) {
			var entries = new LinkedHashMap<String, Object>();
			var buffer = ByteBuffer.wrap(Exceptions.sneak().get(() -> Files.readAllBytes(journal.path)));
			int count = 0;
			while (buffer.hasRemaining()) {
				var payload = new byte[buffer.getInt()];
				buffer.get(payload);
				var entry = (LogEntry)Exceptions.sneak().get(() -> {
					try (var input = new ObjectInputStream(new ByteArrayInputStream(payload))) {
						return input.readObject();
					}
				});
				entries.put(entry.key(), entry.data());
				++count;
			}
			logger.debug("Loaded {} records with {} distinct keys from {}.", count, entries.size(), journal.path);
			journal.entries = entries;
		}
		return journal.entries;
	}
	@Override
	public Object read(Object input, Map<String, ?> metadata) {
		var key = resolve(input, metadata);
		var entries = entries();
		if (!entries.containsKey(key))
			throw new NoDataSourceException("Key: '" + key + "' does not exist.");
		return entries.get(key);
	}
	@Override
	public void write(Object output, Object input, Map<String, ?> metadata) {
		ensureOpen();
		if (journal.output == null)
			throw new NoDataSinkException("Storage " + journal.path + " is opened for reading only.");
		var key = resolve(input, metadata);
		var bytes = new ByteArrayOutputStream();
		Exceptions.sneak().run(() -> {
			try (var serializer = new ObjectOutputStream(bytes)) {
				serializer.writeObject(new LogEntry(key, output));
			}
			journal.output.writeInt(bytes.size());
			bytes.writeTo(journal.output);
			journal.output.flush();
		});
		if (journal.entries != null)
			journal.entries.put(key, output);
		logger.debug("Appended key {} to {}.", key, journal.path);
	}
	@Override
	public boolean exists() {
		return entries().containsKey(get(KEY));
	}
	@Override
	public List<String> keys() {
		return new ArrayList<>(entries().keySet());
	}
	@Override
	public boolean backed() {
		return !journal.closed;
	}
	@Override
	public void close() {
		if (journal.closed)
			return;
		journal.closed = true;
		if (journal.output != null)
			Exceptions.sneak().run(journal.output::close);
	}
	@Override
	public String toString() {
		return "AppendLogStorage(" + journal.path + ", " + journal.mode + ")";
	}
}
