// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

import static java.util.stream.Collectors.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;
import org.slf4j.*;
import com.google.common.base.Strings;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.gson.*;
import com.machinezoo.noexception.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.arrays.*;
import com.machinezoo.relay.hashing.*;
import com.machinezoo.stagean.*;

/*
 * Layout under the root directory:
 *
 * <key>/data    - stored value, either a leaf file or a directory with children 000, 001, ...
 * <key>/meta    - JSON of identifying metadata
 * <key>/input   - JSON hash tree of the input
 * <key>/output  - JSON hash tree of the output
 *
 * Hash tree mirrors list structure of the value. Leaves are content hashes of list elements.
 * Leaf files start with one tag byte: 'A' for numeric array, 'S' for serialized scalar.
 * Children are read back in numeric order of their names, so lists longer than 1000 elements keep their order.
 *
 * Values are validated before anything is written. Data node is written last.
 * Entries without data node are incomplete and treated as missing.
 */
/**
 * Cache storage that keeps every entry in its own directory.
 * Stored values are numeric arrays, scalars (strings, numbers, booleans), or nested lists of these.
 * Lists are stored as directories, which makes stored data easy to inspect.
 * Every entry also records metadata and hashes of the input and output for auditing.
 */
@DraftCode("atomic replacement of entries")
public class HierarchicalStorage extends DataStorage {
	private static final Logger logger = LoggerFactory.getLogger(HierarchicalStorage.class);
	private static final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();
	private static final byte ARRAY_TAG = 'A';
	private static final byte SCALAR_TAG = 'S';
	/*
	 * Shared by all copies created by at().
	 */
	private static class Tree {
		final Path root;
		final OpenMode mode;
		boolean closed;
		Tree(Path root, OpenMode mode) {
			this.root = root;
			this.mode = mode;
		}
	}
	private final Tree tree;
	public HierarchicalStorage(Path root, OpenMode mode, Arguments arguments) {
		super(arguments);
		Objects.requireNonNull(root);
		Objects.requireNonNull(mode);
		tree = new Tree(root, mode);
		if (mode == OpenMode.READ && !Files.isDirectory(root))
			throw new UncheckedIOException(new NoSuchFileException(root.toString()));
		Exceptions.sneak().run(() -> {
			switch (mode) {
				case WRITE -> {
					if (Files.exists(root))
						MoreFiles.deleteDirectoryContents(root, RecursiveDeleteOption.ALLOW_INSECURE);
					Files.createDirectories(root);
				}
				case APPEND -> Files.createDirectories(root);
			}
		});
	}
	public HierarchicalStorage(Path root, OpenMode mode) {
		this(root, mode, Arguments.none());
	}
	public Path root() {
		return tree.root;
	}
	public OpenMode mode() {
		return tree.mode;
	}
	private void ensureOpen() {
		if (tree.closed)
			throw new IllegalStateException("Storage " + tree.root + " is closed.");
	}
	private Path group(String key) {
		ensureOpen();
		if (key.isEmpty() || key.equals(".") || key.equals("..") || key.contains("/") || key.contains("\\"))
			throw new IllegalArgumentException("Invalid key: '" + key + "'.");
		return tree.root.resolve(key);
	}
	@Override
	public Object read(Object input, Map<String, ?> metadata) {
		var key = resolve(input, metadata);
		var data = group(key).resolve("data");
		if (!Files.exists(data))
			throw new NoDataSourceException("Key: '" + key + "' does not exist.");
		return Exceptions.sneak().get(() -> readNode(data));
	}
	@Override
	public void write(Object output, Object input, Map<String, ?> metadata) {
		var key = resolve(input, metadata);
		var group = group(key);
		if (tree.mode == OpenMode.READ)
			throw new NoDataSinkException("Storage " + tree.root + " is opened for reading only.");
		validate(output);
		var hasher = get(HASHER);
		Exceptions.sneak().run(() -> {
			if (Files.exists(group))
				MoreFiles.deleteRecursively(group, RecursiveDeleteOption.ALLOW_INSECURE);
			Files.createDirectories(group);
			try {
				Files.writeString(group.resolve("meta"), gson.toJson(json(metadata)));
				Files.writeString(group.resolve("input"), gson.toJson(hashTree(hasher, input)));
				Files.writeString(group.resolve("output"), gson.toJson(hashTree(hasher, output)));
				writeNode(group.resolve("data"), output);
			} catch (IOException | RuntimeException ex) {
				MoreFiles.deleteRecursively(group, RecursiveDeleteOption.ALLOW_INSECURE);
				throw ex;
			}
		});
		logger.debug("Stored key {} in {}.", key, tree.root);
	}
	@Override
	public boolean exists() {
		return Files.exists(group(get(KEY)).resolve("data"));
	}
	@Override
	public List<String> keys() {
		ensureOpen();
		return Exceptions.sneak().get(() -> {
			try (var listing = Files.list(tree.root)) {
				return listing
					.filter(p -> Files.exists(p.resolve("data")))
					.map(p -> p.getFileName().toString())
					.sorted()
					.collect(toList());
			}
		});
	}
	@Override
	public boolean backed() {
		return !tree.closed;
	}
	@Override
	public void close() {
		tree.closed = true;
	}
	private static NumericArray array(Object value) {
		return value instanceof NumericArray numeric ? numeric : NumericArray.wrap(value);
	}
	private static void validate(Object value) {
		if (value instanceof List<?> list) {
			for (var item : list)
				validate(item);
		} else if (array(value) == null && !(value instanceof String || value instanceof Number || value instanceof Boolean))
			throw new IllegalArgumentException("Cannot store " + (value == null ? "null" : value.getClass().getName()) + ". Expected numeric array, scalar, or list.");
	}
	private static void writeNode(Path path, Object value) throws IOException {
		if (value instanceof List<?> list) {
			Files.createDirectories(path);
			for (int i = 0; i < list.size(); ++i)
				writeNode(path.resolve(Strings.padStart(Integer.toString(i), 3, '0')), list.get(i));
			return;
		}
		var array = array(value);
		try (var output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
			if (array != null) {
				output.writeByte(ARRAY_TAG);
				array.writeTo(output);
			} else {
				output.writeByte(SCALAR_TAG);
				var serializer = new ObjectOutputStream(output);
				serializer.writeObject(value);
				serializer.flush();
			}
		}
	}
	private static Object readNode(Path path) throws IOException, ClassNotFoundException {
		if (Files.isDirectory(path)) {
			List<Path> children;
			try (var listing = Files.list(path)) {
				children = listing.sorted(Comparator.comparingInt(p -> Integer.parseInt(p.getFileName().toString()))).collect(toList());
			}
			var list = new ArrayList<Object>();
			for (var child : children)
				list.add(readNode(child));
			return Collections.unmodifiableList(list);
		}
		try (var input = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
			int tag = input.readByte();
			if (tag == ARRAY_TAG)
				return NumericArray.readFrom(input);
			if (tag == SCALAR_TAG)
				return new ObjectInputStream(input).readObject();
			throw new StreamCorruptedException("Unknown node tag in " + path);
		}
	}
	private static JsonElement hashTree(ContentHasher hasher, Object value) {
		if (value instanceof List<?> list) {
			var array = new JsonArray();
			for (var item : list)
				array.add(hashTree(hasher, item));
			return array;
		}
		return new JsonPrimitive(hasher.hex(value));
	}
	private static JsonElement json(Object value) {
		if (value == null)
			return JsonNull.INSTANCE;
		if (value instanceof Boolean flag)
			return new JsonPrimitive(flag);
		if (value instanceof Number number)
			return new JsonPrimitive(number);
		if (value instanceof Map<?, ?> map) {
			var object = new JsonObject();
			for (var entry : map.entrySet())
				object.add(String.valueOf(entry.getKey()), json(entry.getValue()));
			return object;
		}
		if (value instanceof List<?> list) {
			var array = new JsonArray();
			for (var item : list)
				array.add(json(item));
			return array;
		}
		return new JsonPrimitive(value.toString());
	}
	@Override
	public String toString() {
		return "HierarchicalStorage(" + tree.root + ", " + tree.mode + ")";
	}
}
