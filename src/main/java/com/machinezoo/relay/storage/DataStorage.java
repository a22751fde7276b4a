// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

import java.io.*;
import java.util.*;
import com.machinezoo.relay.*;
import com.machinezoo.relay.hashing.*;
import com.machinezoo.stagean.*;

/*
 * Storage is a field container, so that it can be rebound to another key with at().
 * Rebound copies share the underlying resource with the original. Closing any of them closes all of them.
 */
/**
 * Key/value store used as a cache of computation results.
 * Entries are addressed by {@link #KEY} if it is set.
 * Otherwise the key is derived from content hash of the input and identifying metadata of the computation.
 * <p>
 * Reads of missing entries throw {@link NoDataSourceException}.
 * Writes to storage that does not accept data throw {@link NoDataSinkException}.
 * Methods {@link #contains(String)}, {@link #get(String)}, and {@link #put(String, Object)}
 * offer map-like access to explicitly named entries.
 *
 * @see DisabledStorage
 * @see AppendLogStorage
 * @see HierarchicalStorage
 */
@DraftApi("iteration over entries, deletion")
public abstract class DataStorage extends FieldContainer implements Closeable {
	/**
	 * Explicit entry key. When absent, entries are addressed by content hash.
	 */
	public static final FieldSpec<String> KEY = FieldSpec.builder("key", String.class).build();
	public static final FieldSpec<ContentHasher> HASHER = FieldSpec.builder("hasher", ContentHasher.class)
		.fallback(new ContentHasher())
		.build();
	static {
		DeclarationRegistry.declare(DataStorage.class, KEY, HASHER);
	}
	protected DataStorage(Arguments arguments) {
		super(arguments);
	}
	/**
	 * Reads cached result of computation.
	 *
	 * @param input
	 *            input of the computation
	 * @param metadata
	 *            identifying metadata of the computation
	 * @return cached output
	 * @throws NoDataSourceException
	 *             if there is no such entry
	 */
	public abstract Object read(Object input, Map<String, ?> metadata);
	/**
	 * Stores result of computation.
	 *
	 * @throws NoDataSinkException
	 *             if this storage does not accept writes
	 */
	public abstract void write(Object output, Object input, Map<String, ?> metadata);
	/**
	 * Checks whether an entry exists under {@link #KEY}.
	 *
	 * @throws MandatoryFieldException
	 *             if {@link #KEY} is not set
	 */
	public abstract boolean exists();
	public abstract List<String> keys();
	/**
	 * Checks whether this storage is open and able to hold data.
	 */
	public abstract boolean backed();
	@Override
	public void close() {
	}
	/**
	 * Gets the key under which result of the given computation is stored.
	 */
	public String resolve(Object input, Map<String, ?> metadata) {
		var key = cell(KEY);
		if (!key.absent())
			return key.value();
		return get(HASHER).hex(Arrays.asList(input, metadata));
	}
	@Override
	public DataStorage at(Map<String, ?> overrides) {
		return (DataStorage)super.at(overrides);
	}
	/**
	 * Creates copy of this storage bound to the given key.
	 */
	public DataStorage at(String key) {
		Objects.requireNonNull(key);
		return at(Map.of(KEY.name(), key));
	}
	public boolean contains(String key) {
		return at(key).exists();
	}
	public Object get(String key) {
		return at(key).read(null, null);
	}
	public void put(String key, Object value) {
		at(key).write(value, null, null);
	}
}
