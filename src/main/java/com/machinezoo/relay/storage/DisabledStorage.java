// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

import java.util.*;
import com.machinezoo.relay.*;

/**
 * Storage that never holds any data.
 * This is the default cache of computation units, which makes caching opt-in.
 */
public class DisabledStorage extends DataStorage {
	public DisabledStorage(Arguments arguments) {
		super(arguments);
	}
	public DisabledStorage() {
		this(Arguments.none());
	}
	@Override
	public Object read(Object input, Map<String, ?> metadata) {
		throw new NoDataSourceException();
	}
	@Override
	public void write(Object output, Object input, Map<String, ?> metadata) {
		throw new NoDataSinkException();
	}
	@Override
	public boolean exists() {
		throw new NoDataSourceException();
	}
	@Override
	public List<String> keys() {
		throw new NoDataSourceException();
	}
	@Override
	public boolean backed() {
		return false;
	}
}
