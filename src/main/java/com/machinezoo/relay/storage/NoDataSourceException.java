// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

/**
 * Thrown when {@link DataStorage} has no data for the requested key.
 * Computation units treat it as a cache miss.
 */
@SuppressWarnings("serial")
public class NoDataSourceException extends RuntimeException {
	public NoDataSourceException() {
		super("No Data Source available.");
	}
	public NoDataSourceException(String message) {
		super(message);
	}
}
