// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

/**
 * Thrown when {@link DataStorage} cannot accept writes.
 * Computation units ignore it, because caching is optional.
 */
@SuppressWarnings("serial")
public class NoDataSinkException extends RuntimeException {
	public NoDataSinkException() {
		super("No Data Target available.");
	}
	public NoDataSinkException(String message) {
		super(message);
	}
}
