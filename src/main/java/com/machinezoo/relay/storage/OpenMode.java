// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.storage;

/**
 * Access mode of file-backed {@link DataStorage}.
 */
public enum OpenMode {
	/**
	 * Existing data can be read, but nothing can be written.
	 */
	READ,
	/**
	 * Existing data is discarded and new data can be written and read back.
	 */
	WRITE,
	/**
	 * Existing data is kept. New data is added to it.
	 */
	APPEND;
	/**
	 * Parses short mode name ("r", "w", or "a").
	 *
	 * @throws IllegalArgumentException
	 *             if the mode is not one of the three short names
	 */
	public static OpenMode parse(String mode) {
		return switch (mode) {
			case "r" -> READ;
			case "w" -> WRITE;
			case "a" -> APPEND;
			default -> throw new IllegalArgumentException("Unsupported mode '" + mode + "'. Expected one of 'r', 'w', or 'a'.");
		};
	}
}
