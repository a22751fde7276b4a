// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

/**
 * Thrown when a value does not satisfy the type constraint of a field.
 */
@SuppressWarnings("serial")
public class FieldTypeException extends IllegalArgumentException {
	public FieldTypeException(String message) {
		super(message);
	}
}
