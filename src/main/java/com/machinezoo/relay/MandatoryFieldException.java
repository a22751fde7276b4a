// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

/**
 * Thrown when a field is read while it has neither explicit value nor any default.
 * Mandatory fields are checked only when read, because they can be set any time after construction.
 */
@SuppressWarnings("serial")
public class MandatoryFieldException extends IllegalStateException {
	public MandatoryFieldException(String message) {
		super(message);
	}
}
