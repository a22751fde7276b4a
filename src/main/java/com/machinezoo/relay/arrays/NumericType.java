// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.arrays;

/**
 * Element type of {@link NumericArray}.
 * Names follow the common convention of scientific array libraries.
 */
public enum NumericType {
	FLOAT64("float64", 8),
	FLOAT32("float32", 4),
	INT64("int64", 8),
	INT32("int32", 4);
	private final String label;
	private final int width;
	NumericType(String label, int width) {
		this.label = label;
		this.width = width;
	}
	public String label() {
		return label;
	}
	/**
	 * Gets size of one element in bytes.
	 */
	public int width() {
		return width;
	}
	public boolean floating() {
		return this == FLOAT64 || this == FLOAT32;
	}
	public static NumericType parse(String label) {
		for (var type : values())
			if (type.label.equals(label))
				return type;
		throw new IllegalArgumentException("Unknown numeric type: " + label);
	}
	@Override
	public String toString() {
		return label;
	}
}
