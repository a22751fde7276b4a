// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.arrays;

import java.io.*;
import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Floating-point elements are kept in double[] and integer elements in long[].
 * Both float32 and int32 values fit losslessly, so one buffer per kind is enough.
 * Element type is still remembered, because it is part of array identity.
 */
/**
 * Immutable n-dimensional array of numbers stored in row-major order.
 */
@StubDocs
@DraftApi("slicing and arithmetic")
public final class NumericArray implements Serializable {
	private static final long serialVersionUID = 1L;
	private final NumericType type;
	private final int[] shape;
	private final double[] doubles;
	private final long[] longs;
	private NumericArray(NumericType type, int[] shape, double[] doubles, long[] longs) {
		this.type = type;
		this.shape = shape;
		this.doubles = doubles;
		this.longs = longs;
		int expected = 1;
		for (int dimension : shape) {
			if (dimension < 0)
				throw new IllegalArgumentException("Negative dimension: " + Arrays.toString(shape));
			expected *= dimension;
		}
		if (expected != size())
			throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " does not match " + size() + " elements.");
	}
	public static NumericArray of(double... values) {
		return new NumericArray(NumericType.FLOAT64, new int[] { values.length }, values.clone(), null);
	}
	public static NumericArray of(float... values) {
		var widened = new double[values.length];
		for (int i = 0; i < values.length; ++i)
			widened[i] = values[i];
		return new NumericArray(NumericType.FLOAT32, new int[] { values.length }, widened, null);
	}
	public static NumericArray of(long... values) {
		return new NumericArray(NumericType.INT64, new int[] { values.length }, null, values.clone());
	}
	public static NumericArray of(int... values) {
		var widened = new long[values.length];
		for (int i = 0; i < values.length; ++i)
			widened[i] = values[i];
		return new NumericArray(NumericType.INT32, new int[] { values.length }, null, widened);
	}
	/**
	 * Wraps primitive numeric array ({@code double[]}, {@code float[]}, {@code long[]}, or {@code int[]}).
	 *
	 * @return one-dimensional array or {@code null} if the value is not a supported primitive array
	 */
	public static NumericArray wrap(Object primitive) {
		if (primitive instanceof double[] values)
			return of(values);
		if (primitive instanceof float[] values)
			return of(values);
		if (primitive instanceof long[] values)
			return of(values);
		if (primitive instanceof int[] values)
			return of(values);
		return null;
	}
	/**
	 * Returns array with the same elements and different shape.
	 *
	 * @throws IllegalArgumentException
	 *             if the new shape has a different number of elements
	 */
	public NumericArray reshape(int... shape) {
		return new NumericArray(type, shape.clone(), doubles, longs);
	}
	public NumericType type() {
		return type;
	}
	public int[] shape() {
		return shape.clone();
	}
	public int size() {
		return doubles != null ? doubles.length : longs.length;
	}
	public double getDouble(int index) {
		return doubles != null ? doubles[index] : longs[index];
	}
	public long getLong(int index) {
		return longs != null ? longs[index] : (long)doubles[index];
	}
	public double[] toDoubles() {
		var result = new double[size()];
		for (int i = 0; i < result.length; ++i)
			result[i] = getDouble(i);
		return result;
	}
	public void writeTo(DataOutput output) throws IOException {
		output.writeUTF(type.label());
		output.writeInt(shape.length);
		for (int dimension : shape)
			output.writeInt(dimension);
		for (int i = 0; i < size(); ++i) {
			switch (type) {
				case FLOAT64 -> output.writeDouble(doubles[i]);
				case FLOAT32 -> output.writeFloat((float)doubles[i]);
				case INT64 -> output.writeLong(longs[i]);
				case INT32 -> output.writeInt((int)longs[i]);
			}
		}
	}
	public static NumericArray readFrom(DataInput input) throws IOException {
		var type = NumericType.parse(input.readUTF());
		var shape = new int[input.readInt()];
		int size = 1;
		for (int i = 0; i < shape.length; ++i) {
			shape[i] = input.readInt();
			size *= shape[i];
		}
		double[] doubles = type.floating() ? new double[size] : null;
		long[] longs = type.floating() ? null : new long[size];
		for (int i = 0; i < size; ++i) {
			switch (type) {
				case FLOAT64 -> doubles[i] = input.readDouble();
				case FLOAT32 -> doubles[i] = input.readFloat();
				case INT64 -> longs[i] = input.readLong();
				case INT32 -> longs[i] = input.readInt();
			}
		}
		return new NumericArray(type, shape, doubles, longs);
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof NumericArray other
			&& type == other.type
			&& Arrays.equals(shape, other.shape)
			&& Arrays.equals(doubles, other.doubles)
			&& Arrays.equals(longs, other.longs);
	}
	@Override
	public int hashCode() {
		return Objects.hash(type, Arrays.hashCode(shape), Arrays.hashCode(doubles), Arrays.hashCode(longs));
	}
	@Override
	public String toString() {
		var elements = new StringJoiner(", ", "[", "]");
		for (int i = 0; i < Math.min(size(), 10); ++i)
			elements.add(type.floating() ? Double.toString(getDouble(i)) : Long.toString(getLong(i)));
		if (size() > 10)
			elements.add("...");
		return type + Arrays.toString(shape) + elements;
	}
}
