// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.hashing;

import java.io.*;
import java.nio.*;
import java.util.*;
import com.google.common.hash.*;
import com.machinezoo.relay.arrays.*;
import com.machinezoo.stagean.*;

/*
 * Values are hashed by streaming their Java serialization into murmur3.
 * Cryptographic strength is not needed, because cache keys are never exposed to adversarial input.
 *
 * Numeric arrays would be serialized bit-exactly, which makes keys sensitive to floating-point noise.
 * Arrays are therefore replaced during serialization with a coarse identity:
 * element type, shape, and every element split into mantissa and binary exponent
 * with the mantissa rounded to a few decimal places.
 */
/**
 * Stable non-cryptographic hash of arbitrary serializable value graphs.
 * {@link NumericArray}s and primitive numeric arrays are hashed with reduced precision,
 * so that arrays differing only in negligible floating-point jitter produce the same hash.
 * Instances are immutable and can be shared.
 */
@DraftApi("pluggable identity rules for other array types")
public class ContentHasher {
	public static final int DEFAULT_DECIMALS = 2;
	private final int decimals;
	/**
	 * Number of decimal places kept in mantissas of array elements.
	 */
	public int decimals() {
		return decimals;
	}
	public ContentHasher(int decimals) {
		if (decimals < 0 || decimals > 15)
			throw new IllegalArgumentException("Decimals must be between 0 and 15.");
		this.decimals = decimals;
	}
	public ContentHasher() {
		this(DEFAULT_DECIMALS);
	}
	/**
	 * Computes 128-bit hash of the value and formats it as 32 lowercase hexadecimal digits.
	 *
	 * @param value
	 *            value to hash, possibly {@code null}
	 * @return hexadecimal hash
	 * @throws IllegalArgumentException
	 *             if the value graph contains objects that cannot be serialized
	 */
	public String hex(Object value) {
		var hasher = Hashing.murmur3_128().newHasher();
		try (var output = new IdentityStream(Funnels.asOutputStream(hasher))) {
			output.writeObject(value);
		} catch (NotSerializableException ex) {
			throw new IllegalArgumentException("Cannot hash value containing " + ex.getMessage() + ".", ex);
		} catch (IOException ex) {
			throw new UncheckedIOException(ex);
		}
		return hasher.hash().toString();
	}
	/*
	 * Payloads are packed into byte arrays, which are not subject to replacement themselves.
	 */
	/**
	 * Identity that replaces numeric arrays during hashing.
	 */
	public record ArrayIdentity(String type, String shape, byte[] mantissas, byte[] exponents) implements Serializable {
	}
	public ArrayIdentity identify(NumericArray array) {
		var mantissas = ByteBuffer.allocate(8 * array.size());
		var exponents = ByteBuffer.allocate(4 * array.size());
		double scale = Math.pow(10, decimals);
		for (int i = 0; i < array.size(); ++i) {
			double value = array.getDouble(i);
			int exponent = exponent(value);
			/*
			 * Math.rint() rounds half to even, which is how scientific libraries round decimals.
			 * Adding zero turns negative zero into positive zero.
			 */
			mantissas.putDouble(Math.rint(Math.scalb(value, -exponent) * scale) / scale + 0.0);
			exponents.putInt(exponent);
		}
		return new ArrayIdentity(array.type().label(), Arrays.toString(array.shape()), mantissas.array(), exponents.array());
	}
	/*
	 * Binary exponent that brings the mantissa into range [0.5, 1).
	 * Zero, infinities, and NaN keep exponent zero and mantissa equal to the value.
	 */
	static int exponent(double value) {
		if (value == 0 || !Double.isFinite(value))
			return 0;
		if (Math.getExponent(value) < Double.MIN_EXPONENT)
			return exponent(Math.scalb(value, 64)) - 64;
		return Math.getExponent(value) + 1;
	}
	private class IdentityStream extends ObjectOutputStream {
		IdentityStream(OutputStream output) throws IOException {
			super(output);
			enableReplaceObject(true);
		}
		@Override
		protected Object replaceObject(Object obj) {
			if (obj instanceof NumericArray array)
				return identify(array);
			var primitive = NumericArray.wrap(obj);
			if (primitive != null)
				return identify(primitive);
			return obj;
		}
	}
	@Override
	public String toString() {
		return "ContentHasher(decimals=" + decimals + ")";
	}
}
