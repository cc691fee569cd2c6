package works.jotter.codec;

import static java.lang.Double.doubleToRawLongBits;
import static java.lang.Double.longBitsToDouble;
import static java.lang.Float.floatToRawIntBits;
import static java.lang.Float.intBitsToFloat;

/**
 * A number held in exactly one of a fixed set of representations,
 * tagged with which one is active.
 * Immutable.
 */
public final class JsonNumber {
	public enum Type {
		FLOAT,
		DOUBLE,
		SIGNED,

		/**
		 * 64-bit unsigned, stored in a {@code long} two's-complement style.
		 */
		UNSIGNED,
	}

	private final Type type;
	private final long bits;

	private JsonNumber(Type type, long bits) {
		this.type = type;
		this.bits = bits;
	}

	public static JsonNumber ofFloat(float value) {
		return new JsonNumber(Type.FLOAT, floatToRawIntBits(value));
	}

	public static JsonNumber ofDouble(double value) {
		return new JsonNumber(Type.DOUBLE, doubleToRawLongBits(value));
	}

	public static JsonNumber ofSigned(long value) {
		return new JsonNumber(Type.SIGNED, value);
	}

	/**
	 * @param value interpreted as unsigned, so {@code -1L} means 2<sup>64</sup>-1
	 */
	public static JsonNumber ofUnsigned(long value) {
		return new JsonNumber(Type.UNSIGNED, value);
	}

	public Type type() {
		return type;
	}

	public float floatValue() {
		expect(Type.FLOAT);
		return intBitsToFloat((int) bits);
	}

	public double doubleValue() {
		expect(Type.DOUBLE);
		return longBitsToDouble(bits);
	}

	public long signedValue() {
		expect(Type.SIGNED);
		return bits;
	}

	public long unsignedValue() {
		expect(Type.UNSIGNED);
		return bits;
	}

	private void expect(Type expected) {
		if (type != expected) {
			throw new IllegalStateException("Number is " + type + ", not " + expected);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof JsonNumber other)) {
			return false;
		}
		return type == other.type && bits == other.bits;
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + Long.hashCode(bits);
	}

	@Override
	public String toString() {
		String value = switch (type) {
			case FLOAT -> Float.toString(floatValue());
			case DOUBLE -> Double.toString(doubleValue());
			case SIGNED -> Long.toString(bits);
			case UNSIGNED -> Long.toUnsignedString(bits);
		};
		return type + "(" + value + ")";
	}
}
