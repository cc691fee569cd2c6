package works.jotter.codec.text;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import works.jotter.codec.JsonNumber;
import works.jotter.exceptions.JsonProcessingException;
import works.jotter.exceptions.NonFiniteNumberException;
import works.jotter.io.JsonSink;

/**
 * Writes numbers as canonical JSON decimal text:
 * no leading zeros except a lone {@code 0}, no {@code +} sign on the mantissa,
 * {@code .} as the decimal point whatever the default locale,
 * and an exponent only when the value is too large or too small to write out plainly.
 * <p>
 * Integers are formatted into a scratch buffer owned by this object,
 * so a formatter must not be shared between threads.
 */
public final class NumberFormatter {
	/**
	 * Decimal digits in 2<sup>64</sup>-1.
	 */
	public static final int MAX_DIGITS_UNSIGNED_64 = 20;

	/**
	 * Sign plus the decimal digits in {@link Long#MIN_VALUE}.
	 */
	public static final int MAX_CHARS_SIGNED_64 = 20;

	/**
	 * Significant decimal digits that always suffice to identify a {@code double}.
	 */
	public static final int MAX_DIGITS_DOUBLE = 17;

	/**
	 * Significant decimal digits that always suffice to identify a {@code float}.
	 */
	public static final int MAX_DIGITS_FLOAT = 9;

	/**
	 * Longest text {@link #writeDouble} can produce: {@code -0.00000} followed by
	 * {@link #MAX_DIGITS_DOUBLE} significant digits.
	 */
	public static final int MAX_CHARS_FLOATING = 8 + MAX_DIGITS_DOUBLE;

	/**
	 * Beyond this decimal exponent, we switch to exponential notation.
	 */
	static final int MAX_PLAIN_EXPONENT = 21;
	static final int MIN_PLAIN_EXPONENT = -6;

	private final byte[] scratch = new byte[Math.max(Math.max(MAX_DIGITS_UNSIGNED_64, MAX_CHARS_SIGNED_64), MAX_CHARS_FLOATING) + 8];

	// Significant digits pulled from the JDK's shortest round-trip representation
	private final byte[] digits = new byte[32];

	public void writeUnsigned(JsonSink sink, long value) throws IOException {
		int start = fillUnsigned(value);
		sink.putn(scratch, start, scratch.length - start);
	}

	public void writeSigned(JsonSink sink, long value) throws IOException {
		// Negation overflows for MIN_VALUE, but the result read as unsigned is still the right magnitude
		long magnitude = (value < 0) ? -value : value;
		int start = fillUnsigned(magnitude);
		if (value < 0) {
			scratch[--start] = '-';
		}
		sink.putn(scratch, start, scratch.length - start);
	}

	public void writeFloat(JsonSink sink, float value) throws IOException {
		if (!Float.isFinite(value)) {
			throw NonFiniteNumberException.of(value);
		}
		// Float.toString gives the digits that identify a float, not the widened double
		int length = layOut(Float.toString(value), MAX_DIGITS_FLOAT);
		if (length < 0) {
			length = layOut(rounded(value, MAX_DIGITS_FLOAT), MAX_DIGITS_FLOAT);
		}
		sink.putn(scratch, 0, length);
	}

	public void writeDouble(JsonSink sink, double value) throws IOException {
		if (!Double.isFinite(value)) {
			throw NonFiniteNumberException.of(value);
		}
		int length = layOut(Double.toString(value), MAX_DIGITS_DOUBLE);
		if (length < 0) {
			length = layOut(rounded(value, MAX_DIGITS_DOUBLE), MAX_DIGITS_DOUBLE);
		}
		sink.putn(scratch, 0, length);
	}

	public void writeNumber(JsonSink sink, JsonNumber value) throws IOException {
		switch (value.type()) {
			case FLOAT -> writeFloat(sink, value.floatValue());
			case DOUBLE -> writeDouble(sink, value.doubleValue());
			case SIGNED -> writeSigned(sink, value.signedValue());
			case UNSIGNED -> writeUnsigned(sink, value.unsignedValue());
			default -> throw new JsonProcessingException("Unexpected number type: " + value.type());
		}
	}

	/**
	 * Before JDK 19, {@link Double#toString(double)} sometimes returns one digit more than needed,
	 * as in {@code 2.82879384806159008E17}.
	 * Rounding the exact binary value to {@code maxDigits} still identifies it.
	 */
	private static String rounded(double value, int maxDigits) {
		return new BigDecimal(value)
			.round(new MathContext(maxDigits, RoundingMode.HALF_EVEN))
			.stripTrailingZeros()
			.toString();
	}

	/**
	 * Digits go into the end of {@link #scratch}, least significant first.
	 *
	 * @return the index of the first digit
	 */
	private int fillUnsigned(long value) {
		int pos = scratch.length;
		if (value < 0) {
			// Top bit set. One unsigned division brings it into signed range.
			long quotient = Long.divideUnsigned(value, 10);
			scratch[--pos] = (byte) ('0' + (value - quotient * 10));
			value = quotient;
		}
		do {
			scratch[--pos] = (byte) ('0' + (value % 10));
			value /= 10;
		} while (value != 0);
		return pos;
	}

	/**
	 * Rearranges the JDK's representation of a finite floating-point value,
	 * which looks like {@code -1.25}, {@code 0.001}, {@code 1.0E-10} or {@code 1E+17},
	 * into our canonical layout at the start of {@link #scratch}.
	 * The JDK representation ignores the default locale.
	 *
	 * @return the number of bytes written, or -1, having written nothing,
	 * if {@code repr} has more than {@code maxDigits} significant digits
	 */
	int layOut(CharSequence repr, int maxDigits) {
		int length = repr.length();
		int i = 0;
		boolean negative = repr.charAt(0) == '-';
		if (negative) {
			i++;
		}

		int numDigits = 0;
		int integerDigits = -1;
		for (; i < length; i++) {
			char c = repr.charAt(i);
			if (c == '.') {
				integerDigits = numDigits;
			} else if (c == 'E') {
				break;
			} else {
				digits[numDigits++] = (byte) c;
			}
		}
		if (integerDigits < 0) {
			integerDigits = numDigits;
		}

		int exponent = 0;
		if (i < length) {
			i++; // 'E'
			boolean negativeExponent = repr.charAt(i) == '-';
			if (negativeExponent || repr.charAt(i) == '+') {
				i++;
			}
			for (; i < length; i++) {
				exponent = exponent * 10 + (repr.charAt(i) - '0');
			}
			if (negativeExponent) {
				exponent = -exponent;
			}
		}

		int first = 0;
		while (first < numDigits && digits[first] == '0') {
			first++;
		}
		int end = numDigits;
		while (end > first && digits[end - 1] == '0') {
			end--;
		}
		if (end - first > maxDigits) {
			return -1;
		}

		int out = 0;
		if (negative) {
			scratch[out++] = '-';
		}
		if (first == end) {
			scratch[out++] = '0';
			return out;
		}

		int significant = end - first;

		// The value is 0.ddd * 10^point, where ddd are the significant digits
		int point = integerDigits - first + exponent;

		if (significant <= point && point <= MAX_PLAIN_EXPONENT) {
			// Integral
			out = copyDigits(first, end, out);
			for (int z = significant; z < point; z++) {
				scratch[out++] = '0';
			}
		} else if (0 < point && point <= MAX_PLAIN_EXPONENT) {
			out = copyDigits(first, first + point, out);
			scratch[out++] = '.';
			out = copyDigits(first + point, end, out);
		} else if (MIN_PLAIN_EXPONENT < point && point <= 0) {
			scratch[out++] = '0';
			scratch[out++] = '.';
			for (int z = point; z < 0; z++) {
				scratch[out++] = '0';
			}
			out = copyDigits(first, end, out);
		} else {
			scratch[out++] = digits[first];
			if (significant > 1) {
				scratch[out++] = '.';
				out = copyDigits(first + 1, end, out);
			}
			scratch[out++] = 'e';
			int e = point - 1;
			if (e < 0) {
				scratch[out++] = '-';
				e = -e;
			} else {
				scratch[out++] = '+';
			}
			int exponentStart = fillUnsigned(e);
			int exponentLength = scratch.length - exponentStart;
			System.arraycopy(scratch, exponentStart, scratch, out, exponentLength);
			out += exponentLength;
		}
		return out;
	}

	private int copyDigits(int from, int to, int out) {
		int n = to - from;
		System.arraycopy(digits, from, scratch, out, n);
		return out + n;
	}
}
