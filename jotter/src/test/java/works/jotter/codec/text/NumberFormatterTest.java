package works.jotter.codec.text;

import java.io.IOException;
import java.util.Locale;
import java.util.Random;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.jotter.codec.JsonNumber;
import works.jotter.exceptions.NonFiniteNumberException;
import works.jotter.io.ByteArraySink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NumberFormatterTest {
	NumberFormatter formatter;
	ByteArraySink sink;

	@BeforeEach
	void setUp() {
		formatter = new NumberFormatter();
		sink = new ByteArraySink();
	}

	String signed(long value) throws IOException {
		sink.reset();
		formatter.writeSigned(sink, value);
		return sink.toString();
	}

	String unsigned(long value) throws IOException {
		sink.reset();
		formatter.writeUnsigned(sink, value);
		return sink.toString();
	}

	String doubleText(double value) throws IOException {
		sink.reset();
		formatter.writeDouble(sink, value);
		return sink.toString();
	}

	String floatText(float value) throws IOException {
		sink.reset();
		formatter.writeFloat(sink, value);
		return sink.toString();
	}

	static LongStream interestingLongs() {
		return LongStream.of(
			0, 1, -1, 9, 10, -10, 99, 100,
			Integer.MAX_VALUE, Integer.MIN_VALUE,
			999_999_999_999_999_999L, 1_000_000_000_000_000_000L,
			Long.MAX_VALUE, Long.MIN_VALUE, Long.MIN_VALUE + 1);
	}

	@ParameterizedTest
	@MethodSource("interestingLongs")
	void signedMatchesCanonical(long value) throws IOException {
		String text = signed(value);
		assertEquals(Long.toString(value), text);
		assertEquals(value, Long.parseLong(text));
	}

	@ParameterizedTest
	@MethodSource("interestingLongs")
	void unsignedMatchesCanonical(long value) throws IOException {
		String text = unsigned(value);
		assertEquals(Long.toUnsignedString(value), text);
		assertEquals(value, Long.parseUnsignedLong(text));
	}

	@Test
	void extremes() throws IOException {
		assertEquals("0", signed(0));
		assertEquals("-9223372036854775808", signed(Long.MIN_VALUE));
		assertEquals("18446744073709551615", unsigned(-1L));
		assertEquals(NumberFormatter.MAX_DIGITS_UNSIGNED_64, unsigned(-1L).length());
		assertEquals(NumberFormatter.MAX_CHARS_SIGNED_64, signed(Long.MIN_VALUE).length());
	}

	@Test
	void randomIntegersRoundTrip() throws IOException {
		Random random = new Random(123);
		for (int i = 0; i < 10_000; i++) {
			long value = random.nextLong() >> random.nextInt(64);
			assertEquals(Long.toString(value), signed(value));
			assertEquals(Long.toUnsignedString(value), unsigned(value));
		}
	}

	@ParameterizedTest
	@CsvSource({
		"0.0,                     0",
		"-0.0,                    -0",
		"1.0,                     1",
		"-1.0,                    -1",
		"100.0,                   100",
		"0.5,                     0.5",
		"0.1,                     0.1",
		"123.456,                 123.456",
		"0.001,                   0.001",
		"1.0E-6,                  0.000001",
		"1.25E-6,                 0.00000125",
		"1.0E-7,                  1e-7",
		"1.5E-7,                  1.5e-7",
		"1.0E7,                   10000000",
		"1.0E20,                  100000000000000000000",
		"1.0E21,                  1e+21",
		"1.2345E21,               1.2345e+21",
		"1.7976931348623157E308,  1.7976931348623157e+308",
		"4.9E-324,                4.9e-324",
	})
	void doubleLayout(double value, String expected) throws IOException {
		assertEquals(expected, doubleText(value));
	}

	@ParameterizedTest
	@CsvSource({
		"0.1,            0.1",
		"1.0,            1",
		"3.4028235E38,   3.4028235e+38",
		"1.4E-45,        1.4e-45",
		"16777216.0,     16777216",
	})
	void floatLayout(float value, String expected) throws IOException {
		assertEquals(expected, floatText(value),
			"Floats use the digits that identify the float, not its widened double");
	}

	/**
	 * JDK 17's {@link Double#toString(double)} gives {@code 2.82879384806159008E17} for this value.
	 */
	@Test
	void doubleDigitsAreCapped() throws IOException {
		double value = 2.82879384806159E17;
		String text = doubleText(value);
		assertTrue(text.matches("\\d{18}"), text);
		assertTrue(significantDigits(text) <= NumberFormatter.MAX_DIGITS_DOUBLE, text);
		assertEquals(value, Double.parseDouble(text));
		assertEquals(text, doubleText(Double.parseDouble(text)));
	}

	@Test
	void layOutRejectsExcessDigits() {
		assertEquals(-1, formatter.layOut("2.82879384806159008E17", NumberFormatter.MAX_DIGITS_DOUBLE));
		assertEquals(18, formatter.layOut("2.82879384806159008E17", 18));
		assertEquals(-1, formatter.layOut("1.23456789E-3", 8));
	}

	@Test
	void layOutAcceptsSignedExponent() {
		// BigDecimal writes its exponents with an explicit sign
		assertEquals(18, formatter.layOut("2.8287938480615901E+17", NumberFormatter.MAX_DIGITS_DOUBLE));
		assertEquals(5, formatter.layOut("1E+21", NumberFormatter.MAX_DIGITS_DOUBLE));
		assertEquals(4, formatter.layOut("1E-7", NumberFormatter.MAX_DIGITS_DOUBLE));
	}

	static int significantDigits(String text) {
		int e = text.indexOf('e');
		String mantissa = (e < 0 ? text : text.substring(0, e)).replace("-", "").replace(".", "");
		int first = 0;
		while (first < mantissa.length() && mantissa.charAt(first) == '0') {
			first++;
		}
		int end = mantissa.length();
		while (end > first && mantissa.charAt(end - 1) == '0') {
			end--;
		}
		return end - first;
	}

	@Test
	void randomDoublesRoundTrip() throws IOException {
		Random random = new Random(456);
		for (int i = 0; i < 10_000; i++) {
			double value = Double.longBitsToDouble(random.nextLong());
			if (!Double.isFinite(value)) {
				continue;
			}
			String text = doubleText(value);
			double parsed = Double.parseDouble(text);
			assertEquals(Double.doubleToLongBits(value), Double.doubleToLongBits(parsed), text);
			assertEquals(text, doubleText(parsed), "Formatting is idempotent");
			assertTrue(significantDigits(text) <= NumberFormatter.MAX_DIGITS_DOUBLE, text);
			assertTrue(text.indexOf(',') < 0, text);
		}
	}

	@Test
	void randomFloatsRoundTrip() throws IOException {
		Random random = new Random(789);
		for (int i = 0; i < 10_000; i++) {
			float value = Float.intBitsToFloat(random.nextInt());
			if (!Float.isFinite(value)) {
				continue;
			}
			String text = floatText(value);
			float parsed = Float.parseFloat(text);
			assertEquals(Float.floatToIntBits(value), Float.floatToIntBits(parsed), text);
			assertEquals(text, floatText(parsed));
			assertTrue(significantDigits(text) <= NumberFormatter.MAX_DIGITS_FLOAT, text);
		}
	}

	@Test
	void decimalPointIgnoresDefaultLocale() throws IOException {
		Locale original = Locale.getDefault();
		try {
			Locale.setDefault(Locale.GERMANY);
			assertEquals("1234567.5", doubleText(1234567.5));
			assertEquals("0.25", floatText(0.25f));
		} finally {
			Locale.setDefault(original);
		}
	}

	@ParameterizedTest
	@ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
	void nonFiniteRejected(double value) {
		assertThrows(NonFiniteNumberException.class, () -> formatter.writeDouble(sink, value));
		assertThrows(NonFiniteNumberException.class, () -> formatter.writeFloat(sink, (float) value));
		assertEquals(0, sink.outpos());
	}

	@Test
	void taggedNumberDispatch() throws IOException {
		formatter.writeNumber(sink, JsonNumber.ofFloat(0.1f));
		sink.put((byte) ' ');
		formatter.writeNumber(sink, JsonNumber.ofDouble(0.1));
		sink.put((byte) ' ');
		formatter.writeNumber(sink, JsonNumber.ofSigned(-1));
		sink.put((byte) ' ');
		formatter.writeNumber(sink, JsonNumber.ofUnsigned(-1));
		assertEquals("0.1 0.1 -1 18446744073709551615", sink.toString());
	}
}
