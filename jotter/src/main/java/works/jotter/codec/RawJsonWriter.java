package works.jotter.codec;

import java.io.Closeable;
import java.io.IOException;
import works.jotter.codec.text.NumberFormatter;
import works.jotter.codec.text.StringEscaper;
import works.jotter.io.ByteArrayInput;
import works.jotter.io.ByteInput;
import works.jotter.io.CharSequenceInput;
import works.jotter.io.JsonSink;

import static java.util.Objects.requireNonNull;
import static works.jotter.codec.Token.COLON;
import static works.jotter.codec.Token.COMMA;
import static works.jotter.codec.Token.END_ARRAY;
import static works.jotter.codec.Token.END_OBJECT;
import static works.jotter.codec.Token.FALSE;
import static works.jotter.codec.Token.NULL;
import static works.jotter.codec.Token.START_ARRAY;
import static works.jotter.codec.Token.START_OBJECT;
import static works.jotter.codec.Token.TRUE;

/**
 * Emits JSON tokens exactly as asked, with no notion of structure.
 * Nothing stops you from writing a comma before a closing brace, or two values in a row;
 * to prevent that, use {@link JsonWriter}, which calls this after checking the grammar.
 * <p>
 * Not thread-safe: the number formatter and string inputs are reused across calls.
 */
public final class RawJsonWriter implements Closeable {
	private final JsonSink sink;
	private final NumberFormatter numbers = new NumberFormatter();
	private final CharSequenceInput charInput = new CharSequenceInput();
	private final ByteArrayInput byteInput = new ByteArrayInput();

	public RawJsonWriter(JsonSink sink) {
		this.sink = requireNonNull(sink);
	}

	public void writeStartObject() throws IOException { sink.put(START_OBJECT.fixedByte()); }
	public void writeEndObject() throws IOException { sink.put(END_OBJECT.fixedByte()); }
	public void writeStartArray() throws IOException { sink.put(START_ARRAY.fixedByte()); }
	public void writeEndArray() throws IOException { sink.put(END_ARRAY.fixedByte()); }
	public void writeKeySeparator() throws IOException { sink.put(COLON.fixedByte()); }
	public void writeItemSeparator() throws IOException { sink.put(COMMA.fixedByte()); }

	public void writeInt(int value) throws IOException { numbers.writeSigned(sink, value); }
	public void writeLong(long value) throws IOException { numbers.writeSigned(sink, value); }

	/**
	 * @param value interpreted as unsigned, so {@code -1L} is written as {@code 18446744073709551615}
	 */
	public void writeUnsignedLong(long value) throws IOException { numbers.writeUnsigned(sink, value); }

	public void writeFloat(float value) throws IOException { numbers.writeFloat(sink, value); }
	public void writeDouble(double value) throws IOException { numbers.writeDouble(sink, value); }
	public void writeNumber(JsonNumber value) throws IOException { numbers.writeNumber(sink, value); }

	public void writeBoolean(boolean value) throws IOException {
		sink.putn((value ? TRUE : FALSE).fixedBytes());
	}

	public void writeNull() throws IOException {
		sink.putn(NULL.fixedBytes());
	}

	/**
	 * Writes the contents of {@code input}, escaped.
	 *
	 * @param quoted if false, the surrounding quotes are left to the caller,
	 *               which allows a string to be assembled from several fragments.
	 */
	public void writeStringFrom(ByteInput input, boolean quoted) throws IOException {
		StringEscaper.writeFrom(input, sink, quoted);
	}

	/**
	 * Writes a quoted, escaped string, or {@code null} if {@code value} is null.
	 */
	public void writeString(CharSequence value) throws IOException {
		if (value == null) {
			writeNull();
		} else {
			writeStringFrom(charInput.reset(value), true);
		}
	}

	/**
	 * Writes a quoted, escaped string from text that is already UTF-8 encoded,
	 * or {@code null} if {@code utf8} is null.
	 */
	public void writeString(byte[] utf8, int offset, int length) throws IOException {
		if (utf8 == null) {
			writeNull();
		} else {
			writeStringFrom(byteInput.reset(utf8, offset, length), true);
		}
	}

	// Overloads for each category of value we know how to write.
	// Any other static type is a compile error.

	public void write(int value) throws IOException { writeInt(value); }
	public void write(long value) throws IOException { writeLong(value); }
	public void write(float value) throws IOException { writeFloat(value); }
	public void write(double value) throws IOException { writeDouble(value); }
	public void write(JsonNumber value) throws IOException {
		if (value == null) {
			writeNull();
		} else {
			writeNumber(value);
		}
	}
	public void write(boolean value) throws IOException { writeBoolean(value); }
	public void write(CharSequence value) throws IOException { writeString(value); }

	public void writeNewline() throws IOException {
		sink.put((byte) '\n');
	}

	public void writeWhitespace(int numSpaces) throws IOException {
		if (numSpaces < 0) {
			throw new IllegalArgumentException("Negative number of spaces: " + numSpaces);
		}
		sink.put((byte) ' ', numSpaces);
	}

	public JsonSink sink() {
		return sink;
	}

	public void flush() throws IOException {
		sink.flush();
	}

	/**
	 * Closes the sink, which flushes it.
	 * Any failure is thrown; nothing is silently dropped.
	 */
	@Override
	public void close() throws IOException {
		sink.close();
	}
}
