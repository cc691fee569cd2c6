package works.jotter.io;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * An in-memory {@link JsonSink} that grows as needed.
 * None of its methods actually throw.
 */
public final class ByteArraySink implements JsonSink {
	private byte[] bytes;
	private int count = 0;

	public ByteArraySink() {
		this(256);
	}

	public ByteArraySink(int initialCapacity) {
		bytes = new byte[Math.max(1, initialCapacity)];
	}

	@Override
	public void put(byte b) {
		ensureCapacity(1);
		bytes[count++] = b;
	}

	@Override
	public void put(byte b, int n) {
		if (n <= 0) {
			return;
		}
		ensureCapacity(n);
		Arrays.fill(bytes, count, count + n, b);
		count += n;
	}

	@Override
	public void putn(byte[] source) {
		putn(source, 0, source.length);
	}

	@Override
	public void putn(byte[] source, int offset, int length) {
		ensureCapacity(length);
		System.arraycopy(source, offset, bytes, count, length);
		count += length;
	}

	@Override
	public void flush() {
	}

	@Override
	public long outpos() {
		return count;
	}

	@Override
	public void close() {
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(bytes, count);
	}

	/**
	 * Decodes the contents as UTF-8.
	 */
	@Override
	public String toString() {
		return new String(bytes, 0, count, UTF_8);
	}

	/**
	 * Discards everything written so far.
	 */
	public void reset() {
		count = 0;
	}

	private void ensureCapacity(int extra) {
		int required = count + extra;
		if (required < 0) {
			throw new OutOfMemoryError("Sink would exceed maximum array size");
		}
		if (required > bytes.length) {
			bytes = Arrays.copyOf(bytes, Math.max(required, bytes.length * 2));
		}
	}
}
