package works.jotter.io;

/**
 * Walks a slice of a byte array, typically text that is already UTF-8 encoded.
 * The bytes are not validated.
 * Instances can be {@link #reset} to avoid allocating one per string.
 */
public final class ByteArrayInput implements ByteInput {
	private byte[] bytes;
	private int position;
	private int limit;

	public ByteArrayInput() {
		reset(new byte[0], 0, 0);
	}

	public ByteArrayInput(byte[] bytes) {
		reset(bytes, 0, bytes.length);
	}

	public ByteArrayInput(byte[] bytes, int offset, int length) {
		reset(bytes, offset, length);
	}

	public ByteArrayInput reset(byte[] bytes, int offset, int length) {
		if (offset < 0 || length < 0 || offset > bytes.length - length) {
			throw new IndexOutOfBoundsException("Slice [" + offset + ", " + offset + "+" + length + ") out of bounds for length " + bytes.length);
		}
		this.bytes = bytes;
		this.position = offset;
		this.limit = offset + length;
		return this;
	}

	@Override
	public int next() {
		if (position < limit) {
			return bytes[position++] & 0xFF;
		} else {
			return END_OF_INPUT;
		}
	}
}
