package works.jotter.io;

import static java.lang.Character.isHighSurrogate;
import static java.lang.Character.isLowSurrogate;
import static java.lang.Character.toCodePoint;

/**
 * Presents a {@link CharSequence} as its UTF-8 bytes, encoding one character at a time.
 * <p>
 * A surrogate pair becomes the four-byte encoding of its code point.
 * An unpaired surrogate becomes {@code '?'}, matching {@link String#getBytes(java.nio.charset.Charset)}.
 * <p>
 * Instances can be {@link #reset} to avoid allocating one per string.
 */
public final class CharSequenceInput implements ByteInput {
	private CharSequence chars;
	private int index;

	// Continuation bytes of the current character, not yet returned
	private final byte[] pending = new byte[3];
	private int pendingPosition;
	private int pendingLimit;

	public CharSequenceInput() {
		reset("");
	}

	public CharSequenceInput(CharSequence chars) {
		reset(chars);
	}

	public CharSequenceInput reset(CharSequence chars) {
		this.chars = chars;
		this.index = 0;
		this.pendingPosition = 0;
		this.pendingLimit = 0;
		return this;
	}

	@Override
	public int next() {
		if (pendingPosition < pendingLimit) {
			return pending[pendingPosition++] & 0xFF;
		}
		if (index >= chars.length()) {
			return END_OF_INPUT;
		}
		char c = chars.charAt(index++);
		if (c < 0x80) {
			return c;
		} else if (c < 0x800) {
			stage(0x80 | (c & 0x3F));
			return 0xC0 | (c >> 6);
		} else if (isHighSurrogate(c) && index < chars.length() && isLowSurrogate(chars.charAt(index))) {
			int codePoint = toCodePoint(c, chars.charAt(index++));
			stage(
				0x80 | ((codePoint >> 12) & 0x3F),
				0x80 | ((codePoint >> 6) & 0x3F),
				0x80 | (codePoint & 0x3F));
			return 0xF0 | (codePoint >> 18);
		} else if (Character.isSurrogate(c)) {
			return '?';
		} else {
			stage(
				0x80 | ((c >> 6) & 0x3F),
				0x80 | (c & 0x3F));
			return 0xE0 | (c >> 12);
		}
	}

	private void stage(int b0) {
		pending[0] = (byte) b0;
		pendingPosition = 0;
		pendingLimit = 1;
	}

	private void stage(int b0, int b1) {
		pending[0] = (byte) b0;
		pending[1] = (byte) b1;
		pendingPosition = 0;
		pendingLimit = 2;
	}

	private void stage(int b0, int b1, int b2) {
		pending[0] = (byte) b0;
		pending[1] = (byte) b1;
		pending[2] = (byte) b2;
		pendingPosition = 0;
		pendingLimit = 3;
	}
}
