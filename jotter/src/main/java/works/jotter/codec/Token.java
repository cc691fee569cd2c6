package works.jotter.codec;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * A syntactically significant element of JSON text that is always
 * written with the same sequence of characters.
 * Numbers and strings vary, and are written by {@link RawJsonWriter} directly.
 */
enum Token {
	NULL("null"),
	FALSE("false"),
	TRUE("true"),
	START_OBJECT("{"),
	END_OBJECT("}"),
	START_ARRAY("["),
	END_ARRAY("]"),
	COMMA(","),
	COLON(":"),
	;

	private final byte[] bytes;

	Token(String representation) {
		this.bytes = representation.getBytes(US_ASCII);
	}

	/**
	 * Not copied; callers must not modify the array.
	 */
	byte[] fixedBytes() {
		return bytes;
	}

	/**
	 * Only meaningful for single-character tokens.
	 */
	byte fixedByte() {
		assert bytes.length == 1: "Token " + this + " is not a single character";
		return bytes[0];
	}
}
