package works.jotter.codec.text;

import java.io.IOException;
import works.jotter.io.ByteInput;
import works.jotter.io.JsonSink;

import static works.jotter.io.ByteInput.END_OF_INPUT;

/**
 * Copies bytes to a sink, replacing the characters JSON cannot carry raw
 * with their two-character escapes:
 * {@code \b \f \n \r \t \" \\}.
 * <p>
 * Everything else passes through verbatim, including other control characters
 * and bytes of multi-byte UTF-8 sequences. Encoding correctness is not checked.
 */
public final class StringEscaper {
	private static final byte QUOTE = '"';
	private static final byte BACKSLASH = '\\';

	/**
	 * For each ASCII byte, the character that follows the backslash in its escape, or zero.
	 */
	private static final byte[] ESCAPES = new byte[128];
	static {
		ESCAPES['\b'] = 'b';
		ESCAPES['\f'] = 'f';
		ESCAPES['\n'] = 'n';
		ESCAPES['\r'] = 'r';
		ESCAPES['\t'] = 't';
		ESCAPES['"'] = '"';
		ESCAPES['\\'] = '\\';
	}

	private StringEscaper() {
	}

	/**
	 * Drains {@code input} into {@code sink}.
	 *
	 * @param quoted if true, the output is enclosed in double quotes;
	 *               otherwise it can be spliced into a string the caller has opened.
	 */
	public static void writeFrom(ByteInput input, JsonSink sink, boolean quoted) throws IOException {
		if (quoted) {
			sink.put(QUOTE);
		}
		for (int b = input.next(); b != END_OF_INPUT; b = input.next()) {
			byte escape = (b < ESCAPES.length) ? ESCAPES[b] : 0;
			if (escape == 0) {
				sink.put((byte) b);
			} else {
				sink.put(BACKSLASH);
				sink.put(escape);
			}
		}
		if (quoted) {
			sink.put(QUOTE);
		}
	}
}
