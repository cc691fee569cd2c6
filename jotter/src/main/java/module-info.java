/**
 * Jotter: a streaming JSON writer that enforces the grammar as it goes.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.jotter.codec},
 *         the structured {@link works.jotter.codec.JsonWriter JsonWriter}
 *         and the raw token layer beneath it;
 *     </li>
 *     <li>
 *         {@link works.jotter.codec.text},
 *         number formatting and string escaping; and
 *     </li>
 *     <li>
 *         {@link works.jotter.io},
 *         the sink the text is written to.
 *     </li>
 * </ul>
 */
module works.jotter {
	requires org.slf4j;

	exports works.jotter.codec;
	exports works.jotter.codec.text;
	exports works.jotter.io;
	exports works.jotter.exceptions;
}
