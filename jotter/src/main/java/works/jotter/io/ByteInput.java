package works.jotter.io;

/**
 * A finite, one-pass source of bytes.
 * Once {@link #next()} has returned {@link #END_OF_INPUT}, it keeps doing so.
 */
public interface ByteInput {
	int END_OF_INPUT = -1;

	/**
	 * @return the next byte as an unsigned value in {@code [0, 255]},
	 * or {@link #END_OF_INPUT}.
	 */
	int next();
}
