package works.jotter.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * The destination of JSON text.
 * The writer depends only on this contract, never on a particular transport.
 * <p>
 * Any method may block for as long as the underlying destination does.
 * A sink that has thrown is in an undefined state and should not be written to again.
 */
public interface JsonSink extends Closeable {
	void put(byte b) throws IOException;

	/**
	 * Writes {@code b} {@code count} times.
	 */
	void put(byte b, int count) throws IOException;

	void putn(byte[] bytes, int offset, int length) throws IOException;

	default void putn(byte[] bytes) throws IOException {
		putn(bytes, 0, bytes.length);
	}

	void flush() throws IOException;

	/**
	 * @return the number of bytes accepted by this sink so far,
	 * whether or not they have been flushed.
	 */
	long outpos();

	/**
	 * Flushes and releases any underlying resource.
	 */
	@Override
	default void close() throws IOException {
		flush();
	}
}
