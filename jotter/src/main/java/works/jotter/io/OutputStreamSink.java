package works.jotter.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonSink} that bridges to an {@link OutputStream},
 * staging bytes in a fixed buffer and handing them to the stream
 * whenever the buffer fills or {@link #flush()} is called.
 */
public final class OutputStreamSink implements JsonSink {
	static final int DEFAULT_BUFFER_SIZE = 8192;

	private final OutputStream stream;
	private final byte[] buffer;
	private int count = 0;
	private long flushedBytes = 0;

	public OutputStreamSink(OutputStream stream) {
		this(stream, DEFAULT_BUFFER_SIZE);
	}

	public OutputStreamSink(OutputStream stream, int bufferSize) {
		if (bufferSize < 1) {
			throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
		}
		this.stream = requireNonNull(stream);
		this.buffer = new byte[bufferSize];
	}

	@Override
	public void put(byte b) throws IOException {
		if (count == buffer.length) {
			drain();
		}
		buffer[count++] = b;
	}

	@Override
	public void put(byte b, int n) throws IOException {
		while (n > 0) {
			if (count == buffer.length) {
				drain();
			}
			int chunk = Math.min(n, buffer.length - count);
			Arrays.fill(buffer, count, count + chunk, b);
			count += chunk;
			n -= chunk;
		}
	}

	@Override
	public void putn(byte[] bytes, int offset, int length) throws IOException {
		if (length >= buffer.length) {
			// Too big to stage; skip the copy
			drain();
			stream.write(bytes, offset, length);
			flushedBytes += length;
			return;
		}
		if (length > buffer.length - count) {
			drain();
		}
		System.arraycopy(bytes, offset, buffer, count, length);
		count += length;
	}

	@Override
	public void flush() throws IOException {
		drain();
		stream.flush();
	}

	@Override
	public long outpos() {
		return flushedBytes + count;
	}

	@Override
	public void close() throws IOException {
		try {
			flush();
		} finally {
			stream.close();
		}
	}

	private void drain() throws IOException {
		if (count > 0) {
			stream.write(buffer, 0, count);
			flushedBytes += count;
			count = 0;
		}
	}
}
