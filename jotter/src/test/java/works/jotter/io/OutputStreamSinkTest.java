package works.jotter.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutputStreamSinkTest {

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 3, 7, 8192 })
	void everyPutMethodAtAnyBufferSize(int bufferSize) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		OutputStreamSink sink = new OutputStreamSink(out, bufferSize);
		sink.put((byte) 'a');
		sink.put((byte) '-', 5);
		sink.putn("hello".getBytes(US_ASCII));
		sink.putn("xxworldxx".getBytes(US_ASCII), 2, 5);
		sink.put((byte) '!', 0);
		assertEquals(16, sink.outpos());
		sink.flush();
		assertEquals("a-----helloworld", out.toString(US_ASCII));
		assertEquals(16, sink.outpos());
	}

	@ParameterizedTest
	@ValueSource(ints = { 0, -1 })
	void rejectsBadBufferSize(int bufferSize) {
		assertThrows(IllegalArgumentException.class,
			() -> new OutputStreamSink(new ByteArrayOutputStream(), bufferSize));
	}
}
