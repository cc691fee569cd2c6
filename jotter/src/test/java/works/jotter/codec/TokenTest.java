package works.jotter.codec;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.jotter.codec.Token.COLON;
import static works.jotter.codec.Token.COMMA;
import static works.jotter.codec.Token.END_ARRAY;
import static works.jotter.codec.Token.END_OBJECT;
import static works.jotter.codec.Token.START_ARRAY;
import static works.jotter.codec.Token.START_OBJECT;

class TokenTest {

	@Test
	void literals() {
		assertArrayEquals("null".getBytes(US_ASCII), Token.NULL.fixedBytes());
		assertArrayEquals("false".getBytes(US_ASCII), Token.FALSE.fixedBytes());
		assertArrayEquals("true".getBytes(US_ASCII), Token.TRUE.fixedBytes());
	}

	@ParameterizedTest
	@EnumSource(value = Token.class, names = { "NULL", "FALSE", "TRUE" }, mode = EnumSource.Mode.EXCLUDE)
	void punctuationIsOneByte(Token token) {
		assertEquals(1, token.fixedBytes().length);
		assertEquals(token.fixedBytes()[0], token.fixedByte());
	}

	@Test
	void punctuationCharacters() {
		assertEquals('{', START_OBJECT.fixedByte());
		assertEquals('}', END_OBJECT.fixedByte());
		assertEquals('[', START_ARRAY.fixedByte());
		assertEquals(']', END_ARRAY.fixedByte());
		assertEquals(',', COMMA.fixedByte());
		assertEquals(':', COLON.fixedByte());
		assertEquals(9, EnumSet.allOf(Token.class).size());
	}
}
