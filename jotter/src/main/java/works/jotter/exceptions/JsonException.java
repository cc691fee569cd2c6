package works.jotter.exceptions;

/**
 * Base class for every error the writer raises on its own account.
 * Failures of the underlying sink are not wrapped in this;
 * they surface as the sink's own {@link java.io.IOException}.
 */
public sealed abstract class JsonException extends RuntimeException permits
	JsonStructureException,
	NullKeyException,
	NonFiniteNumberException,
	JsonProcessingException
{
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(Throwable cause) {
		super(cause);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
