package works.jotter.exceptions;

/**
 * An unexpected error has occurred while writing JSON.
 * <p>
 * This does not indicate a problem with the caller's sequence of operations,
 * but rather that something unexpected has gone wrong. A correctly written
 * writer would not throw this exception.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message) {
		super(message);
	}

	public JsonProcessingException(Throwable cause) {
		super(cause);
	}

	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
