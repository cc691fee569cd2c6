package works.jotter.exceptions;

/**
 * An object member was requested with a null key.
 */
public final class NullKeyException extends JsonException {
	public NullKeyException(String message) {
		super(message);
	}
}
