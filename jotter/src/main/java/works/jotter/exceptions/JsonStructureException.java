package works.jotter.exceptions;

/**
 * The requested operation would make the output violate the JSON grammar,
 * given what has been written so far.
 * For example, ending an array while an object is open,
 * or writing a second value at the top level of the document.
 */
public final class JsonStructureException extends JsonException {
	public JsonStructureException(String message) {
		super(message);
	}

	public JsonStructureException(String message, Throwable cause) {
		super(message, cause);
	}
}
