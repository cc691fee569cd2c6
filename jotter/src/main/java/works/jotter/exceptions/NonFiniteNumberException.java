package works.jotter.exceptions;

/**
 * JSON has no token for {@code NaN} or the infinities.
 */
public final class NonFiniteNumberException extends JsonException {
	public NonFiniteNumberException(String message) {
		super(message);
	}

	public static NonFiniteNumberException of(double value) {
		return new NonFiniteNumberException("Value is NaN or infinity: " + value);
	}
}
