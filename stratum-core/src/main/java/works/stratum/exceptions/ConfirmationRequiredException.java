package works.stratum.exceptions;

/**
 * Thrown when a destructive bulk operation is invoked without explicit confirmation.
 * Nothing has been touched when this is thrown.
 */
public class ConfirmationRequiredException extends RuntimeException {
	public ConfirmationRequiredException(String message) {
		super(message);
	}
}
