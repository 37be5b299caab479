package works.stratum.exceptions;

/**
 * Thrown when a driver is used before it is initialized or after it is closed.
 */
public class DriverStateException extends IllegalStateException {
	public DriverStateException(String s) {
		super(s);
	}
}
