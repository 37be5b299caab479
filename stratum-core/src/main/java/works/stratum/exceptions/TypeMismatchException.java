package works.stratum.exceptions;

import works.stratum.IdentifierData;

/**
 * Thrown when an increment or toggle finds a stored value of the wrong type.
 */
public class TypeMismatchException extends BackendException {
	public TypeMismatchException(IdentifierData identifier, String expected, Object actual) {
		super("Expected " + expected + " at " + identifier, String.valueOf(actual));
	}
}
