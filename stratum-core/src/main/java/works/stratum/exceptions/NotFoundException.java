package works.stratum.exceptions;

import works.stratum.IdentifierData;

/**
 * Thrown when nothing is stored at the requested identifier.
 * Callers that have a default value to fall back on are expected to catch this.
 */
public class NotFoundException extends Exception {
	private final IdentifierData identifier;

	public NotFoundException(IdentifierData identifier) {
		super("No value at " + identifier);
		this.identifier = identifier;
	}

	public NotFoundException(IdentifierData identifier, String diagnostics) {
		super("No value at " + identifier + ": " + diagnostics);
		this.identifier = identifier;
	}

	public IdentifierData identifier() {
		return identifier;
	}
}
