package works.stratum.exceptions;

/**
 * Thrown when a storage backend does not complete an operation successfully:
 * an error response, a malformed response body, or a transport failure.
 * <p>
 * {@link #diagnostics()} carries whatever raw text the backend supplied,
 * unaltered, for inclusion in logs.
 */
public class BackendException extends RuntimeException {
	private final String diagnostics;

	public BackendException(String message) {
		super(message);
		this.diagnostics = message;
	}

	public BackendException(String message, String diagnostics) {
		super(message + ": " + diagnostics);
		this.diagnostics = diagnostics;
	}

	public BackendException(String message, Throwable cause) {
		super(message, cause);
		this.diagnostics = String.valueOf(cause.getMessage());
	}

	public BackendException(Throwable cause) {
		super(cause);
		this.diagnostics = String.valueOf(cause.getMessage());
	}

	public String diagnostics() {
		return diagnostics;
	}
}
