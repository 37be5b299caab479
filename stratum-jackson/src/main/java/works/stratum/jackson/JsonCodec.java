package works.stratum.jackson;

import tools.jackson.databind.JsonNode;
import works.stratum.exceptions.BackendException;

/**
 * Converts JSON trees to and from their encoded forms.
 * <p>
 * Implementations differ in which form they produce natively;
 * both forms are always available, so callers never need to know which one they have.
 */
public interface JsonCodec {
	/**
	 * @return the UTF-8 encoding of {@code value}
	 */
	byte[] writeBytes(JsonNode value);

	String writeText(JsonNode value);

	/**
	 * @throws BackendException if {@code encoded} is not valid JSON
	 */
	JsonNode read(byte[] encoded);

	/**
	 * @throws BackendException if {@code encoded} is not valid JSON
	 */
	JsonNode read(String encoded);

	/**
	 * @return a short description for logs
	 */
	String name();
}
