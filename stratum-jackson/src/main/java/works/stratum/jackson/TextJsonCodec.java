package works.stratum.jackson;

import java.nio.charset.StandardCharsets;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.stratum.exceptions.BackendException;

/**
 * Encodes to and from strings with a plain {@link JsonMapper}; bytes are the UTF-8 encoding of the text.
 */
public final class TextJsonCodec implements JsonCodec {
	private final ObjectMapper mapper;

	public TextJsonCodec() {
		this(JsonMapper.builder().build());
	}

	public TextJsonCodec(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	@Override
	public byte[] writeBytes(JsonNode value) {
		return writeText(value).getBytes(StandardCharsets.UTF_8);
	}

	@Override
	public String writeText(JsonNode value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JacksonException e) {
			throw new BackendException("Unable to encode JSON", e);
		}
	}

	@Override
	public JsonNode read(byte[] encoded) {
		return read(new String(encoded, StandardCharsets.UTF_8));
	}

	@Override
	public JsonNode read(String encoded) {
		try {
			return mapper.readTree(encoded);
		} catch (JacksonException e) {
			throw new BackendException("Unable to decode JSON", e);
		}
	}

	@Override
	public String name() {
		return "text";
	}

	@Override
	public String toString() {
		return "TextJsonCodec";
	}
}
