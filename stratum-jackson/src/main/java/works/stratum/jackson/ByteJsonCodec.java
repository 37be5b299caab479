package works.stratum.jackson;

import java.nio.charset.StandardCharsets;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.module.blackbird.BlackbirdModule;
import works.stratum.exceptions.BackendException;

/**
 * Encodes directly to and from bytes, with Jackson's Blackbird module
 * generating the accessors.
 * <p>
 * Only usable when Blackbird is on the classpath; see {@link JsonCodecs#preferred()}.
 */
public final class ByteJsonCodec implements JsonCodec {
	private final JsonMapper mapper;

	public ByteJsonCodec() {
		this.mapper = JsonMapper.builder()
			.addModule(new BlackbirdModule())
			.build();
	}

	@Override
	public byte[] writeBytes(JsonNode value) {
		try {
			return mapper.writeValueAsBytes(value);
		} catch (JacksonException e) {
			throw new BackendException("Unable to encode JSON", e);
		}
	}

	@Override
	public String writeText(JsonNode value) {
		return new String(writeBytes(value), StandardCharsets.UTF_8);
	}

	@Override
	public JsonNode read(byte[] encoded) {
		try {
			return mapper.readTree(encoded);
		} catch (JacksonException e) {
			throw new BackendException("Unable to decode JSON", e);
		}
	}

	@Override
	public JsonNode read(String encoded) {
		return read(encoded.getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public String name() {
		return "bytes";
	}

	@Override
	public String toString() {
		return "ByteJsonCodec";
	}
}
