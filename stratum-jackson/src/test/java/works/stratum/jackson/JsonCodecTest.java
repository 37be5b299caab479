package works.stratum.jackson;

import java.lang.reflect.Parameter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.stratum.exceptions.BackendException;
import works.stratum.junit.InjectFrom;
import works.stratum.junit.InjectedTest;
import works.stratum.junit.ParameterInjector;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

@InjectFrom(JsonCodecTest.CodecInjector.class)
class JsonCodecTest {
	final JsonMapper mapper = JsonMapper.builder().build();
	final JsonNode sample = mapper.readTree("{\"name\":\"caf\\u00e9 \\uD83C\\uDFB5\",\"n\":[1,2.5,null,true]}");

	@InjectedTest
	void textAndBytes_agree(JsonCodec codec) {
		assertArrayEquals(codec.writeText(sample).getBytes(StandardCharsets.UTF_8), codec.writeBytes(sample));
	}

	@InjectedTest
	void read_acceptsEitherForm(JsonCodec codec) {
		assertEquals(sample, codec.read(codec.writeBytes(sample)));
		assertEquals(sample, codec.read(codec.writeText(sample)));
	}

	@InjectedTest
	void codecs_areInterchangeable(JsonCodec codec) {
		JsonCodec other = (codec instanceof TextJsonCodec)? new ByteJsonCodec() : new TextJsonCodec();
		assertEquals(sample, other.read(codec.writeBytes(sample)));
	}

	@InjectedTest
	void malformedInput_throws(JsonCodec codec) {
		assertThrows(BackendException.class, () -> codec.read("{\"unterminated\":"));
		assertThrows(BackendException.class, () -> codec.read(new byte[] { '[', '1' }));
	}

	@Test
	void preferred_usesBlackbirdWhenPresent() {
		// Blackbird is an optional dependency, present on the test classpath
		assertInstanceOf(ByteJsonCodec.class, JsonCodecs.preferred());
	}

	@Test
	void isAvailable_missingClass() {
		assertFalse(JsonCodecs.isAvailable("works.stratum.jackson.NoSuchClass"));
	}

	record CodecInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType() == JsonCodec.class;
		}

		@Override
		public List<JsonCodec> values() {
			return List.of(new ByteJsonCodec(), new TextJsonCodec());
		}
	}
}
