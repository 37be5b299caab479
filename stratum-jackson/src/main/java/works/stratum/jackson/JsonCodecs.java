package works.stratum.jackson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a {@link JsonCodec} based on what's on the classpath.
 */
public final class JsonCodecs {
	private JsonCodecs() {}

	static final String BLACKBIRD_CLASS = "tools.jackson.module.blackbird.BlackbirdModule";

	/**
	 * @return a {@link ByteJsonCodec} if Jackson Blackbird is available; otherwise a {@link TextJsonCodec}
	 */
	public static JsonCodec preferred() {
		JsonCodec result = isAvailable(BLACKBIRD_CLASS)? new ByteJsonCodec() : new TextJsonCodec();
		LOGGER.debug("Using {} JSON codec", result.name());
		return result;
	}

	static boolean isAvailable(String className) {
		try {
			Class.forName(className, false, JsonCodecs.class.getClassLoader());
			return true;
		} catch (ClassNotFoundException | LinkageError e) {
			LOGGER.trace("{} is not available", className, e);
			return false;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonCodecs.class);
}
