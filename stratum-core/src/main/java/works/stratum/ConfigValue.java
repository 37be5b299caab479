package works.stratum;

import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.stratum.exceptions.BackendException;
import works.stratum.exceptions.NotFoundException;

/**
 * A handle on one {@link IdentifierData} within a {@link Config}, which supplies its default.
 */
public final class ConfigValue {
	private final Config config;
	private final IdentifierData identifier;

	ConfigValue(Config config, IdentifierData identifier) {
		this.config = config;
		this.identifier = identifier;
	}

	public IdentifierData identifier() {
		return identifier;
	}

	/**
	 * @return the registered default, or {@link tools.jackson.databind.node.MissingNode} if there is none
	 */
	public JsonNode defaultValue() {
		return config.defaultValue(identifier.category(), identifier.identifiers());
	}

	/**
	 * @return the stored value, or the default if nothing is stored.
	 * If there's neither, returns {@link tools.jackson.databind.node.MissingNode}.
	 */
	public JsonNode get() {
		try {
			return config.driver().get(identifier);
		} catch (NotFoundException e) {
			return defaultValue();
		}
	}

	/**
	 * @return the value converted to {@code type}, or null if there is neither a stored value nor a default
	 * @throws BackendException if the value can't be converted
	 */
	public <T> @Nullable T get(Class<T> type) {
		return convert(get(), type);
	}

	/**
	 * @return the registered default converted to {@code type}, or null if there is none
	 */
	public <T> @Nullable T defaultValue(Class<T> type) {
		return convert(defaultValue(), type);
	}

	private <T> @Nullable T convert(JsonNode node, Class<T> type) {
		if (node.isMissingNode()) {
			return null;
		}
		try {
			return config.mapper().treeToValue(node, type);
		} catch (RuntimeException e) {
			throw new BackendException("Value at " + identifier + " is not a valid " + type.getSimpleName(), e);
		}
	}

	/**
	 * @param value anything the config's mapper can serialize, including a {@link JsonNode}
	 */
	public JsonNode set(Object value) {
		JsonNode node = (value instanceof JsonNode n)? n : config.mapper().valueToTree(value);
		return config.driver().set(identifier, node);
	}

	public void clear() {
		config.driver().clear(identifier);
	}

	/**
	 * Starts from the registered default if it's a number, otherwise zero.
	 */
	public Number increment(Number delta) {
		JsonNode defaultNode = defaultValue();
		Number seed = defaultNode.isNumber()? defaultNode.numberValue() : Integer.valueOf(0);
		return config.driver().increment(identifier, delta, seed);
	}

	/**
	 * Flips the stored boolean, starting from the registered default.
	 */
	public boolean toggle() {
		return config.driver().toggle(identifier, null, defaultBoolean());
	}

	public boolean toggle(boolean value) {
		return config.driver().toggle(identifier, value, defaultBoolean());
	}

	private @Nullable Boolean defaultBoolean() {
		JsonNode defaultNode = defaultValue();
		return defaultNode.isBoolean()? defaultNode.booleanValue() : null;
	}

	@Override
	public String toString() {
		return "ConfigValue{" + identifier + "}";
	}
}
