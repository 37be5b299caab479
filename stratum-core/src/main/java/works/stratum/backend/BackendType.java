package works.stratum.backend;

import java.util.Locale;
import java.util.Map;

/**
 * The kinds of storage a {@link works.stratum.StorageDriver} can use.
 */
public enum BackendType {
	JSON,
	SQL,
	REDIS,
	API,
	MEMORY;

	public static final String ENVIRONMENT_VARIABLE = "STRATUM_STORAGE_TYPE";

	/**
	 * Case-insensitive.
	 *
	 * @throws IllegalArgumentException if there's no such backend
	 */
	public static BackendType fromName(String name) {
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown storage backend \"" + name + "\"", e);
		}
	}

	/**
	 * @return the backend named by {@link #ENVIRONMENT_VARIABLE}, or {@link #JSON} if it's unset
	 */
	public static BackendType fromEnvironment(Map<String, String> environment) {
		String name = environment.get(ENVIRONMENT_VARIABLE);
		if (name == null || name.isBlank()) {
			return JSON;
		}
		return fromName(name);
	}

	/**
	 * @return the prefix used for this backend's environment variables, like {@code REDIS_}
	 */
	public String environmentPrefix() {
		return name() + "_";
	}
}
