package works.stratum.backend;

import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Backend-neutral connection parameters. Each backend reads the fields that make sense for it
 * and ignores the rest.
 */
@Value
@Builder
public class StorageDetails {
	/**
	 * For password fields that come from text, such as environment variables,
	 * this value means there is no password.
	 */
	public static final String NO_PASSWORD = "NONE";

	@Nullable String host;
	@Nullable Integer port;
	@Nullable String password;
	/**
	 * A database name, or for Redis, a database index
	 */
	@Nullable String database;
	/**
	 * A directory for file-based backends, or a JDBC URL for SQL
	 */
	@Nullable String path;
	@Default Map<String, String> options = Map.of();

	public static StorageDetails empty() {
		return builder().build();
	}

	/**
	 * Reads {@code <TYPE>_HOST}, {@code <TYPE>_PORT}, {@code <TYPE>_PASSWORD},
	 * {@code <TYPE>_DATABASE} and {@code <TYPE>_PATH}.
	 * A password of {@value #NO_PASSWORD} is treated as absent.
	 *
	 * @throws IllegalArgumentException if the port isn't a number
	 */
	public static StorageDetails fromEnvironment(BackendType type, Map<String, String> environment) {
		String prefix = type.environmentPrefix();
		String port = environment.get(prefix + "PORT");
		Integer portNumber;
		try {
			portNumber = (port == null || port.isBlank())? null : Integer.valueOf(port.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + prefix + "PORT: " + port, e);
		}
		return builder()
			.host(environment.get(prefix + "HOST"))
			.port(portNumber)
			.password(normalizePassword(environment.get(prefix + "PASSWORD")))
			.database(environment.get(prefix + "DATABASE"))
			.path(environment.get(prefix + "PATH"))
			.build();
	}

	public static @Nullable String normalizePassword(@Nullable String password) {
		if (password == null || NO_PASSWORD.equals(password)) {
			return null;
		}
		return password;
	}

	/**
	 * Omits the password.
	 */
	@Override
	public String toString() {
		return "StorageDetails{" +
			"host=" + host +
			", port=" + port +
			", password=" + ((password == null)? "none" : "***") +
			", database=" + database +
			", path=" + path +
			", options=" + options +
			'}';
	}
}
