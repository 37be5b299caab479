package works.stratum.backend;

import java.util.EnumMap;
import java.util.Map;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.stratum.DriverFactory;
import works.stratum.StorageDriver;

/**
 * Looks up a {@link StorageDriverProvider} for the requested backend.
 */
public final class StorageDrivers {
	private StorageDrivers() {}

	/**
	 * @return a driver that has not yet been initialized
	 * @throws IllegalArgumentException if no module on the classpath provides that backend
	 */
	public static StorageDriver create(BackendType type, StorageDetails details) {
		StorageDriverProvider provider = providers().get(type);
		if (provider == null) {
			throw new IllegalArgumentException("No storage driver provider for " + type + "; is its module on the classpath?");
		}
		LOGGER.debug("Creating {} driver with {}", type, details);
		return provider.create(details);
	}

	public static DriverFactory factory(BackendType type, StorageDetails details) {
		return () -> create(type, details);
	}

	/**
	 * Reads the backend type and its details from the given environment variables.
	 */
	public static StorageDriver fromEnvironment(Map<String, String> environment) {
		BackendType type = BackendType.fromEnvironment(environment);
		return create(type, StorageDetails.fromEnvironment(type, environment));
	}

	static Map<BackendType, StorageDriverProvider> providers() {
		Map<BackendType, StorageDriverProvider> result = new EnumMap<>(BackendType.class);
		for (StorageDriverProvider provider: ServiceLoader.load(StorageDriverProvider.class, StorageDrivers.class.getClassLoader())) {
			StorageDriverProvider existing = result.putIfAbsent(provider.type(), provider);
			if (existing != null) {
				LOGGER.warn("Ignoring duplicate {} provider {}; using {}", provider.type(), provider.getClass().getName(), existing.getClass().getName());
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StorageDrivers.class);
}
