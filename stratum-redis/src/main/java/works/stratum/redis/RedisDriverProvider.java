package works.stratum.redis;

import works.stratum.StorageDriver;
import works.stratum.backend.BackendType;
import works.stratum.backend.StorageDetails;
import works.stratum.backend.StorageDriverProvider;

/**
 * Reads host, port, password and database (an index) from the details;
 * anything missing takes the {@link RedisDriverSettings} default.
 * The optional {@code keyPrefix} option overrides the hash key prefix.
 */
public final class RedisDriverProvider implements StorageDriverProvider {
	@Override
	public BackendType type() {
		return BackendType.REDIS;
	}

	@Override
	public StorageDriver create(StorageDetails details) {
		RedisDriverSettings.RedisDriverSettingsBuilder settings = RedisDriverSettings.builder();
		if (details.getHost() != null) {
			settings.host(details.getHost());
		}
		if (details.getPort() != null) {
			settings.port(details.getPort());
		}
		settings.password(StorageDetails.normalizePassword(details.getPassword()));
		if (details.getDatabase() != null) {
			try {
				settings.database(Integer.parseInt(details.getDatabase().trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Redis database must be a number: " + details.getDatabase(), e);
			}
		}
		String keyPrefix = details.getOptions().get("keyPrefix");
		if (keyPrefix != null) {
			settings.keyPrefix(keyPrefix);
		}
		return new RedisDriver(settings.build());
	}
}
