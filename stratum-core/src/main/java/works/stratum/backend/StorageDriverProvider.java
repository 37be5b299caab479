package works.stratum.backend;

import works.stratum.StorageDriver;

/**
 * Creates drivers for one {@link BackendType}.
 * <p>
 * Providers are discovered with {@link java.util.ServiceLoader}: each backend module lists its
 * implementation in {@code META-INF/services/works.stratum.backend.StorageDriverProvider}.
 */
public interface StorageDriverProvider {
	BackendType type();

	/**
	 * @return a driver that has not yet been initialized
	 * @throws IllegalArgumentException if {@code details} lacks something this backend needs
	 */
	StorageDriver create(StorageDetails details);
}
