package works.stratum;

/**
 * Creates an uninitialized {@link StorageDriver}.
 * <p>
 * Each backend module offers a {@code factory(...)} method that captures
 * its settings and connection parameters; the factory can then be handed
 * to code (or tests) that don't care which backend they're getting.
 */
@FunctionalInterface
public interface DriverFactory {
	StorageDriver build();

	/**
	 * @return a new driver that has already been {@link StorageDriver#initialize() initialized}
	 */
	default StorageDriver buildAndInitialize() {
		StorageDriver result = build();
		result.initialize();
		return result;
	}
}
