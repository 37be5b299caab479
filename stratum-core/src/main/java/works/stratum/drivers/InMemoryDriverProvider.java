package works.stratum.drivers;

import works.stratum.StorageDriver;
import works.stratum.backend.BackendType;
import works.stratum.backend.StorageDetails;
import works.stratum.backend.StorageDriverProvider;

public final class InMemoryDriverProvider implements StorageDriverProvider {
	@Override
	public BackendType type() {
		return BackendType.MEMORY;
	}

	@Override
	public StorageDriver create(StorageDetails details) {
		return new InMemoryDriver();
	}
}
