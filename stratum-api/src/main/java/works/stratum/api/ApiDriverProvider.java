package works.stratum.api;

import works.stratum.StorageDriver;
import works.stratum.backend.BackendType;
import works.stratum.backend.StorageDetails;
import works.stratum.backend.StorageDriverProvider;

public final class ApiDriverProvider implements StorageDriverProvider {
	@Override
	public BackendType type() {
		return BackendType.API;
	}

	@Override
	public StorageDriver create(StorageDetails details) {
		return new ApiDriver(ApiDriverSettings.fromStorageDetails(details));
	}
}
