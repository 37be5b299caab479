package works.stratum.jackson;

import java.nio.file.Path;
import works.stratum.StorageDriver;
import works.stratum.backend.BackendType;
import works.stratum.backend.StorageDetails;
import works.stratum.backend.StorageDriverProvider;

public final class JsonFileDriverProvider implements StorageDriverProvider {
	@Override
	public BackendType type() {
		return BackendType.JSON;
	}

	/**
	 * @throws IllegalArgumentException if {@link StorageDetails#getPath() path} is missing
	 */
	@Override
	public StorageDriver create(StorageDetails details) {
		if (details.getPath() == null) {
			throw new IllegalArgumentException("The JSON backend requires a path");
		}
		return new JsonFileDriver(JsonFileDriverSettings.builder()
			.baseDirectory(Path.of(details.getPath()))
			.prettyPrint(Boolean.parseBoolean(details.getOptions().getOrDefault("prettyPrint", "false")))
			.build());
	}
}
