package works.stratum;

import tools.jackson.databind.JsonNode;

import static java.util.Objects.requireNonNull;

/**
 * All the data stored under one category, as handed to {@link StorageDriver#importData}.
 */
public record CategoryData(String category, JsonNode payload) {
	public CategoryData {
		requireNonNull(category);
		requireNonNull(payload);
	}
}
