package works.stratum.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.stratum.CategoryData;
import works.stratum.CategoryRegistry;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.exceptions.NotFoundException;

/**
 * Copies everything from one backend to another.
 * <p>
 * Each namespace in the source is read in its entirety and handed to
 * the target's {@link StorageDriver#importData importData}, so the target's
 * bulk-then-individual fallback applies.
 */
public final class StorageMigration {
	private StorageMigration() {}

	/**
	 * @param registries supplies the category registry for each namespace,
	 *                   since custom groups are registered per owner.
	 *                   Categories unknown to the registry are skipped with a warning.
	 */
	public static MigrationReport copyAll(StorageDriver source, StorageDriver target, Function<Namespace, CategoryRegistry> registries) {
		List<Namespace> namespaces;
		try (Stream<Namespace> stream = source.namespaces()) {
			namespaces = stream.toList();
		}
		LOGGER.info("Migrating {} namespaces", namespaces.size());
		MigrationReport result = MigrationReport.empty();
		for (Namespace namespace: namespaces) {
			result = result.plus(copyNamespace(source, target, namespace, registries.apply(namespace)));
		}
		return result;
	}

	public static MigrationReport copyNamespace(StorageDriver source, StorageDriver target, Namespace namespace, CategoryRegistry registry) {
		JsonNode everything;
		try {
			everything = source.get(IdentifierData.forNamespace(namespace));
		} catch (NotFoundException e) {
			LOGGER.debug("Namespace {} vanished during migration", namespace);
			return MigrationReport.empty();
		}
		List<CategoryData> data = new ArrayList<>();
		for (Map.Entry<String, JsonNode> entry: everything.properties()) {
			if (registry.contains(entry.getKey())) {
				data.add(new CategoryData(entry.getKey(), entry.getValue()));
			} else {
				LOGGER.warn("Skipping unregistered category \"{}\" in {}", entry.getKey(), namespace);
			}
		}
		return target.importData(namespace, data, registry);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StorageMigration.class);
}
