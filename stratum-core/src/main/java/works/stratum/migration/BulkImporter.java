package works.stratum.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.stratum.CategoryData;
import works.stratum.CategoryRegistry;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.migration.MigrationReport.FailedLeaf;

/**
 * The two-phase import used by {@link StorageDriver#importData}.
 * <ol>
 *     <li>
 *         Each category is first written with a single {@link StorageDriver#set set}.
 *     </li>
 *     <li>
 *         If that fails, the category's payload is split into leaves, one per complete
 *         primary key, and each leaf is written with its own {@code set}.
 *         Leaves that fail are logged, recorded in the {@link MigrationReport}, and skipped.
 *     </li>
 * </ol>
 * All writes go through the given driver's own {@code set},
 * so decorators see every individual write.
 */
public final class BulkImporter {
	private BulkImporter() {}

	public static MigrationReport importInto(StorageDriver driver, Namespace namespace, Iterable<CategoryData> data, CategoryRegistry registry) {
		LOGGER.info("Importing data for {}", namespace);
		MigrationReport result = MigrationReport.empty();
		for (CategoryData categoryData: data) {
			result = result.plus(importCategory(driver, namespace, categoryData, registry));
		}
		if (result.isComplete()) {
			LOGGER.info("Imported {}: {} categories in bulk, {} individual entities", namespace, result.categoriesImported(), result.leavesImported());
		} else {
			LOGGER.warn("Imported {} with {} failures", namespace, result.failures().size());
		}
		return result;
	}

	static MigrationReport importCategory(StorageDriver driver, Namespace namespace, CategoryData categoryData, CategoryRegistry registry) {
		LOGGER.debug("Importing category {} of {}", categoryData.category(), namespace);
		IdentifierData categoryID = IdentifierData.forCategory(namespace, categoryData.category(), registry);
		try {
			driver.set(categoryID, categoryData.payload());
			return new MigrationReport(1, 0, List.of());
		} catch (RuntimeException e) {
			LOGGER.warn("Bulk import of {} failed; falling back to individual entities", categoryID, e);
		}

		int imported = 0;
		List<FailedLeaf> failures = new ArrayList<>();
		for (Leaf leaf: splitByPrimaryKey(categoryData.payload(), categoryID.primaryKeyLength())) {
			IdentifierData leafID = categoryID.withPrimaryKey(leaf.primaryKey());
			try {
				driver.set(leafID, leaf.value());
				++imported;
			} catch (RuntimeException e) {
				LOGGER.error("Error saving {}: {}", leafID, leaf.value(), e);
				failures.add(new FailedLeaf(leafID, leaf.value(), e));
			}
		}
		return new MigrationReport(0, imported, failures);
	}

	/**
	 * @param primaryKey at most {@code primaryKeyLength} segments.
	 *                   It can be shorter if the payload had a non-object where an object was expected,
	 *                   in which case the non-object is imported as-is at that shorter key.
	 */
	record Leaf(List<String> primaryKey, JsonNode value) { }

	static List<Leaf> splitByPrimaryKey(JsonNode payload, int primaryKeyLength) {
		List<Leaf> result = new ArrayList<>();
		collectLeaves(payload, primaryKeyLength, new ArrayList<>(), result);
		return result;
	}

	private static void collectLeaves(JsonNode node, int levelsRemaining, List<String> keySoFar, List<Leaf> result) {
		if (levelsRemaining == 0 || !node.isObject()) {
			result.add(new Leaf(List.copyOf(keySoFar), node));
			return;
		}
		for (Map.Entry<String, JsonNode> entry: node.properties()) {
			keySoFar.add(entry.getKey());
			collectLeaves(entry.getValue(), levelsRemaining - 1, keySoFar, result);
			keySoFar.remove(keySoFar.size() - 1);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BulkImporter.class);
}
