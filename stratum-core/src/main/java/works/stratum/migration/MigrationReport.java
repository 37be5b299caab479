package works.stratum.migration;

import java.util.ArrayList;
import java.util.List;
import tools.jackson.databind.JsonNode;
import works.stratum.IdentifierData;

/**
 * The outcome of a bulk import. A report with failures is a legitimate result,
 * not an error: everything that could be stored has been stored.
 *
 * @param categoriesImported categories that were stored with a single bulk write
 * @param leavesImported entities stored individually after a category's bulk write failed
 * @param failures entities that could not be stored at all
 */
public record MigrationReport(
	int categoriesImported,
	int leavesImported,
	List<FailedLeaf> failures
) {
	public MigrationReport {
		failures = List.copyOf(failures);
	}

	public static MigrationReport empty() {
		return new MigrationReport(0, 0, List.of());
	}

	public boolean isComplete() {
		return failures.isEmpty();
	}

	public MigrationReport plus(MigrationReport other) {
		List<FailedLeaf> allFailures = new ArrayList<>(failures);
		allFailures.addAll(other.failures);
		return new MigrationReport(
			categoriesImported + other.categoriesImported,
			leavesImported + other.leavesImported,
			allFailures);
	}

	public record FailedLeaf(IdentifierData identifier, JsonNode value, Exception cause) { }
}
