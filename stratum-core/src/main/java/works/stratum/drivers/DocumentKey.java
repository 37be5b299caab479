package works.stratum.drivers;

import works.stratum.IdentifierData;
import works.stratum.Namespace;

import static java.util.Objects.requireNonNull;

/**
 * Identifies one document in a {@link DocumentStorageDriver}:
 * everything stored under a single category of a single namespace.
 */
public record DocumentKey(Namespace namespace, String category) {
	public DocumentKey {
		requireNonNull(namespace);
		requireNonNull(category);
		if (category.isEmpty()) {
			throw new IllegalArgumentException("Document key requires a category");
		}
	}

	public static DocumentKey of(IdentifierData identifier) {
		return new DocumentKey(identifier.namespace(), identifier.category());
	}

	@Override
	public String toString() {
		return namespace + "/" + category;
	}
}
