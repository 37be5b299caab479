package works.stratum;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * The full address of a config value or subtree.
 * <p>
 * An address consists of the owner namespace and instance that own the data,
 * the category (a kind of logical table), the primary key identifying an entity
 * within the category, and the identifiers leading to a value within that entity.
 * <p>
 * A primary key shorter than {@link #primaryKeyLength()} addresses the subtree
 * containing all the entities that share that prefix.
 * An empty category addresses the entire namespace.
 * <p>
 * Instances are immutable; the {@code with*} methods return new objects.
 */
public final class IdentifierData {
	@NotNull private final String ownerNamespace;
	@NotNull private final String instanceId;
	@NotNull private final String category;
	@NotNull private final List<String> primaryKey;
	@NotNull private final List<String> identifiers;
	private final int primaryKeyLength;
	private final boolean isCustom;

	private IdentifierData(String ownerNamespace, String instanceId, String category, List<String> primaryKey, List<String> identifiers, int primaryKeyLength, boolean isCustom) {
		this.ownerNamespace = ownerNamespace;
		this.instanceId = instanceId;
		this.category = category;
		this.primaryKey = primaryKey;
		this.identifiers = identifiers;
		this.primaryKeyLength = primaryKeyLength;
		this.isCustom = isCustom;
	}

	/**
	 * @throws IllegalArgumentException if {@code ownerNamespace} is empty,
	 * or if {@code primaryKey} has more than {@code primaryKeyLength} segments.
	 */
	public static IdentifierData of(
		String ownerNamespace,
		String instanceId,
		String category,
		List<String> primaryKey,
		List<String> identifiers,
		int primaryKeyLength,
		boolean isCustom
	) {
		requireNonNull(ownerNamespace, "ownerNamespace");
		requireNonNull(instanceId, "instanceId");
		requireNonNull(category, "category");
		if (ownerNamespace.isEmpty()) {
			throw new IllegalArgumentException("Owner namespace can't be empty");
		}
		if (primaryKeyLength < 0) {
			throw new IllegalArgumentException("Primary key length can't be negative: " + primaryKeyLength);
		}
		List<String> pk = List.copyOf(primaryKey); // Also rejects nulls
		List<String> ids = List.copyOf(identifiers);
		if (pk.size() > primaryKeyLength) {
			throw new IllegalArgumentException("Primary key " + pk + " is longer than " + primaryKeyLength + " for category \"" + category + "\"");
		}
		if (category.isEmpty() && !(pk.isEmpty() && ids.isEmpty())) {
			throw new IllegalArgumentException("An identifier without a category can't have keys");
		}
		return new IdentifierData(ownerNamespace, instanceId, category, pk, ids, primaryKeyLength, isCustom);
	}

	/**
	 * The identifier for a whole category, using the registry to look up the category's metadata.
	 */
	public static IdentifierData forCategory(Namespace namespace, String category, CategoryRegistry registry) {
		CategoryInfo info = registry.lookup(category);
		return of(namespace.ownerNamespace(), namespace.instanceId(), category, List.of(), List.of(), info.primaryKeyLength(), info.isCustom());
	}

	/**
	 * The identifier for everything stored under the given namespace.
	 */
	public static IdentifierData forNamespace(Namespace namespace) {
		return of(namespace.ownerNamespace(), namespace.instanceId(), "", List.of(), List.of(), 0, false);
	}

	public String ownerNamespace() {
		return ownerNamespace;
	}

	public String instanceId() {
		return instanceId;
	}

	public String category() {
		return category;
	}

	public List<String> primaryKey() {
		return primaryKey;
	}

	public List<String> identifiers() {
		return identifiers;
	}

	public int primaryKeyLength() {
		return primaryKeyLength;
	}

	public boolean isCustom() {
		return isCustom;
	}

	public Namespace namespace() {
		return new Namespace(ownerNamespace, instanceId);
	}

	public boolean isWholeNamespace() {
		return category.isEmpty();
	}

	/**
	 * @return true if the primary key is complete, meaning this addresses
	 * something within a single entity rather than a group of entities.
	 */
	public boolean hasFullPrimaryKey() {
		return primaryKey.size() == primaryKeyLength;
	}

	/**
	 * @return the path within the category's document: primary key segments followed by identifiers.
	 */
	public List<String> documentPath() {
		List<String> result = new ArrayList<>(primaryKey.size() + identifiers.size());
		result.addAll(primaryKey);
		result.addAll(identifiers);
		return result;
	}

	/**
	 * @return the flat, ordered address of this value, suitable for
	 * any backend that addresses values by a list of segments.
	 */
	public List<String> pathSegments() {
		List<String> result = new ArrayList<>(3 + primaryKey.size() + identifiers.size());
		result.add(ownerNamespace);
		result.add(instanceId);
		if (!category.isEmpty()) {
			result.add(category);
			result.addAll(primaryKey);
			result.addAll(identifiers);
		}
		return result;
	}

	public IdentifierData withPrimaryKey(List<String> newPrimaryKey) {
		return of(ownerNamespace, instanceId, category, newPrimaryKey, identifiers, primaryKeyLength, isCustom);
	}

	public IdentifierData withIdentifiers(List<String> newIdentifiers) {
		return of(ownerNamespace, instanceId, category, primaryKey, newIdentifiers, primaryKeyLength, isCustom);
	}

	/**
	 * @return an identifier addressing something inside this one
	 */
	public IdentifierData then(String... moreIdentifiers) {
		List<String> ids = new ArrayList<>(identifiers);
		ids.addAll(List.of(moreIdentifiers));
		return withIdentifiers(ids);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		IdentifierData that = (IdentifierData) o;
		return primaryKeyLength == that.primaryKeyLength
			&& isCustom == that.isCustom
			&& ownerNamespace.equals(that.ownerNamespace)
			&& instanceId.equals(that.instanceId)
			&& category.equals(that.category)
			&& primaryKey.equals(that.primaryKey)
			&& identifiers.equals(that.identifiers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ownerNamespace, instanceId, category, primaryKey, identifiers, primaryKeyLength, isCustom);
	}

	@Override
	public String toString() {
		return "IdentifierData{" +
			"owner=" + ownerNamespace +
			", instance=" + instanceId +
			", category=" + category +
			", primaryKey=" + primaryKey +
			", identifiers=" + identifiers +
			", primaryKeyLength=" + primaryKeyLength +
			(isCustom? ", custom" : "") +
			'}';
	}
}
