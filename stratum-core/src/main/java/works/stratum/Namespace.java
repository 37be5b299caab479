package works.stratum;

import static java.util.Objects.requireNonNull;

/**
 * The top-level grouping of stored data: one installed copy of one owner.
 */
public record Namespace(String ownerNamespace, String instanceId) {
	public Namespace {
		requireNonNull(ownerNamespace);
		requireNonNull(instanceId);
		if (ownerNamespace.isEmpty()) {
			throw new IllegalArgumentException("Owner namespace can't be empty");
		}
	}

	@Override
	public String toString() {
		return ownerNamespace + "/" + instanceId;
	}
}
