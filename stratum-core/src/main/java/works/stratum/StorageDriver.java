package works.stratum;

import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.stratum.exceptions.BackendException;
import works.stratum.exceptions.ConfirmationRequiredException;
import works.stratum.exceptions.DriverStateException;
import works.stratum.exceptions.NotFoundException;
import works.stratum.exceptions.TypeMismatchException;
import works.stratum.migration.BulkImporter;
import works.stratum.migration.MigrationReport;

/**
 * The contract every storage backend implements.
 * <p>
 * A driver is created once per process, {@link #initialize() initialized},
 * shared by everyone who needs it, and finally {@link #close() closed}.
 * Calling any other method outside that window throws {@link DriverStateException}.
 * <p>
 * Drivers are thread-safe. Operations on different identifiers may proceed in any order;
 * {@link #increment} and {@link #toggle} are atomic with respect to other operations
 * on the same identifier from the same process.
 * <p>
 * Values are JSON trees. Drivers never retain the caller's node objects,
 * and the nodes they return are not shared with the driver's internal state.
 * <p>
 * Unless otherwise noted, any method may throw {@link BackendException}.
 */
public interface StorageDriver extends AutoCloseable {
	/**
	 * Acquires the driver's resources, such as connection pools.
	 * Must complete before any other operation is issued.
	 */
	void initialize();

	/**
	 * Releases the driver's resources. Idempotent.
	 */
	@Override
	void close();

	/**
	 * @return the value stored at exactly the given identifier;
	 * if the identifier addresses a subtree, returns the whole subtree
	 * @throws NotFoundException if there is no value there.
	 * Defaults are the caller's concern; the driver never invents a value.
	 */
	JsonNode get(IdentifierData identifier) throws NotFoundException;

	/**
	 * Replaces whatever is stored at the given identifier,
	 * creating any intermediate objects as needed.
	 *
	 * @return the value as stored
	 */
	JsonNode set(IdentifierData identifier, JsonNode value);

	/**
	 * Deletes the value or subtree at the given identifier.
	 * Does nothing if there is no such value.
	 */
	void clear(IdentifierData identifier);

	/**
	 * Adds {@code delta} to the stored number, or to {@code defaultValue} if there is none.
	 *
	 * @return the new value
	 * @throws TypeMismatchException if the stored value is not a number
	 */
	Number increment(IdentifierData identifier, Number delta, Number defaultValue);

	/**
	 * If {@code value} is null, flips the stored boolean, starting from
	 * {@code defaultValue} if there is none (or from false if that is null too).
	 * Otherwise, stores {@code value}.
	 *
	 * @return the new value
	 * @throws TypeMismatchException if the stored value exists and is not a boolean
	 */
	boolean toggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue);

	/**
	 * Bulk-loads data for the given namespace, typically while migrating from another backend.
	 * <p>
	 * Attempts one {@link #set} per category. If that fails, the category's payload is
	 * split into individual entities according to its primary key length,
	 * and each one is set separately. Entities that still fail are logged and reported,
	 * but do not stop the import.
	 *
	 * @see BulkImporter
	 */
	default MigrationReport importData(Namespace namespace, Iterable<CategoryData> data, CategoryRegistry registry) {
		return BulkImporter.importInto(this, namespace, data, registry);
	}

	/**
	 * Irreversibly deletes everything stored by this driver.
	 *
	 * @param confirmed must be true
	 * @throws ConfirmationRequiredException if {@code confirmed} is false, before touching anything
	 */
	void deleteAllData(boolean confirmed);

	/**
	 * @return every namespace that has data stored, each once.
	 * The stream can be consumed only once. Drivers that can page through their backend
	 * fetch as the stream is consumed; others take a snapshot when this is called.
	 * Either way, callers should close it, preferably with try-with-resources.
	 */
	Stream<Namespace> namespaces();
}
