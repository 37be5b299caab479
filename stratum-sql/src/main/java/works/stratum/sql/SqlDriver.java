package works.stratum.sql;

import java.sql.Connection;
import java.sql.SQLException;
import works.stratum.DriverFactory;
import works.stratum.StorageDriver;

/**
 * Stores each category's document as one row of a relational table,
 * keyed by owner namespace, instance ID and category.
 */
public interface SqlDriver extends StorageDriver {
	/**
	 * The drivers built by this factory don't close {@code connectionSource};
	 * that remains the caller's responsibility.
	 */
	static DriverFactory factory(
		SqlDriverSettings settings,
		ConnectionSource connectionSource
	) {
		return () -> new SqlDriverImpl(settings, connectionSource, () -> {});
	}

	interface ConnectionSource {
		Connection get() throws SQLException;
	}
}
