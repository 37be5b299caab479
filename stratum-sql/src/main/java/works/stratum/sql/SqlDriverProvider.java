package works.stratum.sql;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import works.stratum.StorageDriver;
import works.stratum.backend.BackendType;
import works.stratum.backend.StorageDetails;
import works.stratum.backend.StorageDriverProvider;

/**
 * Reads the JDBC URL from {@link StorageDetails#getPath() path}, and
 * the optional {@code username}, {@code table} and {@code poolSize} from the options.
 * The driver owns the connection pool and closes it when the driver closes.
 */
public final class SqlDriverProvider implements StorageDriverProvider {
	@Override
	public BackendType type() {
		return BackendType.SQL;
	}

	@Override
	public StorageDriver create(StorageDetails details) {
		if (details.getPath() == null) {
			throw new IllegalArgumentException("The SQL backend requires a JDBC URL as its path");
		}
		HikariConfig config = new HikariConfig();
		config.setJdbcUrl(details.getPath());
		config.setUsername(details.getOptions().get("username"));
		config.setPassword(details.getPassword());
		config.setPoolName("stratum-sql");
		String poolSize = details.getOptions().get("poolSize");
		if (poolSize != null) {
			config.setMaximumPoolSize(Integer.parseInt(poolSize));
		}
		SqlDriverSettings.SqlDriverSettingsBuilder settings = SqlDriverSettings.builder();
		String tableName = details.getOptions().get("table");
		if (tableName != null) {
			settings.tableName(tableName);
		}

		// Connect lazily, on initialize, like the other backends
		config.setInitializationFailTimeout(-1);
		HikariDataSource dataSource = new HikariDataSource(config);
		return new SqlDriverImpl(settings.build(), dataSource::getConnection, dataSource::close);
	}
}
