package works.stratum.sql;

import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import works.stratum.testing.drivers.DriverConformanceTest;

class SqlDriverConformanceTest extends DriverConformanceTest {
	@TempDir
	Path directory;

	private HikariDataSource dataSource;

	@BeforeEach
	void setupDriverFactory() {
		dataSource = SqlTestDatabase.sqliteDataSource(directory);
		driverFactory = SqlDriver.factory(SqlDriverSettings.builder().build(), dataSource::getConnection);
	}

	@AfterEach
	void closeDataSource() {
		dataSource.close();
	}
}
