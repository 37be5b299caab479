package works.stratum.redis;

import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.junit.jupiter.Testcontainers;
import works.stratum.testing.drivers.DriverConformanceTest;

@Testcontainers(disabledWithoutDocker = true)
class RedisDriverConformanceTest extends DriverConformanceTest {

	@BeforeEach
	void setupDriverFactory() {
		driverFactory = RedisDriver.factory(RedisTestService.settings()
			.keyPrefix("conformance")
			.build());
	}

}
