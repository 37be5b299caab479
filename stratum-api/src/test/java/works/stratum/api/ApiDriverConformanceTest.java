package works.stratum.api;

import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import works.stratum.exceptions.BackendException;
import works.stratum.testing.drivers.DriverConformanceTest;

class ApiDriverConformanceTest extends DriverConformanceTest {
	private FakeConfigService service;

	@BeforeEach
	void setupDriverFactory() throws IOException {
		service = new FakeConfigService("secret");
		driverFactory = ApiDriver.factory(ApiDriverSettings.builder()
			.baseUrl(service.baseUrl() + "/")
			.token("secret")
			.build());
	}

	@AfterEach
	void stopService() {
		service.close();
	}

	/**
	 * The service reports a type mismatch like any other rejected request.
	 */
	@Override
	protected Class<? extends BackendException> typeMismatchException() {
		return BackendException.class;
	}
}
