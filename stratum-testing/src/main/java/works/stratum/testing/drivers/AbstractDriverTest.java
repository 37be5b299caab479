package works.stratum.testing.drivers;

import java.lang.reflect.Method;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.stratum.CategoryRegistry;
import works.stratum.DriverFactory;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;

public abstract class AbstractDriverTest {
	protected static final Namespace MUSIC = new Namespace("music", "1");
	protected static final Namespace GAMES = new Namespace("games", "42");
	protected static final CategoryRegistry REGISTRY = CategoryRegistry.builtIn().withCustomGroup("PLAYLIST", 2);
	protected final JsonMapper mapper = JsonMapper.builder().build();
	protected StorageDriver driver;
	private volatile String oldThreadName;

	@BeforeEach
	void logStart(TestInfo testInfo) {
		oldThreadName = Thread.currentThread().getName();
		String newThreadName = "test: " + testInfo.getDisplayName();
		Thread.currentThread().setName(newThreadName);
		logTest("/=== Start", testInfo);
		LOGGER.debug("Old thread name was {}", oldThreadName);
	}

	@AfterEach
	void logDone(TestInfo testInfo) {
		if (driver != null) {
			driver.close();
			driver = null;
		}
		logTest("\\=== Done", testInfo);
		Thread.currentThread().setName(oldThreadName);
	}

	private static void logTest(String verb, TestInfo testInfo) {
		String method =
			testInfo.getTestClass().map(Class::getSimpleName).orElse(null)
				+ "."
				+ testInfo.getTestMethod().map(Method::getName).orElse(null);
		LOGGER.info("{} {} {}", verb, method, testInfo.getDisplayName());
	}

	/**
	 * Builds and initializes the driver under test, and wipes whatever
	 * an earlier test may have left in a shared backend.
	 */
	protected StorageDriver setupDriver(DriverFactory driverFactory) {
		driver = driverFactory.buildAndInitialize();
		driver.deleteAllData(true);
		return driver;
	}

	protected IdentifierData global(String... identifiers) {
		return IdentifierData.forCategory(MUSIC, "GLOBAL", REGISTRY).withIdentifiers(List.of(identifiers));
	}

	protected IdentifierData guild(String guildID, String... identifiers) {
		return IdentifierData.forCategory(MUSIC, "GUILD", REGISTRY)
			.withPrimaryKey(List.of(guildID))
			.withIdentifiers(List.of(identifiers));
	}

	protected IdentifierData member(String guildID, String userID, String... identifiers) {
		return IdentifierData.forCategory(MUSIC, "MEMBER", REGISTRY)
			.withPrimaryKey(List.of(guildID, userID))
			.withIdentifiers(List.of(identifiers));
	}

	protected JsonNode json(String text) {
		return mapper.readTree(text.replace('\'', '"'));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractDriverTest.class);
}
