package works.stratum.api;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;
import works.stratum.CategoryRegistry;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.backend.BackendType;
import works.stratum.backend.StorageDetails;
import works.stratum.backend.StorageDrivers;
import works.stratum.exceptions.BackendException;
import works.stratum.exceptions.NotFoundException;

import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiDriverTest {
	static final Namespace MUSIC = new Namespace("music", "1");
	final JsonMapper mapper = JsonMapper.builder().build();
	WireMockServer server;

	@BeforeEach
	void startServer() {
		server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
		server.start();
	}

	@AfterEach
	void stopServer() {
		server.stop();
	}

	StorageDriver newDriver(String token) {
		StorageDriver result = ApiDriver.factory(ApiDriverSettings.builder()
			.baseUrl(server.baseUrl())
			.token(token)
			.build()).build();
		result.initialize();
		return result;
	}

	static IdentifierData guildVolume() {
		return IdentifierData.forCategory(MUSIC, "GUILD", CategoryRegistry.builtIn())
			.withPrimaryKey(List.of("123"))
			.then("volume");
	}

	@Test
	void set_sendsDocumentedShape() {
		server.stubFor(put(urlEqualTo("/config/set")).willReturn(aResponse().withStatus(200).withBody("{\"value\":50}")));
		try (StorageDriver driver = newDriver("secret")) {
			assertEquals(mapper.readTree("50"), driver.set(guildVolume(), mapper.readTree("50")));
		}
		server.verify(putRequestedFor(urlEqualTo("/config/set"))
			.withHeader("Authorization", equalTo("secret"))
			.withHeader("Content-Type", equalTo("application/json"))
			.withRequestBody(equalToJson("{\"identifier\":[\"music\",\"1\",\"GUILD\",\"123\",\"volume\"],\"config_data\":50}")));
	}

	@Test
	void get_returnsRawBody() throws NotFoundException {
		server.stubFor(post(urlEqualTo("/config/get")).willReturn(aResponse().withStatus(200).withBody("{\"a\":[1,2]}")));
		try (StorageDriver driver = newDriver("secret")) {
			assertEquals(mapper.readTree("{\"a\":[1,2]}"), driver.get(guildVolume()));
		}
		server.verify(postRequestedFor(urlEqualTo("/config/get"))
			.withRequestBody(equalToJson("{\"identifier\":[\"music\",\"1\",\"GUILD\",\"123\",\"volume\"]}")));
	}

	@Test
	void get_anyFailureStatus_isNotFound() {
		server.stubFor(post(urlEqualTo("/config/get")).willReturn(aResponse().withStatus(500).withBody("kaboom")));
		try (StorageDriver driver = newDriver("secret")) {
			NotFoundException e = assertThrows(NotFoundException.class, () -> driver.get(guildVolume()));
			assertTrue(e.getMessage().contains("kaboom"), e::getMessage);
		}
	}

	@Test
	void noToken_noAuthorizationHeader() {
		server.stubFor(put(urlEqualTo("/config/clear")).willReturn(aResponse().withStatus(200).withBody("{}")));
		try (StorageDriver driver = newDriver(null)) {
			driver.clear(guildVolume());
		}
		server.verify(putRequestedFor(urlEqualTo("/config/clear"))
			.withHeader("Authorization", absent()));
	}

	@Test
	void failureStatus_surfacesBodyVerbatim() {
		String body = "{\"detail\":\"Database is on fire\"}";
		server.stubFor(put(urlEqualTo("/config/set")).willReturn(aResponse().withStatus(409).withBody(body)));
		try (StorageDriver driver = newDriver("secret")) {
			BackendException e = assertThrows(BackendException.class, () -> driver.set(guildVolume(), mapper.readTree("1")));
			assertEquals(body, e.diagnostics());
		}
	}

	@Test
	void unauthorized_isNotSpecial() {
		server.stubFor(put(urlEqualTo("/config/toggle")).willReturn(aResponse().withStatus(401).withBody("nope")));
		try (StorageDriver driver = newDriver("wrong")) {
			BackendException e = assertThrows(BackendException.class, () -> driver.toggle(guildVolume(), null, false));
			assertEquals("nope", e.diagnostics());
		}
	}

	@Test
	void increment_sendsDeltaAndDefault() {
		server.stubFor(put(urlEqualTo("/config/increment")).willReturn(aResponse().withStatus(200).withBody("{\"value\":8}")));
		try (StorageDriver driver = newDriver("secret")) {
			assertEquals(8L, driver.increment(guildVolume(), 3, 5).longValue());
		}
		server.verify(putRequestedFor(urlEqualTo("/config/increment"))
			.withRequestBody(equalToJson("{\"identifier\":[\"music\",\"1\",\"GUILD\",\"123\",\"volume\"],\"config_data\":3,\"default\":5}")));
	}

	@Test
	void increment_nonNumericResponse_throws() {
		server.stubFor(put(urlEqualTo("/config/increment")).willReturn(aResponse().withStatus(200).withBody("{\"value\":\"eight\"}")));
		try (StorageDriver driver = newDriver("secret")) {
			assertThrows(BackendException.class, () -> driver.increment(guildVolume(), 3, 5));
		}
	}

	@Test
	void toggle_sendsNullsForAbsentArguments() {
		server.stubFor(put(urlEqualTo("/config/toggle")).willReturn(aResponse().withStatus(200).withBody("{\"value\":true}")));
		try (StorageDriver driver = newDriver("secret")) {
			assertTrue(driver.toggle(guildVolume(), null, null));
		}
		server.verify(putRequestedFor(urlEqualTo("/config/toggle"))
			.withRequestBody(equalToJson("{\"identifier\":[\"music\",\"1\",\"GUILD\",\"123\",\"volume\"],\"config_data\":null,\"default\":null}")));
	}

	@Test
	void deleteAllData_sendsConfirmation() {
		server.stubFor(put(urlPathEqualTo("/config/clear_all")).willReturn(aResponse().withStatus(200).withBody("{}")));
		try (StorageDriver driver = newDriver("secret")) {
			driver.deleteAllData(true);
		}
		server.verify(putRequestedFor(urlEqualTo("/config/clear_all?i_want_to_do_this=true")));
	}

	@Test
	void namespaces_parsesPairs() {
		server.stubFor(post(urlEqualTo("/config/cogs")).willReturn(aResponse().withStatus(200).withBody("[[\"music\",\"1\"],[\"games\",\"42\"]]")));
		try (StorageDriver driver = newDriver("secret"); Stream<Namespace> namespaces = driver.namespaces()) {
			assertEquals(List.of(MUSIC, new Namespace("games", "42")), namespaces.toList());
		}
	}

	@Test
	void malformedResponse_throws() {
		server.stubFor(post(urlEqualTo("/config/cogs")).willReturn(aResponse().withStatus(200).withBody("[[\"music\"]]")));
		server.stubFor(put(urlEqualTo("/config/set")).willReturn(aResponse().withStatus(200).withBody("<html>")));
		try (StorageDriver driver = newDriver("secret")) {
			assertThrows(BackendException.class, driver::namespaces);
			assertThrows(BackendException.class, () -> driver.set(guildVolume(), mapper.readTree("1")));
		}
	}

	@Test
	void unreachableServer_throws() {
		StorageDriver driver = newDriver("secret");
		server.stop();
		assertThrows(BackendException.class, () -> driver.clear(guildVolume()));
		driver.close();
	}

	@Test
	void provider_mapsHostAndPassword() {
		StorageDetails details = StorageDetails.builder()
			.host(server.baseUrl() + "//")
			.password(StorageDetails.NO_PASSWORD)
			.build();
		try (StorageDriver driver = StorageDrivers.create(BackendType.API, details)) {
			ApiDriver api = assertInstanceOf(ApiDriver.class, driver);
			assertEquals(server.baseUrl(), api.baseUrl());
		}
		ApiDriverSettings defaults = ApiDriverSettings.fromStorageDetails(StorageDetails.builder().password("hunter2").build());
		assertEquals(ApiDriverSettings.DEFAULT_BASE_URL, defaults.getBaseUrl());
		assertEquals("hunter2", defaults.getToken());
		assertFalse(defaults.toString().contains("hunter2"));
	}
}
