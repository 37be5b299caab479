package works.stratum.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.drivers.InMemoryDriver;
import works.stratum.exceptions.NotFoundException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static works.stratum.drivers.DocumentStorageDriver.numberNode;

/**
 * An in-process configuration service, speaking the protocol {@link ApiDriver} expects,
 * that keeps its data in an {@link InMemoryDriver}.
 */
final class FakeConfigService implements AutoCloseable {
	private final JsonMapper mapper = JsonMapper.builder().build();
	private final StorageDriver storage = new InMemoryDriver();
	private final @Nullable String requiredToken;
	private final HttpServer server;
	private final ExecutorService executor = Executors.newFixedThreadPool(8);

	FakeConfigService(@Nullable String requiredToken) throws IOException {
		this.requiredToken = requiredToken;
		storage.initialize();
		server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		server.createContext("/config/", this::handle);
		server.setExecutor(executor);
		server.start();
	}

	String baseUrl() {
		return "http://localhost:" + server.getAddress().getPort();
	}

	@Override
	public void close() {
		server.stop(0);
		executor.shutdownNow();
		storage.close();
	}

	private void handle(HttpExchange exchange) throws IOException {
		try {
			if (requiredToken != null && !requiredToken.equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
				respond(exchange, 401, "{\"detail\":\"Unauthorized\"}");
				return;
			}
			String endpoint = exchange.getRequestURI().getPath();
			try {
				respond(exchange, 200, dispatch(endpoint, exchange));
			} catch (NotFoundException e) {
				respond(exchange, 404, "{\"detail\":\"Not found\"}");
			} catch (RuntimeException e) {
				LOGGER.debug("{} failed", endpoint, e);
				respond(exchange, 400, mapper.writeValueAsString(JsonNodeFactory.instance.objectNode().put("detail", String.valueOf(e.getMessage()))));
			}
		} finally {
			exchange.close();
		}
	}

	private String dispatch(String endpoint, HttpExchange exchange) throws IOException, NotFoundException {
		switch (endpoint) {
			case ApiDriver.CLEAR_ALL_ENDPOINT: {
				if (!"i_want_to_do_this=true".equals(exchange.getRequestURI().getQuery())) {
					throw new IllegalArgumentException("Confirmation missing");
				}
				storage.deleteAllData(true);
				return "{}";
			}
			case ApiDriver.COGS_ENDPOINT: {
				ArrayNode result = JsonNodeFactory.instance.arrayNode();
				try (Stream<Namespace> namespaces = storage.namespaces()) {
					namespaces.forEach(n -> result.addArray().add(n.ownerNamespace()).add(n.instanceId()));
				}
				return mapper.writeValueAsString(result);
			}
			default:
				break;
		}
		JsonNode request;
		try (InputStream in = exchange.getRequestBody()) {
			request = mapper.readTree(in.readAllBytes());
		}
		if (!"application/json".equals(exchange.getRequestHeaders().getFirst("Content-Type"))) {
			throw new IllegalArgumentException("Expected JSON");
		}
		IdentifierData identifier = identifier(request.path("identifier"));
		JsonNode data = request.path("config_data");
		JsonNode defaultValue = request.path("default");
		switch (endpoint) {
			case ApiDriver.GET_ENDPOINT:
				return mapper.writeValueAsString(storage.get(identifier));
			case ApiDriver.SET_ENDPOINT:
				return value(storage.set(identifier, data));
			case ApiDriver.CLEAR_ENDPOINT:
				storage.clear(identifier);
				return "{}";
			case ApiDriver.INCREMENT_ENDPOINT:
				return value(numberNode(storage.increment(identifier, data.numberValue(), defaultValue.numberValue())));
			case ApiDriver.TOGGLE_ENDPOINT:
				return value(JsonNodeFactory.instance.booleanNode(storage.toggle(identifier, nullableBoolean(data), nullableBoolean(defaultValue))));
			default:
				throw new IllegalArgumentException("No such endpoint: " + endpoint);
		}
	}

	private String value(JsonNode value) {
		ObjectNode result = JsonNodeFactory.instance.objectNode();
		result.set("value", value);
		return mapper.writeValueAsString(result);
	}

	/**
	 * The service only needs the document path, so the whole remainder is treated as identifiers.
	 */
	private static IdentifierData identifier(JsonNode segments) {
		List<String> strings = new ArrayList<>();
		for (JsonNode segment: segments) {
			strings.add(segment.asString());
		}
		if (strings.size() < 2) {
			throw new IllegalArgumentException("Identifier too short: " + strings);
		}
		String category = (strings.size() > 2)? strings.get(2) : "";
		List<String> rest = (strings.size() > 3)? strings.subList(3, strings.size()) : List.of();
		return IdentifierData.of(strings.get(0), strings.get(1), category, List.of(), rest, 0, false);
	}

	private static @Nullable Boolean nullableBoolean(JsonNode node) {
		return node.isBoolean()? node.booleanValue() : null;
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(UTF_8);
		exchange.getResponseHeaders().set("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FakeConfigService.class);
}
