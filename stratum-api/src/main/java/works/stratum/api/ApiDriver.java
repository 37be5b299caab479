package works.stratum.api;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.stratum.DriverFactory;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.drivers.AbstractStorageDriver;
import works.stratum.exceptions.BackendException;
import works.stratum.exceptions.NotFoundException;
import works.stratum.exceptions.TypeMismatchException;
import works.stratum.jackson.JsonCodec;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.stratum.drivers.DocumentStorageDriver.numberNode;

/**
 * Delegates storage to a remote configuration service over HTTP.
 * <p>
 * Every request body is a JSON object whose {@code identifier} is the
 * {@link IdentifierData#pathSegments() path segments} of the value,
 * with {@code config_data} and {@code default} where the operation has them.
 * Successful responses have status 200; most carry {@code {"value": ...}}.
 * The service is responsible for atomicity; this driver keeps no state
 * beyond its HTTP client.
 */
public class ApiDriver extends AbstractStorageDriver {
	static final String GET_ENDPOINT = "/config/get";
	static final String SET_ENDPOINT = "/config/set";
	static final String CLEAR_ENDPOINT = "/config/clear";
	static final String INCREMENT_ENDPOINT = "/config/increment";
	static final String TOGGLE_ENDPOINT = "/config/toggle";
	static final String CLEAR_ALL_ENDPOINT = "/config/clear_all";
	static final String COGS_ENDPOINT = "/config/cogs";

	private final ApiDriverSettings settings;
	private final String baseUrl;
	private final JsonCodec codec;
	private volatile HttpClient client;

	public ApiDriver(ApiDriverSettings settings) {
		super("api");
		this.settings = requireNonNull(settings);
		this.baseUrl = stripTrailingSlashes(requireNonNull(settings.getBaseUrl()));
		this.codec = requireNonNull(settings.getCodec());
		URI.create(baseUrl); // Fail fast on nonsense
	}

	public static DriverFactory factory(ApiDriverSettings settings) {
		return () -> new ApiDriver(settings);
	}

	public String baseUrl() {
		return baseUrl;
	}

	@Override
	protected void doInitialize() {
		client = HttpClient.newBuilder()
			.connectTimeout(settings.getConnectTimeout())
			.build();
		LOGGER.debug("Using {} with codec {}", baseUrl, codec.name());
	}

	/**
	 * {@link HttpClient} has nothing to close before JDK 21; dropping the
	 * reference lets its threads wind down.
	 */
	@Override
	protected void doClose() {
		client = null;
	}

	@Override
	protected JsonNode doGet(IdentifierData identifier) throws NotFoundException {
		HttpResponse<byte[]> response = send(post(GET_ENDPOINT, body(identifier)));
		if (response.statusCode() != 200) {
			throw new NotFoundException(identifier, text(response));
		}
		return decode(response);
	}

	@Override
	protected JsonNode doSet(IdentifierData identifier, JsonNode value) {
		ObjectNode body = body(identifier);
		body.set("config_data", value.deepCopy());
		JsonNode result = value(expectSuccess(send(put(SET_ENDPOINT, body))));
		return result.isMissingNode()? value.deepCopy() : result;
	}

	@Override
	protected void doClear(IdentifierData identifier) {
		expectSuccess(send(put(CLEAR_ENDPOINT, body(identifier))));
	}

	@Override
	protected Number doIncrement(IdentifierData identifier, Number delta, Number defaultValue) {
		ObjectNode body = body(identifier);
		body.set("config_data", numberNode(delta));
		body.set("default", numberNode(defaultValue));
		JsonNode result = value(expectSuccess(send(put(INCREMENT_ENDPOINT, body))));
		if (!result.isNumber()) {
			throw new TypeMismatchException(identifier, "a number in the response", result);
		}
		return result.numberValue();
	}

	@Override
	protected boolean doToggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue) {
		ObjectNode body = body(identifier);
		body.set("config_data", booleanNode(value));
		body.set("default", booleanNode(defaultValue));
		JsonNode result = value(expectSuccess(send(put(TOGGLE_ENDPOINT, body))));
		if (!result.isBoolean()) {
			throw new TypeMismatchException(identifier, "a boolean in the response", result);
		}
		return result.booleanValue();
	}

	@Override
	protected void doDeleteAllData() {
		HttpRequest request = request(CLEAR_ALL_ENDPOINT + "?i_want_to_do_this=true")
			.PUT(BodyPublishers.noBody())
			.build();
		expectSuccess(send(request));
	}

	@Override
	protected Stream<Namespace> doNamespaces() {
		HttpRequest request = request(COGS_ENDPOINT)
			.POST(BodyPublishers.noBody())
			.build();
		JsonNode pairs = expectSuccess(send(request));
		if (!pairs.isArray()) {
			throw new BackendException("Expected an array of namespaces", pairs.toString());
		}
		List<Namespace> result = new ArrayList<>(pairs.size());
		for (JsonNode pair: pairs) {
			if (pair.isArray() && pair.size() == 2
				&& pair.get(0) instanceof StringNode owner
				&& pair.get(1) instanceof StringNode instance) {
				result.add(new Namespace(owner.asString(), instance.asString()));
			} else {
				throw new BackendException("Expected an [owner, instance] pair", pair.toString());
			}
		}
		return result.stream();
	}

	private ObjectNode body(IdentifierData identifier) {
		ObjectNode result = JsonNodeFactory.instance.objectNode();
		ArrayNode segments = result.putArray("identifier");
		identifier.pathSegments().forEach(segments::add);
		return result;
	}

	private HttpRequest post(String endpoint, JsonNode body) {
		return request(endpoint)
			.header("Content-Type", "application/json")
			.POST(BodyPublishers.ofByteArray(codec.writeBytes(body)))
			.build();
	}

	private HttpRequest put(String endpoint, JsonNode body) {
		return request(endpoint)
			.header("Content-Type", "application/json")
			.PUT(BodyPublishers.ofByteArray(codec.writeBytes(body)))
			.build();
	}

	private HttpRequest.Builder request(String endpoint) {
		HttpRequest.Builder result = HttpRequest.newBuilder()
			.uri(URI.create(baseUrl + endpoint))
			.timeout(settings.getRequestTimeout());
		if (settings.getToken() != null) {
			result.header("Authorization", settings.getToken());
		}
		return result;
	}

	private HttpResponse<byte[]> send(HttpRequest request) {
		HttpClient c = client;
		if (c == null) {
			throw new BackendException("HTTP client is closed");
		}
		LOGGER.trace("{} {}", request.method(), request.uri());
		try {
			return c.send(request, BodyHandlers.ofByteArray());
		} catch (IOException e) {
			throw new BackendException("Request to " + request.uri() + " failed", e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BackendException("Interrupted during request to " + request.uri(), e);
		}
	}

	/**
	 * @return the decoded body
	 */
	private JsonNode expectSuccess(HttpResponse<byte[]> response) {
		if (response.statusCode() != 200) {
			LOGGER.debug("{} {} returned {}", response.request().method(), response.uri(), response.statusCode());
			throw new BackendException("Request to " + response.uri() + " failed with status " + response.statusCode(), text(response));
		}
		return decode(response);
	}

	private JsonNode decode(HttpResponse<byte[]> response) {
		byte[] body = response.body();
		if (body == null || body.length == 0) {
			return JsonNodeFactory.instance.missingNode();
		}
		return codec.read(body);
	}

	private static JsonNode value(JsonNode responseBody) {
		return responseBody.path("value");
	}

	private static String text(HttpResponse<byte[]> response) {
		byte[] body = response.body();
		return (body == null)? "" : new String(body, UTF_8);
	}

	private static JsonNode booleanNode(@Nullable Boolean b) {
		return (b == null)? JsonNodeFactory.instance.nullNode() : JsonNodeFactory.instance.booleanNode(b);
	}

	static String stripTrailingSlashes(String url) {
		String result = url.trim();
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	@Override
	public String toString() {
		return "ApiDriver{" + instanceID() + ", " + baseUrl + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ApiDriver.class);
}
