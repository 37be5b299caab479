package works.stratum.drivers;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.stratum.DriverFactory;
import works.stratum.Namespace;

/**
 * Keeps everything in memory. Nothing survives the driver.
 * <p>
 * Used when no other backend is configured, and as the reference
 * implementation the other drivers are tested against.
 */
public class InMemoryDriver extends DocumentStorageDriver {
	private final ConcurrentHashMap<DocumentKey, JsonNode> documents = new ConcurrentHashMap<>();

	public InMemoryDriver() {
		super("memory");
	}

	public static DriverFactory factory() {
		return InMemoryDriver::new;
	}

	@Override
	protected @Nullable JsonNode loadDocument(DocumentKey key) {
		JsonNode result = documents.get(key);
		return (result == null)? null : result.deepCopy();
	}

	@Override
	protected void storeDocument(DocumentKey key, JsonNode document) {
		documents.put(key, document);
	}

	@Override
	protected void deleteDocument(DocumentKey key) {
		documents.remove(key);
	}

	@Override
	protected Set<String> categories(Namespace namespace) {
		return documents.keySet().stream()
			.filter(k -> k.namespace().equals(namespace))
			.map(DocumentKey::category)
			.collect(Collectors.toSet());
	}

	@Override
	protected void deleteAllDocuments() {
		documents.clear();
	}

	@Override
	protected Stream<Namespace> listNamespaces() {
		return documents.keySet().stream()
			.map(DocumentKey::namespace)
			.distinct()
			.toList()
			.stream();
	}

	@Override
	protected void doClose() {
		documents.clear();
	}
}
