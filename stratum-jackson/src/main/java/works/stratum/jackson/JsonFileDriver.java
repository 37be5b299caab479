package works.stratum.jackson;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import works.stratum.DriverFactory;
import works.stratum.Namespace;
import works.stratum.drivers.DocumentKey;
import works.stratum.drivers.DocumentStorageDriver;
import works.stratum.exceptions.BackendException;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Stores each owner namespace in its own file, {@code <base>/<owner>/settings.json},
 * holding an object of the form {@code {instance: {category: document}}}.
 * <p>
 * Files are read once and kept in memory. Every change rewrites the owner's whole file
 * by writing a temporary file and moving it into place, so a crash leaves either the old
 * contents or the new ones. Changes to one owner are serialized; the cached tree is
 * replaced, never modified, so readers need no lock.
 * <p>
 * Only one process should use a given directory at a time.
 */
public class JsonFileDriver extends DocumentStorageDriver {
	private final JsonFileDriverSettings settings;
	private final ObjectMapper mapper;
	private final Map<String, ObjectNode> owners = new ConcurrentHashMap<>();

	public JsonFileDriver(JsonFileDriverSettings settings) {
		super("json");
		if (settings.getBaseDirectory() == null) {
			throw new IllegalArgumentException("JSON file driver requires a base directory");
		}
		this.settings = settings;
		JsonMapper.Builder builder = JsonMapper.builder();
		if (settings.isPrettyPrint()) {
			builder.enable(SerializationFeature.INDENT_OUTPUT);
		}
		this.mapper = builder.build();
	}

	public static DriverFactory factory(JsonFileDriverSettings settings) {
		return () -> new JsonFileDriver(settings);
	}

	@Override
	protected void doInitialize() {
		try {
			Files.createDirectories(settings.getBaseDirectory());
		} catch (IOException e) {
			throw new BackendException("Unable to create " + settings.getBaseDirectory(), e);
		}
		LOGGER.debug("Storing files in {}", settings.getBaseDirectory());
	}

	@Override
	protected void doClose() {
		owners.clear();
	}

	/**
	 * All documents for one owner share a file.
	 */
	@Override
	protected Object lockKey(DocumentKey key) {
		return key.namespace().ownerNamespace();
	}

	@Override
	protected @Nullable JsonNode loadDocument(DocumentKey key) {
		JsonNode document = ownerTree(key.namespace().ownerNamespace())
			.path(key.namespace().instanceId())
			.get(key.category());
		return (document == null)? null : document.deepCopy();
	}

	@Override
	protected void storeDocument(DocumentKey key, JsonNode document) {
		String owner = key.namespace().ownerNamespace();
		ObjectNode newTree = ownerTree(owner).deepCopy();
		JsonNode instance = newTree.get(key.namespace().instanceId());
		ObjectNode instanceNode = (instance instanceof ObjectNode o)? o : newTree.putObject(key.namespace().instanceId());
		instanceNode.set(key.category(), document);
		replaceOwnerTree(owner, newTree);
	}

	@Override
	protected void deleteDocument(DocumentKey key) {
		String owner = key.namespace().ownerNamespace();
		ObjectNode oldTree = ownerTree(owner);
		if (!(oldTree.get(key.namespace().instanceId()) instanceof ObjectNode oldInstance) || !oldInstance.has(key.category())) {
			return;
		}
		ObjectNode newTree = oldTree.deepCopy();
		ObjectNode instanceNode = (ObjectNode) newTree.get(key.namespace().instanceId());
		instanceNode.remove(key.category());
		if (instanceNode.isEmpty()) {
			newTree.remove(key.namespace().instanceId());
		}
		replaceOwnerTree(owner, newTree);
	}

	@Override
	protected Set<String> categories(Namespace namespace) {
		Set<String> result = new LinkedHashSet<>();
		for (Map.Entry<String, JsonNode> entry: ownerTree(namespace.ownerNamespace()).path(namespace.instanceId()).properties()) {
			result.add(entry.getKey());
		}
		return result;
	}

	@Override
	protected void deleteAllDocuments() {
		for (String owner: ownerDirectoryNames()) {
			Path file = fileFor(owner);
			try {
				Files.deleteIfExists(file);
				Files.deleteIfExists(file.getParent());
			} catch (IOException e) {
				throw new BackendException("Unable to delete " + file, e);
			}
		}
		owners.clear();
	}

	@Override
	protected Stream<Namespace> listNamespaces() {
		return ownerDirectoryNames().stream()
			// Each owner's instances are copied because the tree may change while the caller iterates
			.flatMap(owner -> ownerTree(owner).properties().stream()
				.map(instance -> new Namespace(owner, instance.getKey()))
				.toList()
				.stream());
	}

	private ObjectNode ownerTree(String owner) {
		return owners.computeIfAbsent(owner, this::readFile);
	}

	private ObjectNode readFile(String owner) {
		Path file = fileFor(owner);
		try {
			JsonNode contents = mapper.readTree(Files.readAllBytes(file));
			if (contents instanceof ObjectNode o) {
				LOGGER.debug("Loaded {}", file);
				return o;
			}
			throw new BackendException("Expected a JSON object in " + file + "; found " + contents.getNodeType());
		} catch (NoSuchFileException e) {
			return mapper.createObjectNode();
		} catch (IOException | JacksonException e) {
			throw new BackendException("Unable to read " + file, e);
		}
	}

	/**
	 * Must be called while holding the owner's lock.
	 */
	private void replaceOwnerTree(String owner, ObjectNode newTree) {
		Path file = fileFor(owner);
		try {
			if (newTree.isEmpty()) {
				Files.deleteIfExists(file);
			} else {
				Files.createDirectories(file.getParent());
				Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
				try {
					Files.write(temp, mapper.writeValueAsBytes(newTree));
					moveIntoPlace(temp, file);
				} finally {
					Files.deleteIfExists(temp);
				}
			}
		} catch (IOException | JacksonException e) {
			throw new BackendException("Unable to write " + file, e);
		}
		owners.put(owner, newTree);
	}

	private static void moveIntoPlace(Path temp, Path file) throws IOException {
		try {
			Files.move(temp, file, ATOMIC_MOVE, REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			LOGGER.debug("Atomic move not supported; falling back to plain replace", e);
			Files.move(temp, file, REPLACE_EXISTING);
		}
	}

	private Path fileFor(String owner) {
		Path base = settings.getBaseDirectory().toAbsolutePath().normalize();
		Path dir = base.resolve(owner).normalize();
		if (!dir.getParent().equals(base)) {
			throw new IllegalArgumentException("Owner namespace can't be used as a directory name: \"" + owner + "\"");
		}
		return dir.resolve(settings.getFileName());
	}

	private List<String> ownerDirectoryNames() {
		List<String> result = new ArrayList<>();
		try (DirectoryStream<Path> dirs = Files.newDirectoryStream(settings.getBaseDirectory(), Files::isDirectory)) {
			for (Path dir: dirs) {
				if (Files.exists(dir.resolve(settings.getFileName()))) {
					result.add(dir.getFileName().toString());
				}
			}
		} catch (IOException e) {
			throw new BackendException("Unable to list " + settings.getBaseDirectory(), e);
		}
		return result;
	}

	@Override
	public String toString() {
		return "JsonFileDriver{" + instanceID() + ", " + settings.getBaseDirectory() + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileDriver.class);
}
