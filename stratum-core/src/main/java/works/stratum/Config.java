package works.stratum;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.MissingNode;
import tools.jackson.databind.node.ObjectNode;
import works.stratum.drivers.JsonTree;

import static java.util.Objects.requireNonNull;

/**
 * The view of the store belonging to one owner namespace and instance.
 * <p>
 * Drivers know nothing about defaults. A {@code Config} remembers the defaults its owner
 * registers, per category, and {@link ConfigValue#get()} falls back to them when the
 * driver has nothing stored.
 * <p>
 * Defaults for a category are an object addressed by identifiers alone;
 * they apply equally to every primary key in the category.
 */
public final class Config {
	private final StorageDriver driver;
	private final Namespace namespace;
	private final ObjectMapper mapper;
	private final Map<String, ObjectNode> defaults = new ConcurrentHashMap<>();
	private volatile CategoryRegistry registry;

	private Config(StorageDriver driver, Namespace namespace, CategoryRegistry registry, ObjectMapper mapper) {
		this.driver = requireNonNull(driver);
		this.namespace = requireNonNull(namespace);
		this.registry = requireNonNull(registry);
		this.mapper = requireNonNull(mapper);
	}

	public static Config forOwner(StorageDriver driver, String ownerNamespace, String instanceId) {
		return new Config(driver, new Namespace(ownerNamespace, instanceId), CategoryRegistry.builtIn(), JsonMapper.builder().build());
	}

	public static Config forOwner(StorageDriver driver, Namespace namespace, CategoryRegistry registry, ObjectMapper mapper) {
		return new Config(driver, namespace, registry, mapper);
	}

	public StorageDriver driver() {
		return driver;
	}

	public Namespace namespace() {
		return namespace;
	}

	public CategoryRegistry registry() {
		return registry;
	}

	ObjectMapper mapper() {
		return mapper;
	}

	/**
	 * Merges {@code newDefaults} into the defaults already registered for the category.
	 * Where both have a value, the new one wins.
	 *
	 * @throws IllegalArgumentException if the category is unknown
	 */
	public void registerDefaults(String category, ObjectNode newDefaults) {
		registry.lookup(category);
		defaults.merge(category, newDefaults.deepCopy(), (existing, added) -> merge(existing.deepCopy(), added));
	}

	public void registerGlobal(ObjectNode newDefaults) {
		registerDefaults(ConfigCategory.GLOBAL.name(), newDefaults);
	}

	/**
	 * Makes a custom group available for {@link #value} and {@link #registerDefaults}.
	 */
	public synchronized void registerCustomGroup(String name, int primaryKeyLength) {
		registry = registry.withCustomGroup(name, primaryKeyLength);
	}

	public ConfigValue global(String... identifiers) {
		return value(ConfigCategory.GLOBAL.name(), List.of(), identifiers);
	}

	/**
	 * @param primaryKey may be shorter than the category's primary key length,
	 * in which case the value is a group of entities
	 */
	public ConfigValue value(String category, List<String> primaryKey, String... identifiers) {
		CategoryInfo info = registry.lookup(category);
		IdentifierData identifier = IdentifierData.of(
			namespace.ownerNamespace(),
			namespace.instanceId(),
			category,
			primaryKey,
			List.of(identifiers),
			info.primaryKeyLength(),
			info.isCustom());
		return new ConfigValue(this, identifier);
	}

	/**
	 * @return the registered default, or {@link MissingNode} if there is none.
	 * The caller may modify the result.
	 */
	public JsonNode defaultValue(String category, List<String> identifiers) {
		ObjectNode categoryDefaults = defaults.get(category);
		JsonNode result = JsonTree.find(categoryDefaults, identifiers);
		if (result == null) {
			return MissingNode.getInstance();
		}
		return result.deepCopy();
	}

	/**
	 * Removes everything this owner and instance have stored. Defaults remain registered.
	 */
	public void clearAll() {
		driver.clear(IdentifierData.forNamespace(namespace));
	}

	public void clearCategory(String category) {
		driver.clear(IdentifierData.forCategory(namespace, category, registry));
	}

	private static ObjectNode merge(ObjectNode target, ObjectNode source) {
		for (Map.Entry<String, JsonNode> entry: source.properties()) {
			JsonNode existing = target.get(entry.getKey());
			if (existing instanceof ObjectNode existingObject && entry.getValue() instanceof ObjectNode sourceObject) {
				merge(existingObject, sourceObject);
			} else {
				target.set(entry.getKey(), entry.getValue().deepCopy());
			}
		}
		return target;
	}

	@Override
	public String toString() {
		return "Config{" + namespace + " on " + driver + "}";
	}
}
