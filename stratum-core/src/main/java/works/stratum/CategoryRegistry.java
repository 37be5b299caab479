package works.stratum;

import java.util.Map;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

import static java.util.Objects.requireNonNull;

/**
 * Maps category names to their {@link CategoryInfo}.
 * <p>
 * Always contains the built-in {@link ConfigCategory categories};
 * custom groups are added with {@link #withCustomGroup}, which returns a new registry.
 */
public final class CategoryRegistry {
	private final PMap<String, CategoryInfo> categories;

	private CategoryRegistry(PMap<String, CategoryInfo> categories) {
		this.categories = categories;
	}

	public static CategoryRegistry builtIn() {
		return BUILT_IN;
	}

	/**
	 * @param customGroups map from custom group name to its primary key length
	 */
	public static CategoryRegistry withCustomGroups(Map<String, Integer> customGroups) {
		CategoryRegistry result = BUILT_IN;
		for (var entry: customGroups.entrySet()) {
			result = result.withCustomGroup(entry.getKey(), entry.getValue());
		}
		return result;
	}

	public CategoryRegistry withCustomGroup(String name, int primaryKeyLength) {
		requireNonNull(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Custom group name can't be empty");
		}
		CategoryInfo existing = categories.get(name);
		if (existing != null && !existing.isCustom()) {
			throw new IllegalArgumentException("Custom group can't replace built-in category " + name);
		}
		return new CategoryRegistry(categories.plus(name, new CategoryInfo(primaryKeyLength, true)));
	}

	/**
	 * @throws IllegalArgumentException if the category is not registered
	 */
	public CategoryInfo lookup(String category) {
		CategoryInfo result = categories.get(category);
		if (result == null) {
			throw new IllegalArgumentException("Unknown category \"" + category + "\"");
		}
		return result;
	}

	public boolean contains(String category) {
		return categories.containsKey(category);
	}

	public Map<String, CategoryInfo> asMap() {
		return categories;
	}

	@Override
	public String toString() {
		return "CategoryRegistry" + categories;
	}

	private static final CategoryRegistry BUILT_IN;

	static {
		PMap<String, CategoryInfo> map = HashTreePMap.empty();
		for (ConfigCategory c: ConfigCategory.values()) {
			map = map.plus(c.name(), c.info());
		}
		BUILT_IN = new CategoryRegistry(map);
	}
}
