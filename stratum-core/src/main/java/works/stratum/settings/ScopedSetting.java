package works.stratum.settings;

import java.util.List;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import works.stratum.Config;
import works.stratum.ConfigValue;

import static java.util.Objects.requireNonNull;

/**
 * A setting with one value per entity of a category whose primary key has one segment,
 * such as a guild or a user.
 */
public class ScopedSetting<E, T> extends CachingSetting<E, T> {
	private final Config config;
	private final String category;
	private final Function<? super E, String> idOf;
	private final Class<T> type;
	private final String[] identifiers;

	/**
	 * @param idOf returns the entity's primary key within {@code category}
	 */
	public ScopedSetting(Config config, String category, Function<? super E, String> idOf, Class<T> type, boolean cachingEnabled, String... identifiers) {
		super(category + ":" + String.join(".", identifiers), cachingEnabled);
		int primaryKeyLength = config.registry().lookup(category).primaryKeyLength();
		if (primaryKeyLength != 1) {
			throw new IllegalArgumentException("Scoped settings need a category with one primary key segment; " + category + " has " + primaryKeyLength);
		}
		this.config = config;
		this.category = category;
		this.idOf = requireNonNull(idOf);
		this.type = requireNonNull(type);
		this.identifiers = identifiers.clone();
	}

	/**
	 * @param newValue null means revert to the default
	 */
	public void setFor(E entity, @Nullable T newValue) {
		ContextKey key = contextOf(entity);
		if (newValue == null) {
			reset(key);
		} else {
			set(key, newValue);
		}
	}

	@Override
	protected ContextKey contextOf(E entity) {
		return ContextKey.scoped(category, idOf.apply(entity));
	}

	@Override
	protected @Nullable T read(ContextKey key) {
		return valueFor(key).get(type);
	}

	@Override
	protected void write(ContextKey key, T newValue) {
		valueFor(key).set(newValue);
	}

	@Override
	protected void erase(ContextKey key) {
		valueFor(key).clear();
	}

	@Override
	protected @Nullable T defaultValue(ContextKey key) {
		return valueFor(key).defaultValue(type);
	}

	private ConfigValue valueFor(ContextKey key) {
		if (key instanceof ContextKey.Scoped scoped && scoped.scope().equals(category)) {
			return config.value(category, List.of(scoped.id()), identifiers);
		}
		throw new IllegalArgumentException("Setting " + name() + " has no value for " + key);
	}
}
