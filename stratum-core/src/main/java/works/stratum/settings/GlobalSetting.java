package works.stratum.settings;

import org.jetbrains.annotations.Nullable;
import works.stratum.Config;
import works.stratum.ConfigValue;

/**
 * A setting with a single value for the whole application, whatever the entity.
 */
public class GlobalSetting<E, T> extends CachingSetting<E, T> {
	private final ConfigValue value;
	private final Class<T> type;

	public GlobalSetting(Config config, Class<T> type, boolean cachingEnabled, String... identifiers) {
		super(String.join(".", identifiers), cachingEnabled);
		this.value = config.global(identifiers);
		this.type = type;
	}

	public @Nullable T getGlobal() {
		return get(ContextKey.global());
	}

	/**
	 * @param newValue null means revert to the default
	 */
	public void setGlobal(@Nullable T newValue) {
		if (newValue == null) {
			reset(ContextKey.global());
		} else {
			set(ContextKey.global(), newValue);
		}
	}

	@Override
	protected ContextKey contextOf(E entity) {
		return ContextKey.global();
	}

	@Override
	protected @Nullable T read(ContextKey key) {
		return value.get(type);
	}

	@Override
	protected void write(ContextKey key, T newValue) {
		value.set(newValue);
	}

	@Override
	protected void erase(ContextKey key) {
		value.clear();
	}

	@Override
	protected @Nullable T defaultValue(ContextKey key) {
		return value.defaultValue(type);
	}
}
