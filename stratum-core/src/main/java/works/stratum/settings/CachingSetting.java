package works.stratum.settings;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps an in-process copy of one setting, per {@link ContextKey}, in front of the store.
 * <p>
 * Reads are served from the cache when possible; writes go to the store first and
 * update the cache only once the store has accepted them, so a failed write leaves
 * the cache as it was.
 * <p>
 * Each key has a generation that every write or invalidation advances.
 * A read caches its result only if the key's generation hasn't moved since the read began,
 * so a value read before a concurrent write can't overwrite the written one.
 * <p>
 * With caching disabled, every call goes to the store and nothing is remembered.
 * Callers can't otherwise tell the difference.
 *
 * @param <E> the kind of entity the application has in hand when it asks for the setting
 * @param <T> the setting's value type. Null values are allowed.
 */
public abstract class CachingSetting<E, T> {
	private final String name;
	private final boolean cachingEnabled;
	private final ConcurrentHashMap<ContextKey, Optional<T>> cache = new ConcurrentHashMap<>();

	/**
	 * Updates to {@link #cache} happen inside {@code compute} calls on this map,
	 * which serializes them per key.
	 */
	private final ConcurrentHashMap<ContextKey, Long> generations = new ConcurrentHashMap<>();

	protected CachingSetting(String name, boolean cachingEnabled) {
		this.name = name;
		this.cachingEnabled = cachingEnabled;
	}

	/**
	 * @return the key under which {@code entity}'s value is stored
	 */
	protected abstract ContextKey contextOf(E entity);

	/**
	 * Reads the value from the store, falling back to the default.
	 */
	protected abstract @Nullable T read(ContextKey key);

	protected abstract void write(ContextKey key, T value);

	/**
	 * Removes the stored value so the default applies again.
	 */
	protected abstract void erase(ContextKey key);

	/**
	 * @return the value that applies when nothing is stored, known without asking the store
	 */
	protected abstract @Nullable T defaultValue(ContextKey key);

	public final String name() {
		return name;
	}

	public final boolean cachingEnabled() {
		return cachingEnabled;
	}

	public @Nullable T get(ContextKey key) {
		if (!cachingEnabled) {
			LOGGER.trace("{}: reading {}", name, key);
			return read(key);
		}
		Optional<T> cached = cache.get(key);
		if (cached != null) {
			return cached.orElse(null);
		}
		long generation = generations.computeIfAbsent(key, k -> 0L);
		LOGGER.trace("{}: reading {}", name, key);
		T result = read(key);
		generations.compute(key, (k, current) -> {
			if (current != null && current == generation) {
				cache.put(key, Optional.ofNullable(result));
			} else {
				LOGGER.debug("{}: {} changed during read; not caching", name, key);
			}
			return current;
		});
		return result;
	}

	public void set(ContextKey key, T value) {
		write(key, value);
		advance(key, () -> cache.put(key, Optional.ofNullable(value)));
	}

	/**
	 * Reverts to the default, which is then cached without reading it back from the store.
	 */
	public void reset(ContextKey key) {
		erase(key);
		T value = defaultValue(key);
		advance(key, () -> cache.put(key, Optional.ofNullable(value)));
	}

	public @Nullable T getContextValue(E entity) {
		return get(contextOf(entity));
	}

	/**
	 * The next {@link #get} for this key will read from the store.
	 */
	public void invalidate(ContextKey key) {
		advance(key, () -> cache.remove(key));
	}

	public void invalidateAll() {
		generations.replaceAll((key, generation) -> generation + 1);
		cache.clear();
	}

	/**
	 * Runs {@code cacheUpdate} while advancing the key's generation.
	 */
	private void advance(ContextKey key, Runnable cacheUpdate) {
		if (!cachingEnabled) {
			return;
		}
		generations.compute(key, (k, generation) -> {
			cacheUpdate.run();
			return (generation == null)? 1L : generation + 1;
		});
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + name + (cachingEnabled? "" : ", uncached") + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CachingSetting.class);
}
