package works.stratum.drivers;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A set of exclusive locks, one per key, created on demand
 * and discarded when nobody holds or awaits them.
 *
 * <pre>
 * try (var held = locks.lock(key)) {
 *     // read-modify-write
 * }
 * </pre>
 */
public final class KeyedLocks<K> {
	private final ConcurrentHashMap<K, Entry> entries = new ConcurrentHashMap<>();

	private static final class Entry {
		final ReentrantLock lock = new ReentrantLock();
		int users; // Only modified inside ConcurrentHashMap.compute, which is atomic per key
	}

	public Held lock(K key) {
		Entry entry = entries.compute(key, (k, existing) -> {
			Entry result = (existing == null)? new Entry() : existing;
			result.users++;
			return result;
		});
		entry.lock.lock();
		return new Held(key, entry);
	}

	/**
	 * @return the number of keys currently locked or awaited
	 */
	int activeKeys() {
		return entries.size();
	}

	public final class Held implements AutoCloseable {
		private final K key;
		private final Entry entry;
		private boolean released = false;

		private Held(K key, Entry entry) {
			this.key = key;
			this.entry = entry;
		}

		@Override
		public void close() {
			if (released) {
				return;
			}
			released = true;
			entry.lock.unlock();
			entries.computeIfPresent(key, (k, e) -> (--e.users == 0)? null : e);
		}
	}
}
