package works.stratum.redis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.StringNode;
import works.stratum.DriverFactory;
import works.stratum.Namespace;
import works.stratum.drivers.DocumentKey;
import works.stratum.drivers.DocumentStorageDriver;
import works.stratum.exceptions.BackendException;
import works.stratum.jackson.JsonCodec;

import static java.util.Objects.requireNonNull;

/**
 * Stores each owner namespace as one Redis hash, {@code <prefix>:<owner>}.
 * Each field of the hash is one category document; the field name is the JSON array
 * {@code [instanceId, category]} and the value is the document's JSON text.
 * <p>
 * Read-modify-write cycles use optimistic locking: the hash is {@code WATCH}ed,
 * the document read and modified, and the change applied with {@code MULTI}/{@code EXEC}.
 * If another client changed the hash meanwhile, the cycle starts over.
 */
public class RedisDriver extends DocumentStorageDriver {
	private final RedisDriverSettings settings;
	private final JsonCodec codec;
	private volatile JedisPool pool;

	/**
	 * Set while this thread is running a read-modify-write cycle.
	 */
	private final ThreadLocal<Cycle> currentCycle = new ThreadLocal<>();

	private static final class Cycle {
		final Jedis jedis;
		final List<Map.Entry<String, String>> writes = new ArrayList<>();
		final List<String> deletes = new ArrayList<>();

		Cycle(Jedis jedis) {
			this.jedis = jedis;
		}
	}

	public RedisDriver(RedisDriverSettings settings) {
		super("redis");
		this.settings = requireNonNull(settings);
		this.codec = requireNonNull(settings.getCodec());
		if (settings.getMaxOptimisticRetries() < 1) {
			throw new IllegalArgumentException("maxOptimisticRetries must be positive");
		}
	}

	public static DriverFactory factory(RedisDriverSettings settings) {
		return () -> new RedisDriver(settings);
	}

	@Override
	protected void doInitialize() {
		JedisPoolConfig poolConfig = new JedisPoolConfig();
		pool = new JedisPool(poolConfig,
			settings.getHost(),
			settings.getPort(),
			settings.getTimeoutMillis(),
			settings.getPassword(),
			settings.getDatabase());
		try (Jedis jedis = pool.getResource()) {
			jedis.ping();
		} catch (JedisException e) {
			pool.close();
			throw new BackendException("Unable to connect to Redis at " + settings.getHost() + ":" + settings.getPort(), e);
		}
		LOGGER.debug("Connected to Redis at {}:{} database {}", settings.getHost(), settings.getPort(), settings.getDatabase());
	}

	@Override
	protected void doClose() {
		JedisPool p = pool;
		if (p != null) {
			p.close();
		}
	}

	/**
	 * All documents for one owner share a hash, and {@code WATCH} works on whole keys.
	 */
	@Override
	protected Object lockKey(DocumentKey key) {
		return hashKey(key.namespace().ownerNamespace());
	}

	@Override
	protected <T> T atomically(DocumentKey key, Supplier<T> cycle) {
		String hashKey = hashKey(key.namespace().ownerNamespace());
		try (Jedis jedis = pool.getResource()) {
			for (int attempt = 1; attempt <= settings.getMaxOptimisticRetries(); attempt++) {
				Cycle c = new Cycle(jedis);
				jedis.watch(hashKey);
				T result;
				currentCycle.set(c);
				try {
					result = cycle.get();
				} catch (RuntimeException e) {
					jedis.unwatch();
					throw e;
				} finally {
					currentCycle.remove();
				}
				Transaction tx = jedis.multi();
				for (Map.Entry<String, String> write: c.writes) {
					tx.hset(hashKey, write.getKey(), write.getValue());
				}
				for (String field: c.deletes) {
					tx.hdel(hashKey, field);
				}
				List<Object> outcome = tx.exec();
				if (outcome != null) {
					return result;
				}
				LOGGER.debug("Concurrent change to {}; retrying (attempt {})", hashKey, attempt);
			}
		} catch (JedisException e) {
			throw new BackendException("Redis operation failed on " + key, e);
		}
		throw new BackendException("Gave up on " + key + " after " + settings.getMaxOptimisticRetries() + " attempts due to concurrent changes");
	}

	@Override
	protected @Nullable JsonNode loadDocument(DocumentKey key) {
		String hashKey = hashKey(key.namespace().ownerNamespace());
		String field = fieldName(key);
		Cycle c = currentCycle.get();
		String text;
		if (c == null) {
			text = redis(jedis -> jedis.hget(hashKey, field));
		} else {
			text = c.jedis.hget(hashKey, field);
		}
		return (text == null)? null : codec.read(text);
	}

	@Override
	protected void storeDocument(DocumentKey key, JsonNode document) {
		String field = fieldName(key);
		String text = codec.writeText(document);
		Cycle c = currentCycle.get();
		if (c == null) {
			redis(jedis -> jedis.hset(hashKey(key.namespace().ownerNamespace()), field, text));
		} else {
			c.deletes.remove(field);
			c.writes.add(Map.entry(field, text));
		}
	}

	@Override
	protected void deleteDocument(DocumentKey key) {
		String field = fieldName(key);
		Cycle c = currentCycle.get();
		if (c == null) {
			redis(jedis -> jedis.hdel(hashKey(key.namespace().ownerNamespace()), field));
		} else {
			c.writes.removeIf(w -> w.getKey().equals(field));
			c.deletes.add(field);
		}
	}

	@Override
	protected Set<String> categories(Namespace namespace) {
		Set<String> fields = redis(jedis -> jedis.hkeys(hashKey(namespace.ownerNamespace())));
		Set<String> result = new LinkedHashSet<>();
		for (String field: fields) {
			DocumentKey key = parseField(namespace.ownerNamespace(), field);
			if (key.namespace().equals(namespace)) {
				result.add(key.category());
			}
		}
		return result;
	}

	@Override
	protected void deleteAllDocuments() {
		List<String> keys = hashKeys().distinct().toList();
		if (!keys.isEmpty()) {
			redis(jedis -> jedis.del(keys.toArray(new String[0])));
		}
		LOGGER.debug("Deleted {} hashes", keys.size());
	}

	@Override
	protected Stream<Namespace> listNamespaces() {
		String prefix = settings.getKeyPrefix() + ":";
		return hashKeys()
			.flatMap(hashKey -> {
				String owner = hashKey.substring(prefix.length());
				Set<String> fields = redis(jedis -> jedis.hkeys(hashKey));
				return fields.stream().map(field -> parseField(owner, field).namespace());
			})
			.distinct();
	}

	/**
	 * SCANs for this driver's hashes one page at a time as the stream is consumed,
	 * borrowing a connection only for each page. A key may appear more than once.
	 */
	private Stream<String> hashKeys() {
		ScanParams params = new ScanParams().match(settings.getKeyPrefix() + ":*").count(100);
		return Stream.iterate(
				scanPage(ScanParams.SCAN_POINTER_START, params),
				Objects::nonNull,
				page -> ScanParams.SCAN_POINTER_START.equals(page.getCursor())? null : scanPage(page.getCursor(), params))
			.flatMap(page -> page.getResult().stream());
	}

	private ScanResult<String> scanPage(String cursor, ScanParams params) {
		return redis(jedis -> jedis.scan(cursor, params));
	}

	private String hashKey(String owner) {
		return settings.getKeyPrefix() + ":" + owner;
	}

	private String fieldName(DocumentKey key) {
		ArrayNode field = JsonNodeFactory.instance.arrayNode()
			.add(key.namespace().instanceId())
			.add(key.category());
		return codec.writeText(field);
	}

	private DocumentKey parseField(String owner, String field) {
		JsonNode parsed = codec.read(field);
		if (parsed.isArray() && parsed.size() == 2
			&& parsed.get(0) instanceof StringNode instanceId
			&& parsed.get(1) instanceof StringNode category) {
			return new DocumentKey(new Namespace(owner, instanceId.asString()), category.asString());
		}
		throw new BackendException("Unexpected field \"" + field + "\" in " + hashKey(owner));
	}

	private interface RedisAction<T> {
		T apply(Jedis jedis);
	}

	private <T> T redis(RedisAction<T> action) {
		try (Jedis jedis = pool.getResource()) {
			return action.apply(jedis);
		} catch (JedisException e) {
			throw new BackendException("Redis operation failed", e);
		}
	}

	@Override
	public String toString() {
		return "RedisDriver{" + instanceID() + ", " + settings.getHost() + ":" + settings.getPort() + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RedisDriver.class);
}
