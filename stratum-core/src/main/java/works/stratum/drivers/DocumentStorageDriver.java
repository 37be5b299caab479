package works.stratum.drivers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.exceptions.BackendException;
import works.stratum.exceptions.NotFoundException;
import works.stratum.exceptions.TypeMismatchException;

/**
 * Base class for backends that store one JSON document per {@link DocumentKey},
 * meaning per category of each namespace.
 * <p>
 * Every operation is expressed in terms of loading, storing and deleting whole documents.
 * Modifications are read-modify-write cycles performed while holding an exclusive lock
 * on the document's {@link #lockKey lock key}, so operations from this process
 * on the same document never lose each other's updates.
 * Backends whose storage is shared between processes extend that guarantee
 * by overriding {@link #atomically}.
 */
public abstract class DocumentStorageDriver extends AbstractStorageDriver {
	private final KeyedLocks<Object> locks = new KeyedLocks<>();

	protected DocumentStorageDriver(String driverName) {
		super(driverName);
	}

	/**
	 * @return the current document, or null if there is none.
	 * The caller is free to modify the returned object.
	 */
	protected abstract @Nullable JsonNode loadDocument(DocumentKey key);

	/**
	 * @param document now belongs to the driver; the caller won't modify it
	 */
	protected abstract void storeDocument(DocumentKey key, JsonNode document);

	/**
	 * Does nothing if the document doesn't exist.
	 */
	protected abstract void deleteDocument(DocumentKey key);

	/**
	 * @return the categories that have documents in the given namespace
	 */
	protected abstract Set<String> categories(Namespace namespace);

	protected abstract void deleteAllDocuments();

	protected abstract Stream<Namespace> listNamespaces();

	/**
	 * Documents with equal lock keys are never modified concurrently.
	 * The default is one lock per document; subclasses that store several documents
	 * together (say, in one file) can coarsen that.
	 */
	protected Object lockKey(DocumentKey key) {
		return key;
	}

	/**
	 * Runs one read-modify-write cycle on a document.
	 * Called while holding the lock for the document's {@link #lockKey}.
	 * <p>
	 * The default simply runs {@code cycle}. Backends shared between processes
	 * override this to make the cycle atomic with respect to other processes too,
	 * for example with a database transaction.
	 * Overrides may run {@code cycle} more than once if an attempt has to be abandoned.
	 */
	protected <T> T atomically(DocumentKey key, Supplier<T> cycle) {
		return cycle.get();
	}

	private <T> T modify(DocumentKey key, Supplier<T> cycle) {
		try (var held = locks.lock(lockKey(key))) {
			return atomically(key, cycle);
		}
	}

	@Override
	protected JsonNode doGet(IdentifierData identifier) throws NotFoundException {
		if (identifier.isWholeNamespace()) {
			ObjectNode result = JsonNodeFactory.instance.objectNode();
			for (String category: categories(identifier.namespace())) {
				JsonNode document = loadDocument(new DocumentKey(identifier.namespace(), category));
				if (document != null) {
					result.set(category, document);
				}
			}
			if (result.isEmpty()) {
				throw new NotFoundException(identifier);
			}
			return result;
		}
		JsonNode result = JsonTree.find(loadDocument(DocumentKey.of(identifier)), identifier.documentPath());
		if (result == null) {
			throw new NotFoundException(identifier);
		}
		return result;
	}

	@Override
	protected JsonNode doSet(IdentifierData identifier, JsonNode value) {
		if (identifier.isWholeNamespace()) {
			if (!value.isObject()) {
				throw new IllegalArgumentException("The contents of a whole namespace must be an object of categories; got " + value.getNodeType());
			}
			doClear(identifier);
			for (Map.Entry<String, JsonNode> entry: value.properties()) {
				DocumentKey key = new DocumentKey(identifier.namespace(), entry.getKey());
				JsonNode document = entry.getValue().deepCopy();
				modify(key, () -> {
					storeDocument(key, document);
					return null;
				});
			}
			return value.deepCopy();
		}
		DocumentKey key = DocumentKey.of(identifier);
		modify(key, () -> {
			JsonNode document = loadDocument(key);
			storeDocument(key, JsonTree.put(document, identifier.documentPath(), value.deepCopy()));
			return null;
		});
		return value.deepCopy();
	}

	@Override
	protected void doClear(IdentifierData identifier) {
		if (identifier.isWholeNamespace()) {
			for (String category: categories(identifier.namespace())) {
				DocumentKey key = new DocumentKey(identifier.namespace(), category);
				modify(key, () -> {
					deleteDocument(key);
					return null;
				});
			}
			return;
		}
		DocumentKey key = DocumentKey.of(identifier);
		modify(key, () -> {
			JsonNode document = loadDocument(key);
			if (document == null) {
				return null;
			}
			JsonNode remaining = JsonTree.remove(document, identifier.documentPath());
			if (remaining == null) {
				deleteDocument(key);
			} else {
				storeDocument(key, remaining);
			}
			return null;
		});
	}

	@Override
	protected Number doIncrement(IdentifierData identifier, Number delta, Number defaultValue) {
		DocumentKey key = documentKeyForUpdate(identifier);
		return modify(key, () -> {
			JsonNode document = loadDocument(key);
			JsonNode existing = JsonTree.find(document, identifier.documentPath());
			Number base;
			if (existing == null) {
				base = defaultValue;
			} else if (existing.isNumber()) {
				base = existing.numberValue();
			} else {
				throw new TypeMismatchException(identifier, "a number", existing);
			}
			Number result;
			try {
				result = add(base, delta);
			} catch (ArithmeticException e) {
				throw new BackendException("Increment of " + identifier + " overflows a long", e);
			}
			storeDocument(key, JsonTree.put(document, identifier.documentPath(), numberNode(result)));
			return result;
		});
	}

	@Override
	protected boolean doToggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue) {
		DocumentKey key = documentKeyForUpdate(identifier);
		return modify(key, () -> {
			JsonNode document = loadDocument(key);
			JsonNode existing = JsonTree.find(document, identifier.documentPath());
			if (existing != null && !existing.isBoolean()) {
				throw new TypeMismatchException(identifier, "a boolean", existing);
			}
			boolean result;
			if (value != null) {
				result = value;
			} else if (existing != null) {
				result = !existing.booleanValue();
			} else {
				result = !Boolean.TRUE.equals(defaultValue);
			}
			storeDocument(key, JsonTree.put(document, identifier.documentPath(), JsonNodeFactory.instance.booleanNode(result)));
			return result;
		});
	}

	@Override
	protected void doDeleteAllData() {
		deleteAllDocuments();
	}

	@Override
	protected Stream<Namespace> doNamespaces() {
		return listNamespaces();
	}

	private static DocumentKey documentKeyForUpdate(IdentifierData identifier) {
		if (identifier.isWholeNamespace()) {
			throw new IllegalArgumentException("Can't update a whole namespace as a scalar: " + identifier);
		}
		return DocumentKey.of(identifier);
	}

	/**
	 * Integral plus integral stays integral; anything else becomes a double.
	 *
	 * @throws ArithmeticException if an integral sum doesn't fit in a long
	 */
	static Number add(Number a, Number b) {
		if (isIntegral(a) && isIntegral(b)) {
			return Math.addExact(a.longValue(), b.longValue());
		} else {
			return a.doubleValue() + b.doubleValue();
		}
	}

	private static boolean isIntegral(Number n) {
		return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
			|| (n instanceof BigInteger big && big.bitLength() < Long.SIZE);
	}

	/**
	 * Uses the smallest node type that holds the value, matching what a JSON parser produces,
	 * so a stored number equals the same number read back from text.
	 */
	public static JsonNode numberNode(Number n) {
		if (n instanceof Double || n instanceof Float || n instanceof BigDecimal) {
			return JsonNodeFactory.instance.numberNode(n.doubleValue());
		}
		long value = n.longValue();
		if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
			return JsonNodeFactory.instance.numberNode((int) value);
		} else {
			return JsonNodeFactory.instance.numberNode(value);
		}
	}
}
