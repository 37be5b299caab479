package works.stratum.sql;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.stratum.Namespace;
import works.stratum.drivers.DocumentKey;
import works.stratum.drivers.DocumentStorageDriver;
import works.stratum.exceptions.BackendException;
import works.stratum.jackson.JsonCodec;

import static java.util.Objects.requireNonNull;
import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.primaryKey;
import static org.jooq.impl.DSL.table;
import static org.jooq.impl.DSL.using;

/**
 * Each read-modify-write cycle runs in its own transaction.
 * Where the database supports it, the row is read with {@code SELECT ... FOR UPDATE}
 * so that concurrent cycles from other processes wait their turn.
 * A row that doesn't exist yet can't be locked that way; two processes creating the
 * same document at the same moment resolve to whichever upsert commits last.
 */
class SqlDriverImpl extends DocumentStorageDriver implements SqlDriver {
	private final SqlDriverSettings settings;
	private final ConnectionSource connectionSource;
	private final Runnable onClose;
	private final JsonCodec codec;

	/**
	 * The connection of the transaction this thread is running, if any.
	 */
	private final ThreadLocal<Connection> currentTransaction = new ThreadLocal<>();

	// jOOQ references
	private final Table<Record> CONFIG;
	private final Field<String> OWNER_NAMESPACE;
	private final Field<String> INSTANCE_ID;
	private final Field<String> CATEGORY;
	private final Field<String> JSON_DATA;

	private static final Set<SQLDialect> SUPPORTS_FOR_UPDATE = EnumSet.of(
		SQLDialect.POSTGRES, SQLDialect.MYSQL, SQLDialect.MARIADB, SQLDialect.H2
	);

	SqlDriverImpl(SqlDriverSettings settings, ConnectionSource cs, Runnable onClose) {
		super("sql");
		this.settings = requireNonNull(settings);
		this.onClose = requireNonNull(onClose);
		this.codec = requireNonNull(settings.getCodec());
		requireNonNull(cs);
		this.connectionSource = () -> {
			Connection result = cs.get();
			// autoCommit is an idiotic default
			result.setAutoCommit(false);
			return result;
		};

		CONFIG = table(name(settings.getTableName()));
		OWNER_NAMESPACE = field(name("owner_namespace"), SQLDataType.VARCHAR(255).nullable(false));
		INSTANCE_ID = field(name("instance_id"), SQLDataType.VARCHAR(255).nullable(false));
		CATEGORY = field(name("category"), SQLDataType.VARCHAR(255).nullable(false));
		JSON_DATA = field(name("json_data"), SQLDataType.CLOB.nullable(false));
	}

	@Override
	protected void doInitialize() {
		withConnection(c -> {
			dsl(c)
				.createTableIfNotExists(CONFIG)
				.columns(OWNER_NAMESPACE, INSTANCE_ID, CATEGORY, JSON_DATA)
				.constraints(primaryKey(OWNER_NAMESPACE, INSTANCE_ID, CATEGORY))
				.execute();
			return null;
		});
		LOGGER.debug("Using table {} with codec {}", settings.getTableName(), codec.name());
	}

	@Override
	protected void doClose() {
		onClose.run();
	}

	@Override
	protected <T> T atomically(DocumentKey key, Supplier<T> cycle) {
		if (currentTransaction.get() != null) {
			throw new IllegalStateException("Nested transaction on " + key);
		}
		try (Connection c = connectionSource.get()) {
			currentTransaction.set(c);
			try {
				T result = cycle.get();
				c.commit();
				return result;
			} catch (RuntimeException e) {
				rollback(c, e);
				throw e;
			} finally {
				currentTransaction.remove();
			}
		} catch (SQLException | DataAccessException e) {
			throw new BackendException("Transaction failed on " + key, e);
		}
	}

	@Override
	protected @Nullable JsonNode loadDocument(DocumentKey key) {
		String text = withConnection(c -> {
			DSLContext dsl = dsl(c);
			var query = dsl
				.select(JSON_DATA)
				.from(CONFIG)
				.where(matches(key));
			if (currentTransaction.get() == c && SUPPORTS_FOR_UPDATE.contains(dsl.dialect().family())) {
				return query.forUpdate().fetchOne(JSON_DATA);
			} else {
				return query.fetchOne(JSON_DATA);
			}
		});
		return (text == null)? null : codec.read(text);
	}

	@Override
	protected void storeDocument(DocumentKey key, JsonNode document) {
		String text = codec.writeText(document);
		withConnection(c -> dsl(c)
			.insertInto(CONFIG)
			.columns(OWNER_NAMESPACE, INSTANCE_ID, CATEGORY, JSON_DATA)
			.values(key.namespace().ownerNamespace(), key.namespace().instanceId(), key.category(), text)
			.onConflict(OWNER_NAMESPACE, INSTANCE_ID, CATEGORY)
			.doUpdate()
			.set(JSON_DATA, text)
			.execute());
	}

	@Override
	protected void deleteDocument(DocumentKey key) {
		withConnection(c -> dsl(c)
			.deleteFrom(CONFIG)
			.where(matches(key))
			.execute());
	}

	@Override
	protected Set<String> categories(Namespace namespace) {
		List<String> rows = withConnection(c -> dsl(c)
			.select(CATEGORY)
			.from(CONFIG)
			.where(OWNER_NAMESPACE.eq(namespace.ownerNamespace()))
			.and(INSTANCE_ID.eq(namespace.instanceId()))
			.orderBy(CATEGORY)
			.fetch(CATEGORY));
		return new LinkedHashSet<>(rows);
	}

	@Override
	protected void deleteAllDocuments() {
		int count = withConnection(c -> dsl(c).deleteFrom(CONFIG).execute());
		LOGGER.debug("Deleted {} rows from {}", count, settings.getTableName());
	}

	@Override
	protected Stream<Namespace> listNamespaces() {
		// Fetched eagerly so the connection returns to the pool before the caller iterates
		List<Namespace> result = withConnection(c -> dsl(c)
			.selectDistinct(OWNER_NAMESPACE, INSTANCE_ID)
			.from(CONFIG)
			.fetch(r -> new Namespace(r.get(OWNER_NAMESPACE), r.get(INSTANCE_ID))));
		return result.stream();
	}

	private Condition matches(DocumentKey key) {
		return OWNER_NAMESPACE.eq(key.namespace().ownerNamespace())
			.and(INSTANCE_ID.eq(key.namespace().instanceId()))
			.and(CATEGORY.eq(key.category()));
	}

	private DSLContext dsl(Connection c) {
		SQLDialect dialect = settings.getDialect();
		return (dialect == null)? using(c) : using(c, dialect);
	}

	/**
	 * Runs {@code action} in the current transaction if there is one;
	 * otherwise in a short transaction of its own.
	 */
	private <T> T withConnection(Function<Connection, T> action) {
		Connection current = currentTransaction.get();
		if (current != null) {
			try {
				return action.apply(current);
			} catch (DataAccessException e) {
				throw new BackendException("Database operation failed", e);
			}
		}
		try (Connection c = connectionSource.get()) {
			try {
				T result = action.apply(c);
				c.commit();
				return result;
			} catch (RuntimeException e) {
				rollback(c, e);
				throw e;
			}
		} catch (SQLException | DataAccessException e) {
			throw new BackendException("Database operation failed", e);
		}
	}

	private static void rollback(Connection c, Exception cause) {
		try {
			c.rollback();
		} catch (SQLException e) {
			cause.addSuppressed(e);
		}
	}

	@Override
	public String toString() {
		return "SqlDriver{" + instanceID() + ", " + settings.getTableName() + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlDriverImpl.class);
}
