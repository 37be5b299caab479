package works.stratum.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import tools.jackson.databind.JsonNode;
import works.stratum.CategoryData;
import works.stratum.CategoryRegistry;
import works.stratum.DriverFactory;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.drivers.AbstractStorageDriver;
import works.stratum.drivers.ForwardingDriver;
import works.stratum.exceptions.NotFoundException;
import works.stratum.logging.MappedDiagnosticContext.MDCScope;
import works.stratum.logging.MdcKeys;
import works.stratum.migration.MigrationReport;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.stratum.logging.MappedDiagnosticContext.setupMDC;
import static works.stratum.logging.MdcKeys.DRIVER_INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-driver logging control.
 * Intended to suppress expected warnings and errors during testing.
 * <p>
 * A driver built with {@link #withController} will be able to set log levels using
 * {@link LogController#setLogging} without affecting other logs.
 * <p>
 * This class infers that a log message is associated with a particular driver
 * by checking the MDC for the key {@link MdcKeys#DRIVER_INSTANCE_ID},
 * which {@link AbstractStorageDriver} sets around every operation.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the log is associated with a driver that has a controller,
 *         and that controller has an override for that specific logger, that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply, which means
 *         that the logger inherits the level from its ancestors.
 *     </li>
 * </ol>
 */
public class StratumLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByDriverID = new ConcurrentHashMap<>();
	private static final AtomicLong CONTROLLED_COUNTER = new AtomicLong(0);

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// We'd like to use SLF4J's "Level" but that doesn't support OFF
		public void setLogging(Level level, Class<?>... loggers) {
			// Put them all in one atomic operation
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), n -> level)));
		}
	}

	public static void register(String driverInstanceID, LogController controller) {
		LogController old = controllersByDriverID.put(driverInstanceID, controller);
		assert old == null || old == controller: "Must not create two log controllers for the same driver: " + driverInstanceID;
	}

	public static void unregister(String driverInstanceID) {
		controllersByDriverID.remove(driverInstanceID);
	}

	/**
	 * Wraps each driver built by {@code downstream} so that the given {@code controller}
	 * governs the logs emitted during its operations, including those of the
	 * wrapped driver itself when it's an {@link AbstractStorageDriver}.
	 * The registrations end when the driver is closed.
	 */
	public static DriverFactory withController(LogController controller, DriverFactory downstream) {
		return () -> {
			StorageDriver driver = downstream.build();
			String id = "controlled-" + CONTROLLED_COUNTER.incrementAndGet();
			@Nullable String downstreamID = (driver instanceof AbstractStorageDriver a)? a.instanceID() : null;
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("Registering controller {} for {} and {}", System.identityHashCode(controller), id, downstreamID);
			}
			register(id, controller);
			if (downstreamID != null) {
				register(downstreamID, controller);
			}
			return new ControlledDriver(driver, id, downstreamID);
		};
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Respect user-supplied log levels
			return NEUTRAL;
		}
		String driverID = MDC.get(DRIVER_INSTANCE_ID);
		if (driverID == null) {
			return NEUTRAL;
		}
		var controller = controllersByDriverID.get(driverID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}

		// There is an override. Deny if the message's level is too low.
		if (overrideLevel.isGreaterOrEqual(messageLevel)) {
			return DENY;
		} else {
			return NEUTRAL;
		}
	}

	/**
	 * Runs every operation inside its own MDC scope, so that logs emitted by callers
	 * of {@link #set} (such as a bulk import) are attributed to this driver.
	 */
	private static final class ControlledDriver extends ForwardingDriver {
		private final String id;
		private final @Nullable String downstreamID;

		ControlledDriver(StorageDriver downstream, String id, @Nullable String downstreamID) {
			super(downstream);
			this.id = id;
			this.downstreamID = downstreamID;
		}

		private MDCScope scope() {
			return setupMDC("controlled", id);
		}

		@Override
		public void initialize() {
			try (MDCScope ignored = scope()) {
				super.initialize();
			}
		}

		@Override
		public void close() {
			try (MDCScope ignored = scope()) {
				super.close();
			} finally {
				unregister(id);
				if (downstreamID != null) {
					unregister(downstreamID);
				}
			}
		}

		@Override
		public JsonNode get(IdentifierData identifier) throws NotFoundException {
			try (MDCScope ignored = scope()) {
				return super.get(identifier);
			}
		}

		@Override
		public JsonNode set(IdentifierData identifier, JsonNode value) {
			try (MDCScope ignored = scope()) {
				return super.set(identifier, value);
			}
		}

		@Override
		public void clear(IdentifierData identifier) {
			try (MDCScope ignored = scope()) {
				super.clear(identifier);
			}
		}

		@Override
		public Number increment(IdentifierData identifier, Number delta, Number defaultValue) {
			try (MDCScope ignored = scope()) {
				return super.increment(identifier, delta, defaultValue);
			}
		}

		@Override
		public boolean toggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue) {
			try (MDCScope ignored = scope()) {
				return super.toggle(identifier, value, defaultValue);
			}
		}

		@Override
		public MigrationReport importData(Namespace namespace, Iterable<CategoryData> data, CategoryRegistry registry) {
			try (MDCScope ignored = scope()) {
				return super.importData(namespace, data, registry);
			}
		}

		@Override
		public void deleteAllData(boolean confirmed) {
			try (MDCScope ignored = scope()) {
				super.deleteAllData(confirmed);
			}
		}

		@Override
		public Stream<Namespace> namespaces() {
			try (MDCScope ignored = scope()) {
				return super.namespaces();
			}
		}

		@Override
		public String toString() {
			return "ControlledDriver{" + id + ", " + downstream + "}";
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(StratumLogFilter.class);
}
