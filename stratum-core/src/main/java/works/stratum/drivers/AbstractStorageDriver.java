package works.stratum.drivers;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.exceptions.ConfirmationRequiredException;
import works.stratum.exceptions.DriverStateException;
import works.stratum.exceptions.NotFoundException;
import works.stratum.logging.MappedDiagnosticContext.MDCScope;

import static java.util.Objects.requireNonNull;
import static works.stratum.logging.MappedDiagnosticContext.setupMDC;

/**
 * Handles the parts of {@link StorageDriver} that don't depend on the backend:
 * the initialize/close lifecycle, argument checking, the confirmation check for
 * {@link #deleteAllData}, and setting up the logging MDC around each operation.
 * <p>
 * Subclasses implement the {@code do*} methods, which are only ever called
 * while the driver is open.
 */
public abstract class AbstractStorageDriver implements StorageDriver {
	private final String driverName;
	private final String instanceID;
	private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

	private enum State { NEW, INITIALIZING, OPEN, CLOSED }

	protected AbstractStorageDriver(String driverName) {
		this.driverName = requireNonNull(driverName);
		this.instanceID = driverName + "-" + INSTANCE_COUNTER.incrementAndGet();
	}

	/**
	 * @return a name that uniquely identifies this driver object within the process,
	 * for correlating log messages
	 */
	public final String instanceID() {
		return instanceID;
	}

	@Override
	public final void initialize() {
		if (!state.compareAndSet(State.NEW, State.INITIALIZING)) {
			throw new DriverStateException("Can't initialize " + instanceID + " in state " + state.get());
		}
		try (MDCScope ignored = mdc()) {
			LOGGER.debug("Initializing");
			doInitialize();
			state.set(State.OPEN);
		} catch (RuntimeException e) {
			state.set(State.CLOSED);
			throw e;
		}
	}

	@Override
	public final void close() {
		State old = state.getAndSet(State.CLOSED);
		if (old == State.OPEN) {
			try (MDCScope ignored = mdc()) {
				LOGGER.debug("Closing");
				doClose();
			}
		}
	}

	public final boolean isOpen() {
		return state.get() == State.OPEN;
	}

	@Override
	public final JsonNode get(IdentifierData identifier) throws NotFoundException {
		requireNonNull(identifier);
		try (MDCScope ignored = openScope()) {
			LOGGER.debug("get({})", identifier);
			return doGet(identifier);
		}
	}

	@Override
	public final JsonNode set(IdentifierData identifier, JsonNode value) {
		requireNonNull(identifier);
		requireNonNull(value);
		if (value.isMissingNode()) {
			throw new IllegalArgumentException("Can't store a missing node at " + identifier);
		}
		try (MDCScope ignored = openScope()) {
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("set({}, {})", identifier, value);
			} else {
				LOGGER.debug("set({}, ...)", identifier);
			}
			return doSet(identifier, value);
		}
	}

	@Override
	public final void clear(IdentifierData identifier) {
		requireNonNull(identifier);
		try (MDCScope ignored = openScope()) {
			LOGGER.debug("clear({})", identifier);
			doClear(identifier);
		}
	}

	@Override
	public final Number increment(IdentifierData identifier, Number delta, Number defaultValue) {
		requireNonNull(identifier);
		requireNonNull(delta);
		requireNonNull(defaultValue);
		try (MDCScope ignored = openScope()) {
			LOGGER.debug("increment({}, {}, {})", identifier, delta, defaultValue);
			return doIncrement(identifier, delta, defaultValue);
		}
	}

	@Override
	public final boolean toggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue) {
		requireNonNull(identifier);
		try (MDCScope ignored = openScope()) {
			LOGGER.debug("toggle({}, {}, {})", identifier, value, defaultValue);
			return doToggle(identifier, value, defaultValue);
		}
	}

	@Override
	public final void deleteAllData(boolean confirmed) {
		if (!confirmed) {
			throw new ConfirmationRequiredException("deleteAllData requires confirmation");
		}
		try (MDCScope ignored = openScope()) {
			LOGGER.warn("Deleting all data");
			doDeleteAllData();
		}
	}

	@Override
	public final Stream<Namespace> namespaces() {
		try (MDCScope ignored = openScope()) {
			LOGGER.debug("namespaces()");
			return doNamespaces();
		}
	}

	protected void doInitialize() { }
	protected void doClose() { }
	protected abstract JsonNode doGet(IdentifierData identifier) throws NotFoundException;
	protected abstract JsonNode doSet(IdentifierData identifier, JsonNode value);
	protected abstract void doClear(IdentifierData identifier);
	protected abstract Number doIncrement(IdentifierData identifier, Number delta, Number defaultValue);
	protected abstract boolean doToggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue);
	protected abstract void doDeleteAllData();
	protected abstract Stream<Namespace> doNamespaces();

	protected final MDCScope mdc() {
		return setupMDC(driverName, instanceID);
	}

	private MDCScope openScope() {
		State current = state.get();
		if (current != State.OPEN) {
			throw new DriverStateException("Driver " + instanceID + " is not open: " + current);
		}
		return mdc();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + instanceID + "}";
	}

	private static final AtomicLong INSTANCE_COUNTER = new AtomicLong(0);
	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStorageDriver.class);
}
