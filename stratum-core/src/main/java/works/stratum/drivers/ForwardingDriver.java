package works.stratum.drivers;

import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.stratum.DriverFactory;
import works.stratum.IdentifierData;
import works.stratum.Namespace;
import works.stratum.StorageDriver;
import works.stratum.exceptions.NotFoundException;

/**
 * Implements all {@link StorageDriver} methods by simply calling the corresponding
 * methods on another driver. Useful for overriding one or two methods while leaving
 * the rest unchanged.
 * <p>
 * {@link #importData} is deliberately not forwarded: the inherited implementation
 * calls {@link #set} on this object, so overrides of {@code set} apply to imports too.
 */
public class ForwardingDriver implements StorageDriver {
	protected final StorageDriver downstream;

	public ForwardingDriver(StorageDriver downstream) {
		this.downstream = downstream;
	}

	public static DriverFactory factory(DriverFactory downstream) {
		return () -> new ForwardingDriver(downstream.build());
	}

	@Override
	public void initialize() {
		downstream.initialize();
	}

	@Override
	public void close() {
		downstream.close();
	}

	@Override
	public JsonNode get(IdentifierData identifier) throws NotFoundException {
		return downstream.get(identifier);
	}

	@Override
	public JsonNode set(IdentifierData identifier, JsonNode value) {
		return downstream.set(identifier, value);
	}

	@Override
	public void clear(IdentifierData identifier) {
		downstream.clear(identifier);
	}

	@Override
	public Number increment(IdentifierData identifier, Number delta, Number defaultValue) {
		return downstream.increment(identifier, delta, defaultValue);
	}

	@Override
	public boolean toggle(IdentifierData identifier, @Nullable Boolean value, @Nullable Boolean defaultValue) {
		return downstream.toggle(identifier, value, defaultValue);
	}

	@Override
	public void deleteAllData(boolean confirmed) {
		downstream.deleteAllData(confirmed);
	}

	@Override
	public Stream<Namespace> namespaces() {
		return downstream.namespaces();
	}

	@Override
	public String toString() {
		return "ForwardingDriver{" +
			"downstream=" + downstream +
			'}';
	}
}
