package works.stratum.logging;

import org.slf4j.MDC;

import static works.stratum.logging.MdcKeys.DRIVER_INSTANCE_ID;
import static works.stratum.logging.MdcKeys.DRIVER_NAME;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	/**
	 * Sets the driver's MDC keys, restoring the previous values on {@link MDCScope#close() close}.
	 * Nesting is allowed, so a driver that calls another driver doesn't clobber
	 * its caller's context.
	 */
	public static MDCScope setupMDC(String driverName, String driverInstanceID) {
		MDCScope result = new MDCScope();
		MDC.put(DRIVER_NAME, driverName);
		MDC.put(DRIVER_INSTANCE_ID, driverInstanceID);
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final String oldName = MDC.get(DRIVER_NAME);
		private final String oldInstanceID = MDC.get(DRIVER_INSTANCE_ID);

		MDCScope() {}

		@Override
		public void close() {
			restore(DRIVER_NAME, oldName);
			restore(DRIVER_INSTANCE_ID, oldInstanceID);
		}

		private static void restore(String key, String value) {
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}
	}
}
