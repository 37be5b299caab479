package works.stratum.logging;

/**
 * Keys placed in the SLF4J {@link org.slf4j.MDC} while a driver operation is running.
 */
public final class MdcKeys {
	public static final String DRIVER_NAME = "stratum.driver";
	public static final String DRIVER_INSTANCE_ID = "stratum.driverInstanceID";

	private MdcKeys() {}
}
