package works.stratum.junit;

import java.lang.reflect.Parameter;
import java.util.List;

/**
 * Provides a series of possible values for a given parameter.
 */
public interface ParameterInjector {
	/**
	 * Note: if this method returns different results for the same parameter
	 * at different times, strange behaviour may result.
	 * @return true if this injector provides values for the given parameter.
	 */
	boolean supportsParameter(Parameter parameter);

	/**
	 * @return non-null, non-empty {@link List} of values for the supported parameters.
	 */
	List<?> values();

	static <T> ParameterInjector ofType(Class<T> type, List<? extends T> values) {
		return new ParameterInjector() {
			@Override
			public boolean supportsParameter(Parameter p) {
				return p.getType() == type;
			}
			@Override
			public List<?> values() {
				return values;
			}
		};
	}
}
