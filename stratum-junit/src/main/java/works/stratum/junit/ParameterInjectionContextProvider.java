package works.stratum.junit;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionConfigurationException;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;

import static java.util.Arrays.asList;

/**
 * Implements the {@link InjectFrom} annotation.
 */
public class ParameterInjectionContextProvider implements TestTemplateInvocationContextProvider {

	@Override
	public boolean supportsTestTemplate(ExtensionContext context) {
		return context.getTestMethod().isPresent();
	}

	@Override
	public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
		List<Parameter> parameters = asList(context.getRequiredTestMethod().getParameters());
		List<ParameterInjector> injectors = instantiateInjectors(context.getRequiredTestClass());

		// Each parameter gets the last injector that supports it
		var injectorByParameter = new LinkedHashMap<Parameter, ParameterInjector>();
		for (Parameter p: parameters) {
			for (ParameterInjector candidate: injectors) {
				if (candidate.supportsParameter(p)) {
					injectorByParameter.put(p, candidate);
				}
			}
		}

		// One axis per distinct injector, so two parameters served by
		// the same injector receive the same value in each combination
		List<ParameterInjector> axes = injectorByParameter.values().stream().distinct().toList();
		List<List<Object>> combinations = cartesianProduct(axes.stream().map(ParameterInjector::values).toList());

		String methodName = context.getRequiredTestMethod().getName();
		return combinations.stream().map(combo -> {
			var values = new LinkedHashMap<Parameter, Object>();
			injectorByParameter.forEach((p, injector) -> values.put(p, combo.get(axes.indexOf(injector))));
			return invocationContext(methodName, combo, values);
		});
	}

	private static TestTemplateInvocationContext invocationContext(String methodName, List<Object> combo, Map<Parameter, Object> values) {
		return new TestTemplateInvocationContext() {
			@Override
			public String getDisplayName(int invocationIndex) {
				return methodName + "[" + invocationIndex + "] " + combo;
			}

			@Override
			public List<Extension> getAdditionalExtensions() {
				return List.of(new ParameterResolver() {
					@Override
					public boolean supportsParameter(ParameterContext pc, ExtensionContext ec) {
						return values.containsKey(pc.getParameter());
					}

					@Override
					public Object resolveParameter(ParameterContext pc, ExtensionContext ec) throws ParameterResolutionException {
						Parameter param = pc.getParameter();
						if (values.containsKey(param)) {
							return values.get(param);
						}
						throw new ParameterResolutionException("Parameter not bound: " + param);
					}
				});
			}
		};
	}

	/**
	 * @return the injectors in precedence order: superclass annotations first
	 */
	private static List<ParameterInjector> instantiateInjectors(Class<?> testClass) {
		List<Class<?>> bottomUp = new ArrayList<>();
		for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass()) {
			bottomUp.add(c);
		}
		Collections.reverse(bottomUp);
		List<ParameterInjector> result = new ArrayList<>();
		for (Class<?> c: bottomUp) {
			// getDeclaredAnnotation, because @Inherited would otherwise repeat the superclass's list
			InjectFrom annotation = c.getDeclaredAnnotation(InjectFrom.class);
			if (annotation != null) {
				for (var injectorClass: annotation.value()) {
					result.add(instantiate(injectorClass));
				}
			}
		}
		return result;
	}

	private static ParameterInjector instantiate(Class<? extends ParameterInjector> injectorClass) {
		try {
			Constructor<? extends ParameterInjector> ctor = injectorClass.getDeclaredConstructor();
			ctor.setAccessible(true);
			return ctor.newInstance();
		} catch (NoSuchMethodException e) {
			throw new ExtensionConfigurationException("Injector class must have a no-argument constructor: " + injectorClass, e);
		} catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
			throw new ExtensionConfigurationException("Error calling constructor on injector class " + injectorClass, e);
		}
	}

	/**
	 * Compute the cartesian product of a list of lists.
	 */
	private static List<List<Object>> cartesianProduct(List<? extends List<?>> input) {
		List<List<Object>> result = List.of(List.of());
		for (List<?> list: input) {
			result = result.stream()
				.flatMap(prev -> list.stream().map(v -> {
					List<Object> next = new ArrayList<>(prev);
					next.add(v);
					return next;
				}))
				.toList();
		}
		return result;
	}
}
