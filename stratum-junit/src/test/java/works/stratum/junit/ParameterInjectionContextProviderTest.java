package works.stratum.junit;

import java.lang.reflect.Parameter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInfo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@InjectFrom({
	ParameterInjectionContextProviderTest.StringInjector.class,
	ParameterInjectionContextProviderTest.IntInjector.class
})
class ParameterInjectionContextProviderTest {
	static final Set<String> observations = new LinkedHashSet<>();

	@BeforeAll
	static void setup() {
		observations.clear();
	}

	@InjectedTest
	void cartesianProduct(String s, int i) {
		observations.add(s + i);
	}

	@InjectedTest
	void sameInjectorTwice_sameValue(String first, String second) {
		assertEquals(first, second);
	}

	@InjectedTest
	void otherResolversStillWork(String s, TestInfo testInfo) {
		assertNotNull(s);
		assertNotNull(testInfo.getDisplayName());
	}

	@AfterAll
	static void checkObservations() {
		Set<String> expected = Stream.of("A", "B", "C")
			.flatMap(s -> Stream.of(1, 2).map(i -> s + i))
			.collect(Collectors.toSet());
		assertEquals(expected, observations);
	}

	record StringInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType().equals(String.class);
		}

		@Override
		public List<String> values() {
			return List.of("A", "B", "C");
		}
	}

	record IntInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType().equals(int.class);
		}

		@Override
		public List<Integer> values() {
			return List.of(1, 2);
		}
	}
}
