package works.stratum.junit;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import org.junit.jupiter.api.TestTemplate;
import org.junit.jupiter.api.extension.ExtendWith;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a test method that will have its parameters injected by {@link ParameterInjector}s.
 * The method runs once for every combination of injected values.
 * <p>
 * Parameters that no injector supports are left for JUnit to resolve
 * the usual way, so {@code TestInfo} and friends still work.
 *
 * @see InjectFrom
 */
@Retention(RUNTIME)
@Target(METHOD)
@TestTemplate
@ExtendWith(ParameterInjectionContextProvider.class)
public @interface InjectedTest {
}
