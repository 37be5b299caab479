package works.stratum.junit;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Configures parameter injection for a test class by
 * specifying one or more {@link ParameterInjector}s
 * to be made available for injecting parameters into test methods.
 * <p>
 * When multiple injectors provide values for the same parameter,
 * the later one wins. Annotations on superclasses count as "earlier",
 * so a conformance suite can declare default injectors
 * and a subclass can override them for a particular backend.
 * <p>
 * Each injector class must have a no-argument constructor.
 * Records with no components work nicely.
 *
 * @see InjectedTest
 */
@Inherited
@Retention(RUNTIME)
@Target(TYPE)
public @interface InjectFrom {
	Class<? extends ParameterInjector>[] value();
}
