package works.stratum.settings;

import static java.util.Objects.requireNonNull;

/**
 * Identifies which copy of a setting applies in some context:
 * either the one global copy, or the copy belonging to one entity of some scope.
 */
public sealed interface ContextKey {
	static ContextKey global() {
		return Global.INSTANCE;
	}

	static ContextKey scoped(String scope, String id) {
		return new Scoped(scope, id);
	}

	final class Global implements ContextKey {
		private static final Global INSTANCE = new Global();

		private Global() {}

		@Override
		public String toString() {
			return "Global";
		}
	}

	/**
	 * @param scope usually a category name, like {@code GUILD}
	 * @param id the entity's primary key within the scope
	 */
	record Scoped(String scope, String id) implements ContextKey {
		public Scoped {
			requireNonNull(scope);
			requireNonNull(id);
		}
	}
}
