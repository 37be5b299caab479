package works.stratum;

/**
 * The built-in categories, each with a fixed number of primary key segments.
 * Owners can register additional categories as custom groups;
 * see {@link CategoryRegistry#withCustomGroup}.
 */
public enum ConfigCategory {
	GLOBAL(0),
	GUILD(1),
	CHANNEL(1),
	ROLE(1),
	USER(1),
	MEMBER(2);

	private final int primaryKeyLength;

	ConfigCategory(int primaryKeyLength) {
		this.primaryKeyLength = primaryKeyLength;
	}

	public int primaryKeyLength() {
		return primaryKeyLength;
	}

	public CategoryInfo info() {
		return new CategoryInfo(primaryKeyLength, false);
	}
}
