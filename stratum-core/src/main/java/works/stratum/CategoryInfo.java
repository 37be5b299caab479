package works.stratum;

/**
 * @param primaryKeyLength the number of primary key segments that identify one entity in the category
 * @param isCustom true if the category was registered dynamically rather than being a {@link ConfigCategory}
 */
public record CategoryInfo(int primaryKeyLength, boolean isCustom) {
	public CategoryInfo {
		if (primaryKeyLength < 0) {
			throw new IllegalArgumentException("Primary key length can't be negative: " + primaryKeyLength);
		}
	}
}
