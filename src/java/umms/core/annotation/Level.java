package umms.core.annotation;

/**
 * Granularity of a gene feature row. The code is the value stored in the
 * {@code level} column of a gene database.
 */
public enum Level {
	GENE(1, "Gene"), TRANSCRIPT(2, "Transcript"), EXON(3, "Exon");

	private final int code;
	private final String name;

	private Level(int code, String name) {
		this.code = code;
		this.name = name;
	}

	public int getCode() {
		return code;
	}

	public String toString() {
		return name;
	}

	public static Level fromCode(int code) {
		for (Level level : values()) {
			if (level.code == code) return level;
		}
		throw new IllegalArgumentException("Unknown feature level code " + code);
	}

	/**
	 * Accepts either the level name (any case) or its numeric code.
	 * @param value
	 * @return
	 */
	public static Level fromString(String value) {
		String v = value.trim();
		for (Level level : values()) {
			if (level.name.equalsIgnoreCase(v) || String.valueOf(level.code).equals(v)) return level;
		}
		throw new IllegalArgumentException("Unknown feature level " + value);
	}
}
