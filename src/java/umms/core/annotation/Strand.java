package umms.core.annotation;

/**
 * Strand of a gene feature. Anything that is not "-" is read as the positive strand.
 */
public enum Strand {
	POSITIVE('+'), NEGATIVE('-');
	private char value;

	private Strand(char value) {
		this.value = value;
	}

	public String toString() {
		return "" + value;
	}

	public static Strand fromString(String value) {
		if (value != null && value.trim().equals("-")) return NEGATIVE;
		return POSITIVE;
	}
}
