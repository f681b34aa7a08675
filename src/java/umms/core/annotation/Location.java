package umms.core.annotation;

import org.apache.commons.lang3.StringUtils;

/**
 * A closed genomic interval chr:start-end that is to be annotated.
 * Coordinates are non-negative and start never exceeds end.
 */
public final class Location implements Comparable<Location> {

	private final String chr;
	private final int start;
	private final int end;

	public Location(String chr, int start, int end) {
		if (StringUtils.isBlank(chr)) {
			throw new IllegalArgumentException("Location needs a chromosome");
		}
		if (start < 0 || end < 0) {
			throw new IllegalArgumentException("Negative coordinate in " + chr + ":" + start + "-" + end);
		}
		if (start > end) {
			throw new IllegalArgumentException("Start is after end in " + chr + ":" + start + "-" + end);
		}
		this.chr = chr;
		this.start = start;
		this.end = end;
	}

	/**
	 * Parses chr:start-end. Thousands separators are ignored, so chr3:1,000-2,000 is valid.
	 * @param text
	 * @return
	 */
	public static Location parse(String text) {
		if (text == null) {
			throw new IllegalArgumentException("Cannot parse a null location");
		}
		String cleaned = StringUtils.deleteWhitespace(text).replace(",", "");
		int colon = cleaned.lastIndexOf(':');
		int dash = cleaned.indexOf('-', colon + 1);
		if (colon < 1 || dash < 0) {
			throw new IllegalArgumentException("Location must look like chr:start-end, got \"" + text + "\"");
		}
		String chr = cleaned.substring(0, colon);
		try {
			int start = Integer.parseInt(cleaned.substring(colon + 1, dash));
			int end = Integer.parseInt(cleaned.substring(dash + 1));
			return new Location(chr, start, end);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Bad coordinates in location \"" + text + "\"", e);
		}
	}

	public String getChr() {
		return chr;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/**
	 * @return floor of the midpoint
	 */
	public int getMid() {
		return (int) (((long) start + end) / 2);
	}

	public boolean overlaps(int otherStart, int otherEnd) {
		return otherStart <= end && otherEnd >= start;
	}

	public int compareTo(Location other) {
		int cmp = chr.compareTo(other.chr);
		if (cmp != 0) return cmp;
		if (start != other.start) return start < other.start ? -1 : 1;
		if (end != other.end) return end < other.end ? -1 : 1;
		return 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Location)) return false;
		Location other = (Location) o;
		return start == other.start && end == other.end && chr.equals(other.chr);
	}

	@Override
	public int hashCode() {
		int result = chr.hashCode();
		result = 31 * result + start;
		result = 31 * result + end;
		return result;
	}

	public String toString() {
		return chr + ":" + start + "-" + end;
	}
}
