package umms.locannot;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Result of classifying a location against one gene feature: the promoter/exonic/intronic
 * flags, the signed TSS distance and the label built from them.
 */
public final class Classification {

	public static final String NA = "n/a";
	public static final String PROMOTER = "promoter";
	public static final String EXONIC = "exonic";
	public static final String INTRONIC = "intronic";
	public static final String INTERGENIC = "intergenic";

	private final boolean promoter;
	private final boolean exonic;
	private final boolean intronic;
	private final boolean intergenic;
	private final int distance;

	private Classification(boolean promoter, boolean exonic, boolean intronic, boolean intergenic, int distance) {
		this.promoter = promoter;
		this.exonic = exonic;
		this.intronic = intronic;
		this.intergenic = intergenic;
		this.distance = distance;
	}

	public static Classification of(boolean promoter, boolean exonic, boolean intronic, int distance) {
		return new Classification(promoter, exonic, intronic, false, distance);
	}

	/**
	 * @param distance signed TSS distance, kept so the location can still be ranked
	 */
	public static Classification intergenic(int distance) {
		return new Classification(false, false, false, true, distance);
	}

	public boolean isPromoter() {
		return promoter;
	}

	public boolean isExonic() {
		return exonic;
	}

	public boolean isIntronic() {
		return intronic;
	}

	public boolean isIntergenic() {
		return intergenic;
	}

	public int getDistance() {
		return distance;
	}

	public String getLabel() {
		return intergenic ? INTERGENIC : makeLabel(promoter, exonic, intronic);
	}

	/**
	 * Promoter comes first, then exonic or, failing that, intronic. Returns the empty
	 * string when no flag is set.
	 */
	public static String makeLabel(boolean isPromoter, boolean isExon, boolean isIntronic) {
		List<String> labels = new ArrayList<String>(2);
		if (isPromoter) {
			labels.add(PROMOTER);
		}
		if (isExon) {
			labels.add(EXONIC);
		} else if (isIntronic) {
			labels.add(INTRONIC);
		}
		return StringUtils.join(labels, ",");
	}

	public String toString() {
		return getLabel() + "(" + distance + ")";
	}
}
