package umms.locannot;

import java.util.List;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Location;
import umms.core.annotation.TSSRegion;
import umms.core.exception.GeneStoreException;
import umms.core.store.GeneStore;

/**
 * Decides whether a location is promoter, exonic, intronic or intergenic with respect to
 * a gene feature, and the signed distance from the feature's TSS to the location midpoint.
 * <p>
 * The search window of a feature is its body joined with its promoter window. Locations
 * entirely outside it are intergenic and no exon lookup is made for them.
 */
public class Classifier {

	private final TSSRegion tssRegion;

	public Classifier(TSSRegion tssRegion) {
		this.tssRegion = tssRegion;
	}

	public TSSRegion getTSSRegion() {
		return tssRegion;
	}

	/**
	 * @return TSS - mid, start - mid on the positive strand and end - mid on the negative strand
	 */
	public static int signedDistance(Location location, GenomicFeature feature) {
		return feature.getStrandedStart() - location.getMid();
	}

	public int getWindowStart(GenomicFeature feature) {
		return Math.min(feature.getStart(), tssRegion.getPromoterStart(feature));
	}

	public int getWindowEnd(GenomicFeature feature) {
		return Math.max(feature.getEnd(), tssRegion.getPromoterEnd(feature));
	}

	public boolean isOutsideWindow(Location location, GenomicFeature feature) {
		return location.getStart() > getWindowEnd(feature) || location.getEnd() < getWindowStart(feature);
	}

	/**
	 * Classifies with exon membership already known. Does no I/O.
	 * @param location
	 * @param feature
	 * @param inExon true if the location overlaps an exon of the feature's gene
	 * @return
	 */
	public Classification classify(Location location, GenomicFeature feature, boolean inExon) {
		int d = signedDistance(location, feature);
		if (isOutsideWindow(location, feature)) {
			return Classification.intergenic(d);
		}
		int mid = location.getMid();
		boolean isPromoter = tssRegion.isInPromoter(mid, feature);
		boolean isIntronic = mid >= feature.getStart() && mid <= feature.getEnd();
		return Classification.of(isPromoter, inExon, isIntronic, d);
	}

	/**
	 * Classifies, asking the store for exon membership when the location is inside the
	 * feature's window.
	 * @throws GeneStoreException if the exon query fails
	 */
	public Classification classify(Location location, GenomicFeature feature, GeneStore store) throws GeneStoreException {
		if (isOutsideWindow(location, feature)) {
			return Classification.intergenic(signedDistance(location, feature));
		}
		List<GenomicFeature> exons = store.featuresInExon(location, feature.getGeneId());
		return classify(location, feature, !exons.isEmpty());
	}
}
