package umms.core.store;

import java.util.List;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.exception.GeneStoreException;

/**
 * Indexed store of gene, transcript and exon features. Implementations must be safe
 * for concurrent readers; the annotator issues queries from several threads at once.
 */
public interface GeneStore {

	/**
	 * @return features of the given level overlapping location
	 */
	public List<GenomicFeature> featuresWithin(Location location, Level level) throws GeneStoreException;

	/**
	 * @param pad bases added on both sides of every feature before testing for overlap
	 * @return features of the given level whose padded extent overlaps location, ordered by start
	 */
	public List<GenomicFeature> featuresOverlappingOrNearPromoter(Location location, Level level, int pad) throws GeneStoreException;

	/**
	 * Returns the exons of a gene overlapping a location. Used to decide whether a location
	 * is exonic for that gene.
	 */
	public List<GenomicFeature> featuresInExon(Location location, String geneId) throws GeneStoreException;

	/**
	 * @return the n features of the given level whose TSS is closest to the midpoint of location,
	 * ascending by absolute distance, each carrying its signed distance (TSS - mid)
	 */
	public List<GenomicFeature> closestFeatures(Location location, int n, Level level) throws GeneStoreException;
}
