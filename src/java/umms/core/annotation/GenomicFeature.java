package umms.core.annotation;

/**
 * One row of a gene database: a gene, transcript or exon extent together with the
 * gene it belongs to. Features are read-only once built. The distance field is only
 * meaningful on rows returned by a nearest-feature query, where it holds the signed
 * distance from the feature's TSS to the query midpoint (TSS - mid).
 */
public final class GenomicFeature {

	private final int id;
	private final Level level;
	private final String chr;
	private final int start;
	private final int end;
	private final Strand strand;
	private final String geneId;
	private final String geneSymbol;
	private final int dist;

	public GenomicFeature(int id, Level level, String chr, int start, int end, Strand strand, String geneId, String geneSymbol) {
		this(id, level, chr, start, end, strand, geneId, geneSymbol, 0);
	}

	public GenomicFeature(int id, Level level, String chr, int start, int end, Strand strand, String geneId, String geneSymbol, int dist) {
		if (start > end) {
			throw new IllegalArgumentException("Feature " + id + " (" + geneId + ") has start " + start + " after end " + end);
		}
		this.id = id;
		this.level = level;
		this.chr = chr;
		this.start = start;
		this.end = end;
		this.strand = strand;
		this.geneId = geneId;
		this.geneSymbol = geneSymbol;
		this.dist = dist;
	}

	public int getId() {
		return id;
	}

	public Level getLevel() {
		return level;
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

	public Strand getStrand() {
		return strand;
	}

	public boolean isNegativeStrand() {
		return strand == Strand.NEGATIVE;
	}

	public String getGeneId() {
		return geneId;
	}

	public String getGeneSymbol() {
		return geneSymbol;
	}

	public int getDist() {
		return dist;
	}

	/**
	 * @return the transcription start site, end for negative strand features and start otherwise
	 */
	public int getStrandedStart() {
		return isNegativeStrand() ? end : start;
	}

	/**
	 * @param location
	 * @return signed distance TSS - midpoint of location
	 */
	public int getDistanceTo(Location location) {
		return getStrandedStart() - location.getMid();
	}

	/**
	 * @param location
	 * @return a copy of this feature carrying its signed TSS distance to location
	 */
	public GenomicFeature withDistanceTo(Location location) {
		return new GenomicFeature(id, level, chr, start, end, strand, geneId, geneSymbol, getDistanceTo(location));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof GenomicFeature)) return false;
		GenomicFeature other = (GenomicFeature) o;
		return id == other.id && level == other.level && start == other.start && end == other.end
				&& dist == other.dist && strand == other.strand && chr.equals(other.chr)
				&& geneId.equals(other.geneId) && geneSymbol.equals(other.geneSymbol);
	}

	@Override
	public int hashCode() {
		int result = id;
		result = 31 * result + chr.hashCode();
		result = 31 * result + start;
		result = 31 * result + end;
		result = 31 * result + geneId.hashCode();
		return result;
	}

	public String toString() {
		return geneId + "(" + geneSymbol + ") " + level + " " + chr + ":" + start + "-" + end + " " + strand;
	}
}
