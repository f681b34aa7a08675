package umms.core.annotation;

/**
 * Promoter window around a transcription start site, given as the number of bases
 * upstream (5') and downstream (3') of the TSS in the direction of transcription.
 * <p>
 * For a positive strand gene the window is [start - offset5p, start + offset3p],
 * for a negative strand gene it is mirrored to [end - offset3p, end + offset5p].
 * Bounds are inclusive.
 */
public final class TSSRegion {

	private final int offset5p;
	private final int offset3p;

	public TSSRegion(int offset5p, int offset3p) {
		if (offset5p < 0 || offset3p < 0) {
			throw new IllegalArgumentException("TSS offsets must be non-negative, got [" + offset5p + "," + offset3p + "]");
		}
		this.offset5p = offset5p;
		this.offset3p = offset3p;
	}

	public int getOffset5p() {
		return offset5p;
	}

	public int getOffset3p() {
		return offset3p;
	}

	/**
	 * @return padding needed so an overlap query sees promoter-only hits on either strand
	 */
	public int getMaxOffset() {
		return Math.max(offset5p, offset3p);
	}

	/**
	 * Bounds saturate at the int range, so any non-negative offset is safe.
	 */
	public int getPromoterStart(GenomicFeature feature) {
		long tss = feature.getStrandedStart();
		return clip(feature.isNegativeStrand() ? tss - offset3p : tss - offset5p);
	}

	public int getPromoterEnd(GenomicFeature feature) {
		long tss = feature.getStrandedStart();
		return clip(feature.isNegativeStrand() ? tss + offset5p : tss + offset3p);
	}

	private static int clip(long position) {
		return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, position));
	}

	public boolean isInPromoter(int position, GenomicFeature feature) {
		return position >= getPromoterStart(feature) && position <= getPromoterEnd(feature);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof TSSRegion)) return false;
		TSSRegion other = (TSSRegion) o;
		return offset5p == other.offset5p && offset3p == other.offset3p;
	}

	@Override
	public int hashCode() {
		return 31 * offset5p + offset3p;
	}

	public String toString() {
		return "[" + offset5p + "," + offset3p + "]";
	}
}
