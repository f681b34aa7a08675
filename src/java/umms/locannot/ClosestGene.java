package umms.locannot;

/**
 * One entry of the closest-genes list of an annotation.
 */
public final class ClosestGene {

	private final String geneId;
	private final String geneSymbol;
	private final String label;
	private final int tssDistance;

	public ClosestGene(String geneId, String geneSymbol, String label, int tssDistance) {
		this.geneId = geneId;
		this.geneSymbol = geneSymbol;
		this.label = label;
		this.tssDistance = tssDistance;
	}

	public String getGeneId() {
		return geneId;
	}

	public String getGeneSymbol() {
		return geneSymbol;
	}

	public String getLabel() {
		return label;
	}

	public int getTssDistance() {
		return tssDistance;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof ClosestGene)) return false;
		ClosestGene other = (ClosestGene) o;
		return tssDistance == other.tssDistance && geneId.equals(other.geneId)
				&& geneSymbol.equals(other.geneSymbol) && label.equals(other.label);
	}

	@Override
	public int hashCode() {
		return 31 * geneId.hashCode() + tssDistance;
	}

	public String toString() {
		return geneId + "\t" + geneSymbol + "\t" + label + "\t" + tssDistance;
	}
}
