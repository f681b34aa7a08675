package umms.locannot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import umms.core.annotation.Location;

/**
 * Annotation of one location: the genes it lies in or near, as four co-indexed lists
 * ordered by absolute TSS distance, and the closest genes independent of overlap.
 * When no gene is near, the id, symbol and distance lists hold the single value "n/a"
 * and the label list holds one empty label.
 */
public final class GeneAnnotation {

	public static final String SEPARATOR = ";";

	private final Location location;
	private final List<String> geneIds;
	private final List<String> geneSymbols;
	private final List<String> labels;
	private final List<String> tssDistances;
	private final List<ClosestGene> closestGenes;

	public GeneAnnotation(Location location, List<String> geneIds, List<String> geneSymbols, List<String> labels,
			List<String> tssDistances, List<ClosestGene> closestGenes) {
		if (geneIds.size() != geneSymbols.size() || geneIds.size() != labels.size() || geneIds.size() != tssDistances.size()) {
			throw new IllegalArgumentException("Gene lists of " + location + " differ in length");
		}
		this.location = location;
		this.geneIds = Collections.unmodifiableList(new ArrayList<String>(geneIds));
		this.geneSymbols = Collections.unmodifiableList(new ArrayList<String>(geneSymbols));
		this.labels = Collections.unmodifiableList(new ArrayList<String>(labels));
		this.tssDistances = Collections.unmodifiableList(new ArrayList<String>(tssDistances));
		this.closestGenes = Collections.unmodifiableList(new ArrayList<ClosestGene>(closestGenes));
	}

	public Location getLocation() {
		return location;
	}

	public List<String> getGeneIds() {
		return geneIds;
	}

	public List<String> getGeneSymbols() {
		return geneSymbols;
	}

	public List<String> getLabels() {
		return labels;
	}

	public List<String> getTssDistances() {
		return tssDistances;
	}

	public List<ClosestGene> getClosestGenes() {
		return closestGenes;
	}

	/**
	 * @return false if the gene lists only hold the "n/a" placeholder
	 */
	public boolean hasGenes() {
		return !(geneIds.size() == 1 && Classification.NA.equals(geneIds.get(0)));
	}

	public String getGeneIdsString() {
		return StringUtils.join(geneIds, SEPARATOR);
	}

	public String getGeneSymbolsString() {
		return StringUtils.join(geneSymbols, SEPARATOR);
	}

	public String getLabelsString() {
		return StringUtils.join(labels, SEPARATOR);
	}

	public String getTssDistancesString() {
		return StringUtils.join(tssDistances, SEPARATOR);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof GeneAnnotation)) return false;
		GeneAnnotation other = (GeneAnnotation) o;
		return location.equals(other.location) && geneIds.equals(other.geneIds) && geneSymbols.equals(other.geneSymbols)
				&& labels.equals(other.labels) && tssDistances.equals(other.tssDistances)
				&& closestGenes.equals(other.closestGenes);
	}

	@Override
	public int hashCode() {
		return 31 * location.hashCode() + geneIds.hashCode();
	}

	public String toString() {
		return location + "\t" + getGeneIdsString() + "\t" + getGeneSymbolsString() + "\t" + getLabelsString() + "\t"
				+ getTssDistancesString();
	}
}
