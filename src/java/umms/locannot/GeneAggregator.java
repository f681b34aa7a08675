package umms.locannot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Location;

/**
 * Collapses transcript level classifications into one record per gene id. Flags are
 * OR-combined over the transcripts of a gene and the signed distance of the transcript
 * with the smallest absolute distance is kept (the first one seen on ties).
 * <p>
 * Genes are emitted by ascending absolute distance, ties by gene id, so the order does not
 * depend on the order in which features were added. One aggregator serves a single
 * annotation and is not thread safe.
 */
public class GeneAggregator {

	private final Map<String, GeneProm> genes = new HashMap<String, GeneProm>();

	private static class GeneProm {
		private final String symbol;
		private boolean isPromoter;
		private boolean isExon;
		private boolean isIntronic;
		private int d;
		private int absD;

		GeneProm(String symbol, boolean isPromoter, boolean isExon, boolean isIntronic, int d) {
			this.symbol = symbol;
			this.isPromoter = isPromoter;
			this.isExon = isExon;
			this.isIntronic = isIntronic;
			this.d = d;
			this.absD = Math.abs(d);
		}

		void merge(boolean isPromoter, boolean isExon, boolean isIntronic, int d) {
			this.isPromoter = this.isPromoter || isPromoter;
			this.isExon = this.isExon || isExon;
			this.isIntronic = this.isIntronic || isIntronic;
			int abs = Math.abs(d);
			if (abs < absD) {
				this.d = d;
				this.absD = abs;
			}
		}
	}

	public void add(GenomicFeature feature, Classification classification) {
		add(feature.getGeneId(), feature.getGeneSymbol(), classification.isPromoter(), classification.isExonic(),
				classification.isIntronic(), classification.getDistance());
	}

	public void add(String geneId, String geneSymbol, boolean isPromoter, boolean isExon, boolean isIntronic, int d) {
		GeneProm prom = genes.get(geneId);
		if (prom == null) {
			genes.put(geneId, new GeneProm(geneSymbol, isPromoter, isExon, isIntronic, d));
		} else {
			prom.merge(isPromoter, isExon, isIntronic, d);
		}
	}

	public int size() {
		return genes.size();
	}

	public boolean isEmpty() {
		return genes.isEmpty();
	}

	/**
	 * @return gene ids grouped by absolute distance, each group sorted by id
	 */
	public List<String> getOrderedGeneIds() {
		TreeMap<Integer, TreeSet<String>> distMap = new TreeMap<Integer, TreeSet<String>>();
		for (Map.Entry<String, GeneProm> entry : genes.entrySet()) {
			TreeSet<String> ids = distMap.get(entry.getValue().absD);
			if (ids == null) {
				ids = new TreeSet<String>();
				distMap.put(entry.getValue().absD, ids);
			}
			ids.add(entry.getKey());
		}
		List<String> rtrn = new ArrayList<String>(genes.size());
		for (TreeSet<String> ids : distMap.values()) {
			rtrn.addAll(ids);
		}
		return rtrn;
	}

	public String getSymbol(String geneId) {
		return getProm(geneId).symbol;
	}

	public String getLabel(String geneId) {
		GeneProm p = getProm(geneId);
		return Classification.makeLabel(p.isPromoter, p.isExon, p.isIntronic);
	}

	public int getDistance(String geneId) {
		return getProm(geneId).d;
	}

	private GeneProm getProm(String geneId) {
		GeneProm p = genes.get(geneId);
		if (p == null) {
			throw new IllegalArgumentException("Gene " + geneId + " was never added");
		}
		return p;
	}

	/**
	 * Builds the annotation of location from the genes added so far.
	 */
	public GeneAnnotation toAnnotation(Location location, List<ClosestGene> closestGenes) {
		List<String> ids = getOrderedGeneIds();
		List<String> symbols = new ArrayList<String>(ids.size());
		List<String> labels = new ArrayList<String>(ids.size());
		List<String> dists = new ArrayList<String>(ids.size());
		for (String id : ids) {
			symbols.add(getSymbol(id));
			labels.add(getLabel(id));
			dists.add(Integer.toString(getDistance(id)));
		}
		if (ids.isEmpty()) {
			ids.add(Classification.NA);
			symbols.add(Classification.NA);
			labels.add("");
			dists.add(Classification.NA);
		}
		return new GeneAnnotation(location, ids, symbols, labels, dists, closestGenes);
	}
}
