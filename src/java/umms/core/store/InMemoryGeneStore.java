package umms.core.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;

/**
 * Gene store held in memory, features kept per chromosome and level sorted by start.
 * The store is immutable once built so concurrent queries need no locking.
 */
public class InMemoryGeneStore implements GeneStore {

	static Logger logger = Logger.getLogger(InMemoryGeneStore.class.getName());

	static final Comparator<GenomicFeature> BY_START = new Comparator<GenomicFeature>() {
		public int compare(GenomicFeature a, GenomicFeature b) {
			if (a.getStart() != b.getStart()) return a.getStart() < b.getStart() ? -1 : 1;
			if (a.getEnd() != b.getEnd()) return a.getEnd() < b.getEnd() ? -1 : 1;
			return a.getId() < b.getId() ? -1 : (a.getId() == b.getId() ? 0 : 1);
		}
	};

	static final Comparator<GenomicFeature> BY_ABS_DISTANCE = new Comparator<GenomicFeature>() {
		public int compare(GenomicFeature a, GenomicFeature b) {
			int da = Math.abs(a.getDist());
			int db = Math.abs(b.getDist());
			if (da != db) return da < db ? -1 : 1;
			return BY_START.compare(a, b);
		}
	};

	private final Map<String, Map<Level, List<GenomicFeature>>> features = new TreeMap<String, Map<Level, List<GenomicFeature>>>();
	private final int size;

	public InMemoryGeneStore(Collection<GenomicFeature> all) {
		for (GenomicFeature feature : all) {
			Map<Level, List<GenomicFeature>> byLevel = features.get(feature.getChr());
			if (byLevel == null) {
				byLevel = new EnumMap<Level, List<GenomicFeature>>(Level.class);
				features.put(feature.getChr(), byLevel);
			}
			List<GenomicFeature> list = byLevel.get(feature.getLevel());
			if (list == null) {
				list = new ArrayList<GenomicFeature>();
				byLevel.put(feature.getLevel(), list);
			}
			list.add(feature);
		}
		for (Map<Level, List<GenomicFeature>> byLevel : features.values()) {
			for (List<GenomicFeature> list : byLevel.values()) {
				Collections.sort(list, BY_START);
			}
		}
		size = all.size();
		logger.info("Gene store holds " + size + " features on " + features.size() + " chromosomes");
	}

	public int size() {
		return size;
	}

	private List<GenomicFeature> getFeatures(String chr, Level level) {
		Map<Level, List<GenomicFeature>> byLevel = features.get(chr);
		if (byLevel == null || !byLevel.containsKey(level)) {
			return Collections.emptyList();
		}
		return byLevel.get(level);
	}

	@Override
	public List<GenomicFeature> featuresWithin(Location location, Level level) {
		return featuresOverlappingOrNearPromoter(location, level, 0);
	}

	@Override
	public List<GenomicFeature> featuresOverlappingOrNearPromoter(Location location, Level level, int pad) {
		List<GenomicFeature> rtrn = new ArrayList<GenomicFeature>();
		for (GenomicFeature feature : getFeatures(location.getChr(), level)) {
			// sorted by start, nothing further along can overlap
			if ((long) feature.getStart() - pad > location.getEnd()) break;
			if ((long) feature.getEnd() + pad >= location.getStart()) {
				rtrn.add(feature.withDistanceTo(location));
			}
		}
		return rtrn;
	}

	@Override
	public List<GenomicFeature> featuresInExon(Location location, String geneId) {
		List<GenomicFeature> rtrn = new ArrayList<GenomicFeature>();
		for (GenomicFeature exon : getFeatures(location.getChr(), Level.EXON)) {
			if (exon.getStart() > location.getEnd()) break;
			if (exon.getGeneId().equals(geneId) && location.overlaps(exon.getStart(), exon.getEnd())) {
				rtrn.add(exon.withDistanceTo(location));
			}
		}
		return rtrn;
	}

	@Override
	public List<GenomicFeature> closestFeatures(Location location, int n, Level level) {
		if (n < 1) {
			throw new IllegalArgumentException("Number of closest features must be positive, got " + n);
		}
		List<GenomicFeature> candidates = getFeatures(location.getChr(), level);
		List<GenomicFeature> withDistance = new ArrayList<GenomicFeature>(candidates.size());
		for (GenomicFeature feature : candidates) {
			withDistance.add(feature.withDistanceTo(location));
		}
		Collections.sort(withDistance, BY_ABS_DISTANCE);
		return new ArrayList<GenomicFeature>(withDistance.subList(0, Math.min(n, withDistance.size())));
	}
}
