package umms.locannot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import junit.framework.TestCase;
import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.annotation.TSSRegion;
import umms.core.exception.GeneStoreException;
import umms.core.store.GeneStore;

public class BatchAnnotatorTest extends TestCase {

	private static final TSSRegion TSS = new TSSRegion(2000, 1000);

	private ExecutorService workers;
	private ExecutorService queries;

	@Override
	protected void setUp() throws Exception {
		workers = Executors.newFixedThreadPool(4);
		queries = Executors.newFixedThreadPool(4);
	}

	@Override
	protected void tearDown() throws Exception {
		workers.shutdownNow();
		queries.shutdownNow();
	}

	private static List<Location> locations() {
		List<Location> locations = new ArrayList<Location>();
		for (int i = 0; i < 40; i++) {
			int start = 187700000 + i * 2500;
			locations.add(new Location(i % 5 == 0 ? "chrBad" : "chr3", start, start + 100));
		}
		return locations;
	}

	public void testResultsKeepInputOrder() throws Exception {
		Annotator annotator = new Annotator(GeneFixtures.store(), TSS, 5, queries);
		List<Location> locations = locations();
		List<BatchAnnotator.Result> results = new BatchAnnotator(annotator, workers, false).annotate(locations);

		assertEquals(locations.size(), results.size());
		Annotator sequential = new Annotator(GeneFixtures.store(), TSS, 5);
		for (int i = 0; i < locations.size(); i++) {
			assertEquals(locations.get(i), results.get(i).getLocation());
			assertFalse(results.get(i).isFailed());
			assertEquals(sequential.annotate(locations.get(i)), results.get(i).getAnnotation());
		}
	}

	public void testFailedLocationDoesNotStopBatch() throws Exception {
		Annotator annotator = new Annotator(new ChromosomeFailingStore(), TSS, 5, queries);
		List<Location> locations = locations();
		List<BatchAnnotator.Result> results = new BatchAnnotator(annotator, workers, false).annotate(locations);

		assertEquals(locations.size(), results.size());
		int failed = 0;
		for (BatchAnnotator.Result result : results) {
			if (result.getLocation().getChr().equals("chrBad")) {
				assertTrue(result.isFailed());
				assertNull(result.getAnnotation());
				assertEquals(result.getLocation(), result.getError().getLocation());
				failed++;
			} else {
				assertFalse(result.isFailed());
				assertNotNull(result.getAnnotation());
			}
		}
		assertEquals(8, failed);
	}

	public void testFailFastThrowsFirstError() throws Exception {
		Annotator annotator = new Annotator(new ChromosomeFailingStore(), TSS, 5, queries);
		try {
			new BatchAnnotator(annotator, workers, true).annotate(locations());
			fail("Expected GeneStoreException");
		} catch (GeneStoreException e) {
			assertEquals(locations().get(0), e.getLocation());
		}
	}

	public void testProgrammingErrorIsNotRecordedAsStoreFailure() throws Exception {
		GeneStore broken = new FailingGeneStore(GeneFixtures.store(), null) {
			public List<GenomicFeature> featuresInExon(Location location, String geneId) {
				throw new IllegalStateException("exon index not built");
			}
		};
		Annotator annotator = new Annotator(broken, TSS, 5, queries);
		List<Location> locations = new ArrayList<Location>();
		locations.add(GeneFixtures.QUERY);
		try {
			new BatchAnnotator(annotator, workers, false).annotate(locations);
			fail("Expected IllegalStateException");
		} catch (IllegalStateException e) {
			assertEquals("exon index not built", e.getMessage());
		}
	}

	public void testEmptyBatch() throws Exception {
		Annotator annotator = new Annotator(GeneFixtures.store(), TSS, 5);
		assertTrue(new BatchAnnotator(annotator, workers, false).annotate(new ArrayList<Location>()).isEmpty());
	}

	/*
	 * Fails every query made for chrBad.
	 */
	private static class ChromosomeFailingStore implements GeneStore {
		private final GeneStore ok = GeneFixtures.store();
		private final GeneStore bad = new FailingGeneStore();

		private GeneStore pick(Location location) {
			return location.getChr().equals("chrBad") ? bad : ok;
		}

		public List<GenomicFeature> featuresWithin(Location location, Level level) throws GeneStoreException {
			return pick(location).featuresWithin(location, level);
		}

		public List<GenomicFeature> featuresOverlappingOrNearPromoter(Location location, Level level, int pad) throws GeneStoreException {
			return pick(location).featuresOverlappingOrNearPromoter(location, level, pad);
		}

		public List<GenomicFeature> featuresInExon(Location location, String geneId) throws GeneStoreException {
			return pick(location).featuresInExon(location, geneId);
		}

		public List<GenomicFeature> closestFeatures(Location location, int n, Level level) throws GeneStoreException {
			return pick(location).closestFeatures(location, n, level);
		}
	}
}
