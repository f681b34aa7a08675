package umms.core.annotation;

import junit.framework.TestCase;

public class GenomicFeatureTest extends TestCase {

	public void testStrandedStartAndDistance() {
		Location loc = new Location("chr1", 100, 120);
		GenomicFeature plus = new GenomicFeature(1, Level.GENE, "chr1", 150, 500, Strand.POSITIVE, "G1", "S1");
		GenomicFeature minus = new GenomicFeature(2, Level.GENE, "chr1", 10, 60, Strand.NEGATIVE, "G2", "S2");
		assertEquals(150, plus.getStrandedStart());
		assertEquals(60, minus.getStrandedStart());
		assertEquals(40, plus.getDistanceTo(loc));
		assertEquals(-50, minus.getDistanceTo(loc));

		GenomicFeature withDist = plus.withDistanceTo(loc);
		assertEquals(40, withDist.getDist());
		assertEquals(0, plus.getDist());
		assertFalse(plus.equals(withDist));
	}

	public void testRejectsStartAfterEnd() {
		try {
			new GenomicFeature(1, Level.EXON, "chr1", 10, 5, Strand.POSITIVE, "G1", "S1");
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	public void testLevelAndStrandParsing() {
		assertEquals(Level.TRANSCRIPT, Level.fromString("transcript"));
		assertEquals(Level.EXON, Level.fromString("3"));
		assertEquals(Level.GENE, Level.fromCode(1));
		assertEquals("Gene", Level.GENE.toString());
		try {
			Level.fromString("utr");
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
		assertEquals(Strand.NEGATIVE, Strand.fromString("-"));
		assertEquals(Strand.POSITIVE, Strand.fromString("+"));
		assertEquals(Strand.POSITIVE, Strand.fromString("."));
	}
}
