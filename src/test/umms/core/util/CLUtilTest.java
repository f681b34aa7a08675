package umms.core.util;

import junit.framework.TestCase;
import umms.core.util.CLUtil.ArgumentMap;

public class CLUtilTest extends TestCase {

	public void testParameters() {
		ArgumentMap argMap = CLUtil.getParameters(new String[] {"-task", "closest", "-in", "peaks.bed", "-location", "chr1:1-2",
				"-location", "chr2:3-4", "-failFast", "-tss5p", "-500", "n=3"}, "usage", "annotate");
		assertEquals("closest", argMap.getTask());
		assertEquals("peaks.bed", argMap.getInput());
		assertTrue(argMap.hasInputFile());
		assertFalse(argMap.isOutputSet());
		assertEquals(2, argMap.getAll("location").size());
		assertEquals("chr2:3-4", argMap.getAll("location").get(1));
		assertTrue(argMap.isPresent("failFast"));
		assertEquals(-500, argMap.getInteger("tss5p"));
		assertEquals(3, argMap.getInteger("n", 10));
		assertEquals(1000, argMap.getInteger("tss3p", 1000));
		assertEquals("tsv", argMap.get("format", "tsv"));
		assertTrue(argMap.getAll("level").isEmpty());
	}

	public void testDefaultTask() {
		assertEquals("annotate", CLUtil.getParameters(new String[0], "usage", "annotate").getTask());
		try {
			CLUtil.getParameters(new String[0], "usage").getTask();
			fail();
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().endsWith("usage"));
		}
	}

	public void testErrors() {
		ArgumentMap argMap = CLUtil.getParameters(new String[] {"-n", "ten", "-db"}, "usage");
		try {
			argMap.getInteger("n");
			fail();
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("ten"));
		}
		try {
			argMap.getMandatory("db");
			fail();
		} catch (IllegalArgumentException e) {
			// expected, flag has no value
		}
		try {
			argMap.getInput();
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			CLUtil.getParameters(new String[] {"stray"}, "usage");
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
	}
}
