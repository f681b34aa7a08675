package umms.core.readers;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.io.FileUtils;

import junit.framework.TestCase;
import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.annotation.Strand;
import umms.core.store.InMemoryGeneStore;

public class GeneFeatureFileReaderTest extends TestCase {

	private static final String TABLE = "# gene table\n"
			+ "id\tlevel\tchr\tstart\tend\tstrand\tgene_id\tgene_symbol\n"
			+ "1\tGene\tchr3\t100\t900\t-\tENSG1\tABC1\n"
			+ "\n"
			+ "2\t3\tchr3\t800\t900\t-\tENSG1\tABC1\n";

	public void testLoad() {
		List<GenomicFeature> features = GeneFeatureFileReader.load(new StringReader(TABLE), "table");
		assertEquals(2, features.size());
		GenomicFeature gene = features.get(0);
		assertEquals(1, gene.getId());
		assertEquals(Level.GENE, gene.getLevel());
		assertEquals("chr3", gene.getChr());
		assertEquals(100, gene.getStart());
		assertEquals(900, gene.getEnd());
		assertEquals(Strand.NEGATIVE, gene.getStrand());
		assertEquals("ENSG1", gene.getGeneId());
		assertEquals("ABC1", gene.getGeneSymbol());
		assertEquals(Level.EXON, features.get(1).getLevel());
	}

	public void testBadLineReportsLineNumber() {
		String table = "1\tGene\tchr3\t100\t900\t+\tENSG1\tABC1\n1\tGene\tchr3\tabc\t900\t+\tENSG1\tABC1\n";
		try {
			GeneFeatureFileReader.load(new StringReader(table), "genes.tsv");
			fail();
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith("genes.tsv line 2"));
		}
	}

	public void testShortLine() {
		try {
			GeneFeatureFileReader.load(new StringReader("1\tGene\tchr3\t100\n"), "genes.tsv");
			fail();
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("line 1"));
		}
	}

	public void testNotReallyGzipped() throws Exception {
		File dir = Files.createTempDirectory("genes").toFile();
		try {
			File file = new File(dir, "genes.tsv.gz");
			FileUtils.writeStringToFile(file, TABLE, StandardCharsets.UTF_8);
			try {
				GeneFeatureFileReader.load(file);
				fail();
			} catch (IOException e) {
				// not in gzip format
			}
		} finally {
			FileUtils.deleteQuietly(dir);
		}
	}

	public void testLoadGzippedStore() throws Exception {
		File dir = Files.createTempDirectory("genes").toFile();
		try {
			File file = new File(dir, "genes.tsv.gz");
			Writer writer = new OutputStreamWriter(new GZIPOutputStream(new FileOutputStream(file)), StandardCharsets.UTF_8);
			try {
				writer.write(TABLE);
			} finally {
				writer.close();
			}
			InMemoryGeneStore store = GeneFeatureFileReader.loadStore(file);
			assertEquals(2, store.size());
			assertEquals(1, store.featuresInExon(Location.parse("chr3:850-850"), "ENSG1").size());
		} finally {
			FileUtils.deleteQuietly(dir);
		}
	}
}
