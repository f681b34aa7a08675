package umms.core.store;

import java.io.File;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.io.FileUtils;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.exception.GeneStoreException;

public class JdbcGeneStoreTest extends GeneStoreContract {

	private File dir;
	private File db;

	@Override
	protected GeneStore createStore(List<GenomicFeature> features) throws Exception {
		dir = Files.createTempDirectory("genestore").toFile();
		db = new File(dir, "genes.db");
		Connection c = DriverManager.getConnection("jdbc:sqlite:" + db.getAbsolutePath());
		try {
			Statement stmt = c.createStatement();
			stmt.executeUpdate("CREATE TABLE genes (id INTEGER PRIMARY KEY, level INTEGER, chr TEXT, start INTEGER, \"end\" INTEGER,"
					+ " strand TEXT, gene_id TEXT, gene_symbol TEXT, stranded_start INTEGER)");
			stmt.close();
			PreparedStatement insert = c.prepareStatement("INSERT INTO genes VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)");
			for (GenomicFeature f : features) {
				insert.setInt(1, f.getId());
				insert.setInt(2, f.getLevel().getCode());
				insert.setString(3, f.getChr());
				insert.setInt(4, f.getStart());
				insert.setInt(5, f.getEnd());
				insert.setString(6, f.getStrand().toString());
				insert.setString(7, f.getGeneId());
				insert.setString(8, f.getGeneSymbol());
				insert.setInt(9, f.getStrandedStart());
				insert.executeUpdate();
			}
			insert.close();
		} finally {
			c.close();
		}
		return JdbcGeneStore.openSqlite(db);
	}

	@Override
	protected void tearDown() throws Exception {
		((JdbcGeneStore) store).close();
		FileUtils.deleteQuietly(dir);
	}

	public void testMissingDatabase() {
		try {
			JdbcGeneStore.openSqlite(new File(dir, "missing.db"));
			fail();
		} catch (GeneStoreException e) {
			assertTrue(e.getMessage().contains("missing.db"));
		}
	}

	public void testQueryErrorNamesQueryAndLocation() throws Exception {
		JdbcGeneStore broken = new JdbcGeneStore("jdbc:sqlite:" + new File(dir, "empty.db").getAbsolutePath());
		Location loc = Location.parse("chr1:1-2");
		try {
			broken.closestFeatures(loc, 3, Level.GENE);
			fail();
		} catch (GeneStoreException e) {
			assertEquals("closestFeatures", e.getQuery());
			assertEquals(loc, e.getLocation());
			assertNotNull(e.getCause());
		} finally {
			broken.close();
		}
	}

	private void insertRaw(String values) throws Exception {
		Connection c = DriverManager.getConnection("jdbc:sqlite:" + db.getAbsolutePath());
		try {
			Statement stmt = c.createStatement();
			stmt.executeUpdate("INSERT INTO genes VALUES (" + values + ")");
			stmt.close();
		} finally {
			c.close();
		}
	}

	public void testCorruptRowIsStoreError() throws Exception {
		insertRaw("100, 2, 'chr5', 300, 200, '+', 'G', 'S', 300");
		Location loc = Location.parse("chr5:150-160");
		try {
			store.featuresOverlappingOrNearPromoter(loc, Level.TRANSCRIPT, 2000);
			fail();
		} catch (GeneStoreException e) {
			assertEquals("featuresOverlappingOrNearPromoter", e.getQuery());
			assertEquals(loc, e.getLocation());
			assertTrue(e.getCause() instanceof IllegalArgumentException);
		}
	}

	public void testReopensAfterClose() throws Exception {
		((JdbcGeneStore) store).close();
		assertEquals(list(1), ids(store.featuresWithin(Location.parse("chr1:4500-4600"), Level.GENE)));
	}

	public void testConcurrentQueries() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<List<GenomicFeature>>> futures = new ArrayList<Future<List<GenomicFeature>>>();
			for (int i = 0; i < 20; i++) {
				futures.add(pool.submit(new Callable<List<GenomicFeature>>() {
					public List<GenomicFeature> call() throws GeneStoreException {
						return store.closestFeatures(Location.parse("chr1:7000-7000"), 2, Level.GENE);
					}
				}));
			}
			for (Future<List<GenomicFeature>> f : futures) {
				assertEquals(list(5, 1), ids(f.get()));
			}
		} finally {
			pool.shutdownNow();
		}
	}
}
