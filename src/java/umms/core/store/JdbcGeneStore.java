package umms.core.store;

import java.io.Closeable;
import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.annotation.Strand;
import umms.core.exception.GeneStoreException;

/**
 * Gene store backed by a SQL table
 * <pre>
 * genes(id, level, chr, start, end, strand, gene_id, gene_symbol, stranded_start)
 * </pre>
 * where level is the {@link Level} code and stranded_start is the TSS of the row.
 * Each querying thread gets its own connection; all of them are closed by {@link #close()}.
 */
public class JdbcGeneStore implements GeneStore, Closeable {

	static Logger logger = Logger.getLogger(JdbcGeneStore.class.getName());

	static final String COLUMNS = "id, level, chr, start, \"end\", strand, gene_id, gene_symbol, stranded_start - ?";

	static final String WITHIN_GENE_AND_PROMOTER_SQL = "SELECT " + COLUMNS
			+ " FROM genes WHERE level = ? AND chr = ? AND start - ? <= ? AND \"end\" + ? >= ?"
			+ " ORDER BY start ASC, id ASC";

	static final String IN_EXON_SQL = "SELECT " + COLUMNS
			+ " FROM genes WHERE level = " + Level.EXON.getCode() + " AND gene_id = ? AND chr = ? AND start <= ? AND \"end\" >= ?"
			+ " ORDER BY start ASC, id ASC";

	static final String CLOSEST_GENE_SQL = "SELECT " + COLUMNS
			+ " FROM genes WHERE level = ? AND chr = ?"
			+ " ORDER BY ABS(stranded_start - ?) ASC, start ASC, id ASC LIMIT ?";

	private final String url;
	private final ThreadLocal<Connection> connection = new ThreadLocal<Connection>();
	private final List<Connection> connections = Collections.synchronizedList(new ArrayList<Connection>());

	/**
	 * @param url JDBC url, e.g. jdbc:sqlite:/data/grch38.db
	 */
	public JdbcGeneStore(String url) {
		this.url = url;
	}

	/**
	 * Opens a SQLite gene database file.
	 */
	public static JdbcGeneStore openSqlite(File db) throws GeneStoreException {
		if (!db.exists()) {
			throw new GeneStoreException("Gene database " + db.getAbsolutePath() + " not found");
		}
		JdbcGeneStore store = new JdbcGeneStore("jdbc:sqlite:" + db.getAbsolutePath());
		logger.info("Using gene database " + db.getAbsolutePath());
		return store;
	}

	private Connection getConnection() throws SQLException {
		Connection c = connection.get();
		if (c == null || c.isClosed()) {
			c = DriverManager.getConnection(url);
			connection.set(c);
			connections.add(c);
			logger.debug("Opened connection to " + url + " on " + Thread.currentThread().getName());
		}
		return c;
	}

	@Override
	public List<GenomicFeature> featuresWithin(Location location, Level level) throws GeneStoreException {
		return query("featuresWithin", location, WITHIN_GENE_AND_PROMOTER_SQL, location.getMid(), level.getCode(),
				location.getChr(), 0, location.getEnd(), 0, location.getStart());
	}

	@Override
	public List<GenomicFeature> featuresOverlappingOrNearPromoter(Location location, Level level, int pad) throws GeneStoreException {
		return query("featuresOverlappingOrNearPromoter", location, WITHIN_GENE_AND_PROMOTER_SQL, location.getMid(),
				level.getCode(), location.getChr(), pad, location.getEnd(), pad, location.getStart());
	}

	@Override
	public List<GenomicFeature> featuresInExon(Location location, String geneId) throws GeneStoreException {
		return query("featuresInExon", location, IN_EXON_SQL, location.getMid(), geneId, location.getChr(),
				location.getEnd(), location.getStart());
	}

	@Override
	public List<GenomicFeature> closestFeatures(Location location, int n, Level level) throws GeneStoreException {
		if (n < 1) {
			throw new IllegalArgumentException("Number of closest features must be positive, got " + n);
		}
		return query("closestFeatures", location, CLOSEST_GENE_SQL, location.getMid(), level.getCode(),
				location.getChr(), location.getMid(), n);
	}

	private List<GenomicFeature> query(String name, Location location, String sql, Object... params) throws GeneStoreException {
		List<GenomicFeature> rtrn = new ArrayList<GenomicFeature>();
		try {
			PreparedStatement stmt = getConnection().prepareStatement(sql);
			try {
				for (int i = 0; i < params.length; i++) {
					stmt.setObject(i + 1, params[i]);
				}
				ResultSet rs = stmt.executeQuery();
				try {
					while (rs.next()) {
						rtrn.add(toFeature(rs));
					}
				} finally {
					rs.close();
				}
			} finally {
				stmt.close();
			}
		} catch (SQLException e) {
			throw new GeneStoreException(name, location, e);
		} catch (IllegalArgumentException e) {
			// malformed row, e.g. start after end or an unknown level code
			throw new GeneStoreException(name, location, e);
		}
		return rtrn;
	}

	/*
	 * The last column is stranded_start - mid, the signed TSS distance.
	 */
	private static GenomicFeature toFeature(ResultSet rs) throws SQLException {
		return new GenomicFeature(rs.getInt(1), Level.fromCode(rs.getInt(2)), rs.getString(3), rs.getInt(4),
				rs.getInt(5), Strand.fromString(rs.getString(6)), rs.getString(7), rs.getString(8), rs.getInt(9));
	}

	@Override
	public void close() {
		synchronized (connections) {
			for (Connection c : connections) {
				try {
					c.close();
				} catch (SQLException e) {
					logger.warn("Could not close connection to " + url, e);
				}
			}
			connections.clear();
		}
	}
}
