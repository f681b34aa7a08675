package umms.core.readers;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Strand;
import umms.core.store.InMemoryGeneStore;

/**
 * Reads a tab delimited gene feature table
 * <pre>
 * id	level	chr	start	end	strand	gene_id	gene_symbol
 * </pre>
 * Lines starting with # are skipped, as is a header line starting with "id".
 * The level column takes either the level name or its code. Files ending in .gz are decompressed.
 */
public class GeneFeatureFileReader {

	static Logger logger = Logger.getLogger(GeneFeatureFileReader.class.getName());

	static final int NUM_COLUMNS = 8;

	public static InMemoryGeneStore loadStore(File file) throws IOException {
		return new InMemoryGeneStore(load(file));
	}

	public static List<GenomicFeature> load(File file) throws IOException {
		logger.info("Loading gene features from file " + file.getName() + "...");
		InputStream in = new FileInputStream(file);
		if (file.getName().endsWith(".gz")) {
			try {
				in = new GZIPInputStream(in);
			} catch (IOException e) {
				IOUtils.closeQuietly(in);
				throw e;
			}
		}
		Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
		try {
			List<GenomicFeature> features = load(reader, file.getName());
			logger.info("Loaded " + features.size() + " features.");
			return features;
		} finally {
			IOUtils.closeQuietly(reader);
		}
	}

	/**
	 * @param reader
	 * @param source name used in error messages
	 * @return
	 */
	public static List<GenomicFeature> load(Reader reader, String source) {
		List<GenomicFeature> rtrn = new ArrayList<GenomicFeature>();
		LineIterator itr = new LineIterator(reader);
		int lineNumber = 0;
		while (itr.hasNext()) {
			String line = itr.next();
			lineNumber++;
			if (!looksLikeData(line)) continue;
			rtrn.add(parse(line, source, lineNumber));
			if (rtrn.size() % 100000 == 0) {
				logger.debug("Loaded " + rtrn.size() + " features.");
			}
		}
		return rtrn;
	}

	static boolean looksLikeData(String line) {
		String trimmed = line.trim();
		return trimmed.length() > 0 && !trimmed.startsWith("#") && !trimmed.toLowerCase().startsWith("id\t");
	}

	static GenomicFeature parse(String line, String source, int lineNumber) {
		String[] tokens = line.split("\t");
		if (tokens.length < NUM_COLUMNS) {
			throw new IllegalArgumentException(source + " line " + lineNumber + ": expected " + NUM_COLUMNS
					+ " tab separated columns but found " + tokens.length);
		}
		try {
			return new GenomicFeature(Integer.parseInt(tokens[0].trim()), Level.fromString(tokens[1]), tokens[2].trim(),
					Integer.parseInt(tokens[3].trim()), Integer.parseInt(tokens[4].trim()), Strand.fromString(tokens[5]),
					tokens[6].trim(), tokens[7].trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(source + " line " + lineNumber + ": bad number in \"" + line + "\"", e);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(source + " line " + lineNumber + ": " + e.getMessage(), e);
		}
	}
}
