package umms.locannot;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.Logger;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.annotation.TSSRegion;
import umms.core.exception.GeneStoreException;
import umms.core.readers.GeneFeatureFileReader;
import umms.core.readers.LocationFileReader;
import umms.core.store.GeneStore;
import umms.core.store.JdbcGeneStore;
import umms.core.util.CLUtil;
import umms.core.util.CLUtil.ArgumentMap;

/**
 * Command line entry point. Annotates genomic locations with nearby genes.
 */
public class AnnotateLocations {

	static final String usage = "Usage: AnnotateLocations -task <task name> "+
			"\n\tTASK 1: annotate: Genes each location is promoter/exonic/intronic for, and its closest genes [default]" +
			"\n\tTASK 2: within: Features of a level overlapping each location" +
			"\n\tTASK 3: closest: The n features of a level closest to each location" +
			"\n**************************************************************"+
			"\n\t\tMANDATORY arguments"+
			"\n**************************************************************"+
			"\n\t\t-db <SQLite gene database>"+
			"\n\t\t\t OR"+
			"\n\t\t-jdbc <JDBC url of a gene database>"+
			"\n\t\t\t OR"+
			"\n\t\t-genes <Tab delimited gene feature file: id level chr start end strand gene_id gene_symbol>"+
			"\n\n\t\t-in <File of locations, one chr:start-end or BED line per line>"+
			"\n\t\t\t AND/OR"+
			"\n\t\t-location <chr:start-end, may be repeated>"+
			"\n\n**************************************************************"+
			"\n\t\tOPTIONAL arguments"+
			"\n**************************************************************"+
			"\n\t\t-out <Output file [Defaults to stdout]>"+
			"\n\t\t-tss5p <Promoter bases upstream of the TSS. Default 2000>"+
			"\n\t\t-tss3p <Promoter bases downstream of the TSS. Default 1000>"+
			"\n\t\t-n <Number of closest genes to report. Default 10>"+
			"\n\t\t-threads <Number of locations annotated in parallel. Default 1>"+
			"\n\t\t-format <tsv or json. Default tsv>"+
			"\n\t\t-failFast <Stop at the first location that cannot be annotated>"+
			"\n\t\t-level <gene, transcript or exon, for the within and closest tasks. Default gene>"+
			"\n\t\t-debug <Verbose logging>"+
			"\n";

	static Logger logger = Logger.getLogger(AnnotateLocations.class.getName());

	static final int DEFAULT_TSS_5P = 2000;
	static final int DEFAULT_TSS_3P = 1000;
	static final int DEFAULT_CLOSEST_N = 10;

	static final int EXIT_OK = 0;
	static final int EXIT_USAGE = 1;
	static final int EXIT_FAILED_LOCATIONS = 2;

	public static void main(String[] args) {
		System.exit(run(args));
	}

	/**
	 * @param args
	 * @return process exit status
	 */
	public static int run(String[] args) {
		ArgumentMap argMap;
		List<Location> locations;
		try {
			argMap = CLUtil.getParameters(args, usage, "annotate");
			if (argMap.isPresent("debug")) {
				Logger.getRootLogger().setLevel(org.apache.log4j.Level.DEBUG);
			}
			locations = readLocations(argMap);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			return EXIT_USAGE;
		} catch (IOException e) {
			logger.error("Could not read locations: " + e.getMessage(), e);
			return EXIT_USAGE;
		}

		try {
			String task = argMap.getTask();
			if ("annotate".equalsIgnoreCase(task)) {
				return annotate(argMap, locations);
			} else if ("within".equalsIgnoreCase(task) || "closest".equalsIgnoreCase(task)) {
				return listFeatures(argMap, locations, "closest".equalsIgnoreCase(task));
			}
			throw new IllegalArgumentException("Unknown task " + task + "\n" + usage);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			return EXIT_USAGE;
		} catch (GeneStoreException e) {
			logger.error(e.getMessage(), e);
			return EXIT_FAILED_LOCATIONS;
		} catch (IOException e) {
			logger.error("I/O error: " + e.getMessage(), e);
			return EXIT_FAILED_LOCATIONS;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted", e);
			return EXIT_FAILED_LOCATIONS;
		}
	}

	static List<Location> readLocations(ArgumentMap argMap) throws IOException {
		List<Location> locations = new ArrayList<Location>();
		if (argMap.hasInputFile()) {
			locations.addAll(LocationFileReader.load(new File(argMap.getInput())));
		}
		for (String text : argMap.getAll("location")) {
			locations.add(Location.parse(text));
		}
		if (locations.isEmpty()) {
			throw new IllegalArgumentException("Argument in or location must be provided\n" + usage);
		}
		return locations;
	}

	/**
	 * Opens the gene store named on the command line.
	 */
	static GeneStore openStore(ArgumentMap argMap) throws IOException, GeneStoreException {
		if (argMap.isPresent("db")) {
			return JdbcGeneStore.openSqlite(new File(argMap.getMandatory("db")));
		} else if (argMap.isPresent("jdbc")) {
			return new JdbcGeneStore(argMap.getMandatory("jdbc"));
		} else if (argMap.isPresent("genes")) {
			return GeneFeatureFileReader.loadStore(new File(argMap.getMandatory("genes")));
		}
		throw new IllegalArgumentException("Argument db, jdbc or genes must be provided\n" + usage);
	}

	static TSSRegion getTSSRegion(ArgumentMap argMap) {
		return new TSSRegion(argMap.getInteger("tss5p", DEFAULT_TSS_5P), argMap.getInteger("tss3p", DEFAULT_TSS_3P));
	}

	private static int annotate(ArgumentMap argMap, List<Location> locations) throws IOException, GeneStoreException, InterruptedException {
		TSSRegion tssRegion = getTSSRegion(argMap);
		int n = argMap.getInteger("n", DEFAULT_CLOSEST_N);
		int threads = argMap.getInteger("threads", 1);
		if (threads < 1) {
			throw new IllegalArgumentException("Argument threads must be positive\n" + usage);
		}
		String format = argMap.get("format", "tsv");
		if (!"tsv".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
			throw new IllegalArgumentException("Unknown format " + format + "\n" + usage);
		}
		boolean failFast = argMap.isPresent("failFast");

		logger.info("Annotating " + locations.size() + " locations with TSS region " + tssRegion + ", " + n
				+ " closest genes, " + threads + " threads");

		GeneStore store = openStore(argMap);
		ExecutorService queryPool = threads > 1 ? Executors.newFixedThreadPool(threads) : null;
		ExecutorService workers = Executors.newFixedThreadPool(threads);
		try {
			Annotator annotator = new Annotator(store, tssRegion, n, queryPool);
			List<BatchAnnotator.Result> results = new BatchAnnotator(annotator, workers, failFast).annotate(locations);

			int failed = 0;
			BufferedWriter bw = argMap.getOutputWriter();
			try {
				if ("json".equalsIgnoreCase(format)) {
					GeneAnnotationJsonWriter writer = new GeneAnnotationJsonWriter(bw);
					for (BatchAnnotator.Result result : results) {
						if (result.isFailed()) failed++;
						else writer.write(result.getAnnotation());
					}
					writer.finish();
				} else {
					GeneTableWriter writer = new GeneTableWriter(bw, tssRegion, n);
					writer.writeHeader();
					for (BatchAnnotator.Result result : results) {
						if (result.isFailed()) failed++;
						else writer.write(result.getAnnotation());
					}
					writer.flush();
				}
			} finally {
				closeOutput(argMap, bw);
			}
			if (failed > 0) {
				logger.error(failed + " of " + locations.size() + " locations could not be annotated");
				return EXIT_FAILED_LOCATIONS;
			}
			return EXIT_OK;
		} finally {
			workers.shutdownNow();
			if (queryPool != null) {
				queryPool.shutdownNow();
				queryPool.awaitTermination(10, TimeUnit.SECONDS);
			}
			closeStore(store);
		}
	}

	private static int listFeatures(ArgumentMap argMap, List<Location> locations, boolean closest) throws IOException, GeneStoreException {
		Level level = Level.fromString(argMap.get("level", "gene"));
		int n = argMap.getInteger("n", DEFAULT_CLOSEST_N);
		if (closest && n < 1) {
			throw new IllegalArgumentException("Argument n must be positive\n" + usage);
		}
		GeneStore store = openStore(argMap);
		BufferedWriter bw = argMap.getOutputWriter();
		try {
			bw.write("Location\tID\tLevel\tChr\tStart\tEnd\tStrand\tGene ID\tGene Symbol\tTSS Distance");
			bw.newLine();
			for (Location location : locations) {
				List<GenomicFeature> features = closest ? store.closestFeatures(location, n, level) : store.featuresWithin(location, level);
				logger.debug(location + ": " + features.size() + " " + level + " features");
				for (GenomicFeature f : features) {
					bw.write(location + "\t" + f.getId() + "\t" + f.getLevel() + "\t" + f.getChr() + "\t" + f.getStart() + "\t"
							+ f.getEnd() + "\t" + f.getStrand() + "\t" + f.getGeneId() + "\t" + f.getGeneSymbol() + "\t" + f.getDist());
					bw.newLine();
				}
			}
			bw.flush();
		} finally {
			closeOutput(argMap, bw);
			closeStore(store);
		}
		return EXIT_OK;
	}

	/*
	 * stdout stays open.
	 */
	private static void closeOutput(ArgumentMap argMap, BufferedWriter bw) throws IOException {
		if (argMap.isOutputSet()) {
			bw.close();
		} else {
			bw.flush();
		}
	}

	private static void closeStore(GeneStore store) {
		if (store instanceof JdbcGeneStore) {
			((JdbcGeneStore) store).close();
		}
	}
}
