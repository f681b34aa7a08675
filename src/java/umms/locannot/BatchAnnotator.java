package umms.locannot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import umms.core.annotation.Location;
import umms.core.exception.GeneStoreException;

/**
 * Annotates many locations at once, one task per location on a worker pool.
 * Results come back in input order. A location whose annotation fails is logged and
 * reported as failed while the others carry on, unless the batch is fail-fast.
 */
public class BatchAnnotator {

	static Logger logger = Logger.getLogger(BatchAnnotator.class.getName());

	private final Annotator annotator;
	private final ExecutorService workers;
	private final boolean failFast;

	/**
	 * @param annotator
	 * @param workers pool running one annotation per task; must differ from the annotator's query pool
	 * @param failFast stop at the first failing location
	 */
	public BatchAnnotator(Annotator annotator, ExecutorService workers, boolean failFast) {
		this.annotator = annotator;
		this.workers = workers;
		this.failFast = failFast;
	}

	/**
	 * Outcome for one location: an annotation or the error that stopped it.
	 */
	public static final class Result {
		private final Location location;
		private final GeneAnnotation annotation;
		private final GeneStoreException error;

		Result(Location location, GeneAnnotation annotation, GeneStoreException error) {
			this.location = location;
			this.annotation = annotation;
			this.error = error;
		}

		public Location getLocation() {
			return location;
		}

		public GeneAnnotation getAnnotation() {
			return annotation;
		}

		public GeneStoreException getError() {
			return error;
		}

		public boolean isFailed() {
			return error != null;
		}
	}

	/**
	 * @param locations
	 * @return one result per location, in the same order
	 * @throws GeneStoreException only when fail-fast, for the first failing location in input order
	 * @throws InterruptedException
	 * @throws RuntimeException rethrown as is when a worker fails with something other than a store error
	 */
	public List<Result> annotate(List<Location> locations) throws GeneStoreException, InterruptedException {
		List<Future<GeneAnnotation>> futures = new ArrayList<Future<GeneAnnotation>>(locations.size());
		for (final Location location : locations) {
			futures.add(workers.submit(new Callable<GeneAnnotation>() {
				public GeneAnnotation call() throws GeneStoreException {
					return annotator.annotate(location);
				}
			}));
		}

		List<Result> results = new ArrayList<Result>(locations.size());
		int failed = 0;
		try {
			for (int i = 0; i < locations.size(); i++) {
				Location location = locations.get(i);
				try {
					results.add(new Result(location, futures.get(i).get(), null));
				} catch (ExecutionException e) {
					GeneStoreException error = toStoreException(location, e.getCause());
					if (failFast) {
						throw error;
					}
					failed++;
					logger.error("Could not annotate " + location + ": " + error.getMessage(), error);
					results.add(new Result(location, null, error));
				}
				if ((i + 1) % 1000 == 0) {
					logger.info("Annotated " + (i + 1) + " of " + locations.size() + " locations");
				}
			}
		} finally {
			if (results.size() < locations.size()) {
				for (Future<GeneAnnotation> f : futures) {
					f.cancel(true);
				}
			}
		}
		logger.info("Annotated " + (locations.size() - failed) + " locations, " + failed + " failed");
		return results;
	}

	/*
	 * Only store failures are recorded per location, anything else is a bug and ends the batch.
	 */
	private static GeneStoreException toStoreException(Location location, Throwable cause) {
		if (cause instanceof GeneStoreException) {
			return (GeneStoreException) cause;
		}
		if (cause instanceof RuntimeException) {
			throw (RuntimeException) cause;
		}
		if (cause instanceof Error) {
			throw (Error) cause;
		}
		return new GeneStoreException("annotate", location, cause);
	}
}
