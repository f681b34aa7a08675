package umms.locannot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import org.apache.log4j.Logger;

import umms.core.annotation.GenomicFeature;
import umms.core.annotation.Level;
import umms.core.annotation.Location;
import umms.core.annotation.TSSRegion;
import umms.core.exception.GeneStoreException;
import umms.core.store.GeneStore;

/**
 * Annotates a location with the genes whose body or promoter it falls in, and with the
 * n genes whose TSS is closest to it.
 * <p>
 * An annotator keeps no state between calls. If it is given a query pool, the closest
 * gene query runs alongside the overlap query and the exon lookups fan out over the pool.
 * Otherwise every query runs on the calling thread. The query pool must not be the pool
 * that calls {@link #annotate(Location)}, or callers can starve the queries they wait on.
 */
public class Annotator {

	static Logger logger = Logger.getLogger(Annotator.class.getName());

	private final GeneStore store;
	private final Classifier classifier;
	private final int n;
	private final ExecutorService queryPool;

	public Annotator(GeneStore store, TSSRegion tssRegion, int n) {
		this(store, tssRegion, n, null);
	}

	/**
	 * @param store
	 * @param tssRegion promoter window
	 * @param n number of closest genes to report
	 * @param queryPool pool for store queries, null to query on the calling thread
	 */
	public Annotator(GeneStore store, TSSRegion tssRegion, int n, ExecutorService queryPool) {
		if (n < 1) {
			throw new IllegalArgumentException("Number of closest genes must be positive, got " + n);
		}
		this.store = store;
		this.classifier = new Classifier(tssRegion);
		this.n = n;
		this.queryPool = queryPool;
	}

	public TSSRegion getTSSRegion() {
		return classifier.getTSSRegion();
	}

	/**
	 * @param location
	 * @return the annotation of location
	 * @throws GeneStoreException if any store query fails, nothing partial is returned
	 */
	public GeneAnnotation annotate(final Location location) throws GeneStoreException {
		List<Future<?>> pending = new ArrayList<Future<?>>();
		try {
			Future<List<GenomicFeature>> closestQuery = submit(new Callable<List<GenomicFeature>>() {
				public List<GenomicFeature> call() throws GeneStoreException {
					return store.closestFeatures(location, n, Level.GENE);
				}
			}, pending);

			// widen by the larger offset so promoter-only hits on either strand are found
			List<GenomicFeature> genesWithin = store.featuresOverlappingOrNearPromoter(location, Level.TRANSCRIPT,
					getTSSRegion().getMaxOffset());

			// one exon lookup per gene, reused for the closest genes
			Map<String, Future<Boolean>> exonHits = new LinkedHashMap<String, Future<Boolean>>();
			for (GenomicFeature gene : genesWithin) {
				inExon(location, gene.getGeneId(), exonHits, pending);
			}

			GeneAggregator aggregator = new GeneAggregator();
			for (GenomicFeature gene : genesWithin) {
				boolean isExon = get(exonHits.get(gene.getGeneId()));
				aggregator.add(gene, classifier.classify(location, gene, isExon));
			}

			List<GenomicFeature> closest = get(closestQuery);
			for (GenomicFeature feature : closest) {
				if (!classifier.isOutsideWindow(location, feature)) {
					inExon(location, feature.getGeneId(), exonHits, pending);
				}
			}
			List<ClosestGene> closestGenes = new ArrayList<ClosestGene>(closest.size());
			for (GenomicFeature feature : closest) {
				Classification c;
				if (classifier.isOutsideWindow(location, feature)) {
					c = Classification.intergenic(Classifier.signedDistance(location, feature));
				} else {
					c = classifier.classify(location, feature, get(exonHits.get(feature.getGeneId())));
				}
				closestGenes.add(new ClosestGene(feature.getGeneId(), feature.getGeneSymbol(), c.getLabel(), c.getDistance()));
			}

			GeneAnnotation annotation = aggregator.toAnnotation(location, closestGenes);
			if (logger.isDebugEnabled()) {
				logger.debug(location + " within " + aggregator.size() + " genes: " + annotation.getGeneIdsString() + " "
						+ annotation.getGeneSymbolsString() + " " + annotation.getLabelsString() + " "
						+ annotation.getTssDistancesString());
			}
			return annotation;
		} catch (GeneStoreException e) {
			cancel(pending);
			throw e;
		} catch (RuntimeException e) {
			cancel(pending);
			throw e;
		}
	}

	private void inExon(final Location location, final String geneId, Map<String, Future<Boolean>> exonHits,
			List<Future<?>> pending) {
		if (exonHits.containsKey(geneId)) return;
		exonHits.put(geneId, submit(new Callable<Boolean>() {
			public Boolean call() throws GeneStoreException {
				return !store.featuresInExon(location, geneId).isEmpty();
			}
		}, pending));
	}

	private <T> Future<T> submit(Callable<T> query, List<Future<?>> pending) {
		FutureTask<T> task = new FutureTask<T>(query);
		pending.add(task);
		if (queryPool == null) {
			task.run();
		} else {
			queryPool.execute(task);
		}
		return task;
	}

	/*
	 * Waits for a query and hands back the store error it failed with.
	 */
	private static <T> T get(Future<T> query) throws GeneStoreException {
		try {
			return query.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GeneStoreException("Interrupted while waiting for a gene store query", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof GeneStoreException) {
				throw (GeneStoreException) cause;
			}
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new GeneStoreException("Gene store query failed", cause);
		}
	}

	private static void cancel(List<Future<?>> pending) {
		for (Future<?> f : pending) {
			f.cancel(true);
		}
	}
}
