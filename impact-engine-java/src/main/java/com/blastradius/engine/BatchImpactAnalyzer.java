package com.blastradius.engine;

import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent analyses in parallel on a fixed pool of worker threads.
 *
 * Each request gets its own graph; workers share nothing but the immutable
 * configuration.
 */
public class BatchImpactAnalyzer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchImpactAnalyzer.class);

    private final ImpactAnalyzer analyzer;
    private final ExecutorService executor;

    public BatchImpactAnalyzer(ImpactAnalyzer analyzer) {
        this(analyzer, Runtime.getRuntime().availableProcessors());
    }

    public BatchImpactAnalyzer(ImpactAnalyzer analyzer, int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        this.analyzer = analyzer;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "impact-analysis-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Analyzes every request and returns the results in request order.
     *
     * @throws BatchAnalysisException wrapping the first failure in request order
     */
    public List<ImpactAnalysis> analyzeAll(List<AnalysisRequest> requests) {
        analyzer.getConfig().validate();

        List<Future<ImpactAnalysis>> futures = new ArrayList<>();
        for (AnalysisRequest request : requests) {
            futures.add(executor.submit(() -> analyzer.analyze(request.before(), request.after())));
        }

        List<ImpactAnalysis> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            AnalysisRequest request = requests.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                cancelRemaining(futures);
                throw new BatchAnalysisException("Analysis '" + request.name() + "' failed: "
                        + e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRemaining(futures);
                throw new BatchAnalysisException("Interrupted while waiting for '" + request.name() + "'", e);
            }
        }
        log.debug("Batch of {} analyses complete", results.size());
        return results;
    }

    private static void cancelRemaining(List<Future<ImpactAnalysis>> futures) {
        for (Future<ImpactAnalysis> f : futures) f.cancel(true);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One independent unit of work, e.g. one changed file.
     */
    public record AnalysisRequest(String name, List<StructuralSummary> before, List<StructuralSummary> after) {

        public AnalysisRequest {
            before = Collections.unmodifiableList(new ArrayList<>(before));
            after = Collections.unmodifiableList(new ArrayList<>(after));
        }
    }

    public static class BatchAnalysisException extends RuntimeException {
        public BatchAnalysisException(String message, Throwable cause) { super(message, cause); }
    }
}
