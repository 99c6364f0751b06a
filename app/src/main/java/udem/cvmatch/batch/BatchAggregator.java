package udem.cvmatch.batch;

import udem.cvmatch.dto.SourceDocument;
import udem.cvmatch.matching.Algorithm;
import udem.cvmatch.scoring.DocumentAnalysis;
import udem.cvmatch.scoring.DocumentAnalyzer;
import udem.cvmatch.scoring.KeywordClassification;
import udem.cvmatch.scoring.ScoringConfig;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Scores a corpus against one keyword configuration and folds the per-document
 * performance numbers into corpus-wide totals.
 * <p>
 * Documents may be analysed on a worker pool, but results are only merged after every
 * analysis has completed, in input order, so the output does not depend on the pool size.
 */
public class BatchAggregator {

    private final DocumentAnalyzer analyzer;
    private final ScoringConfig config;

    public BatchAggregator(ScoringConfig config) {
        this(new DocumentAnalyzer(), config);
    }

    public BatchAggregator(DocumentAnalyzer analyzer, ScoringConfig config) {
        this.analyzer = analyzer;
        this.config = config.validate();
    }

    public BatchResult aggregate(List<SourceDocument> documents, KeywordClassification keywords) {
        keywords.requireKeywords();
        long start = System.nanoTime();

        List<SourceDocument> usable = new ArrayList<>();
        int skipped = 0;
        for (var d : documents) {
            if (d == null || !d.hasText()) {
                skipped++;
                System.err.println("[Batch] Skipping document without text: " + (d == null ? "null" : d.id()));
                continue;
            }
            usable.add(d);
        }

        List<DocumentResult> results = config.parallelism() > 1
                ? analyzeParallel(usable, keywords)
                : analyzeSequential(usable, keywords);

        BatchResult out = merge(analyzer.algorithms(), results, skipped, usable.size() - results.size(),
                (System.nanoTime() - start) / 1_000_000.0);
        System.out.println("[Batch] Processed " + out.processed() + " documents, skipped " + skipped
                + (out.interrupted() ? ", not processed " + out.unprocessed() : ""));
        return out;
    }

    private List<DocumentResult> analyzeSequential(List<SourceDocument> docs, KeywordClassification keywords) {
        List<DocumentResult> out = new ArrayList<>(docs.size());
        for (var d : docs) {
            if (Thread.currentThread().isInterrupted()) {
                System.err.println("[Batch] Interrupted after " + out.size() + " documents");
                break;
            }
            out.add(analyzeOne(d, keywords));
        }
        return out;
    }

    private List<DocumentResult> analyzeParallel(List<SourceDocument> docs, KeywordClassification keywords) {
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism());
        try {
            List<CompletableFuture<DocumentResult>> futures = new ArrayList<>(docs.size());
            for (var d : docs) {
                if (Thread.currentThread().isInterrupted()) {
                    System.err.println("[Batch] Interrupted after submitting " + futures.size() + " documents");
                    break;
                }
                futures.add(CompletableFuture.supplyAsync(() -> analyzeOne(d, keywords), pool));
            }
            // join barrier: nothing is merged before every document is done
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            pool.shutdownNow();
        }
    }

    private DocumentResult analyzeOne(SourceDocument d, KeywordClassification keywords) {
        DocumentAnalysis analysis = analyzer.analyze(d.text(), keywords, config);
        return new DocumentResult(d.id(), analysis);
    }

    static BatchResult merge(List<Algorithm> algorithms, List<DocumentResult> results, int skipped,
                             int unprocessed, double totalTimeMs) {
        Map<Algorithm, AlgorithmTotals> totals = new EnumMap<>(Algorithm.class);
        for (var a : algorithms) totals.put(a, AlgorithmTotals.ZERO);
        for (var r : results) {
            r.analysis().performance().runs().forEach((algorithm, run) ->
                    totals.merge(algorithm, AlgorithmTotals.ZERO.plus(run.totalComparisons(), run.timeMs()),
                            (a, b) -> a.plus(b.comparisons(), b.timeMs())));
        }
        List<RankedDocument> ranking = results.stream()
                .map(DocumentResult::ranked)
                .sorted(RankedDocument.RANKING)
                .toList();
        return new BatchResult(ranking, List.copyOf(results), Collections.unmodifiableMap(totals),
                skipped, unprocessed, totalTimeMs);
    }
}
