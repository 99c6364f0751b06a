package udem.cvmatch.batch;

import org.junit.jupiter.api.Test;
import udem.cvmatch.dto.SourceDocument;
import udem.cvmatch.matching.Algorithm;
import udem.cvmatch.scoring.KeywordClassification;
import udem.cvmatch.scoring.NoKeywordsConfiguredException;
import udem.cvmatch.scoring.ScoringConfig;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BatchAggregatorTest {

    private final KeywordClassification keywords =
            KeywordClassification.of(List.of("Python", "SQL"), List.of("Go"), List.of("Docker"));

    private static List<SourceDocument> corpus() {
        List<SourceDocument> docs = new ArrayList<>();
        docs.add(new SourceDocument("b", "Python and Go"));
        docs.add(new SourceDocument("c", "SQL, Go, Python, Docker"));
        docs.add(new SourceDocument("d", "   "));
        docs.add(new SourceDocument("a", "python / sql / go"));
        docs.add(new SourceDocument("e", null));
        docs.add(null);
        return docs;
    }

    @Test
    void ranksByScoreThenId() {
        var ranked = new ArrayList<>(List.of(
                new RankedDocument("b", 52.0),
                new RankedDocument("a", 80.0),
                new RankedDocument("c", 80.0)));
        ranked.sort(RankedDocument.RANKING);
        assertThat(ranked).containsExactly(
                new RankedDocument("a", 80.0),
                new RankedDocument("c", 80.0),
                new RankedDocument("b", 52.0));
    }

    @Test
    void skipsDocumentsWithoutTextAndRanksTheRest() {
        BatchResult result = new BatchAggregator(ScoringConfig.defaults()).aggregate(corpus(), keywords);

        assertThat(result.processed()).isEqualTo(3);
        assertThat(result.skipped()).isEqualTo(3);
        assertThat(result.ranking()).extracting(RankedDocument::documentId).containsExactly("a", "c", "b");
        assertThat(result.ranking().get(0).score()).isCloseTo(100.0, within(1e-9));
        assertThat(result.ranking().get(2).score()).isCloseTo(52.0, within(1e-9));
        assertThat(result.documents()).extracting(DocumentResult::documentId).containsExactly("b", "c", "a");
    }

    @Test
    void totalsAreSummedOverDocumentsAndKeywords() {
        BatchResult result = new BatchAggregator(ScoringConfig.defaults()).aggregate(corpus(), keywords);

        assertThat(result.totals()).containsOnlyKeys(Algorithm.values());
        for (var algorithm : Algorithm.values()) {
            long expected = result.documents().stream()
                    .mapToLong(d -> d.analysis().performance().run(algorithm).totalComparisons())
                    .sum();
            double expectedTime = result.documents().stream()
                    .mapToDouble(d -> d.analysis().performance().run(algorithm).timeMs())
                    .sum();
            assertThat(result.totals().get(algorithm).comparisons()).isEqualTo(expected).isPositive();
            assertThat(result.totals().get(algorithm).timeMs()).isCloseTo(expectedTime, within(1e-6));
        }
    }

    @Test
    void outputDoesNotDependOnParallelism() {
        BatchResult sequential = new BatchAggregator(ScoringConfig.defaults()).aggregate(corpus(), keywords);
        BatchResult parallel = new BatchAggregator(ScoringConfig.defaults().withParallelism(4))
                .aggregate(corpus(), keywords);

        assertThat(parallel.ranking()).isEqualTo(sequential.ranking());
        assertThat(parallel.documents()).extracting(DocumentResult::documentId)
                .containsExactlyElementsOf(sequential.documents().stream().map(DocumentResult::documentId).toList());
        for (var algorithm : Algorithm.values()) {
            assertThat(parallel.totals().get(algorithm).comparisons())
                    .isEqualTo(sequential.totals().get(algorithm).comparisons());
        }
    }

    @Test
    void emptyCorpusYieldsEmptyResult() {
        BatchResult result = new BatchAggregator(ScoringConfig.defaults()).aggregate(List.of(), keywords);
        assertThat(result.processed()).isZero();
        assertThat(result.ranking()).isEmpty();
        assertThat(result.interrupted()).isFalse();
        assertThat(result.totals()).containsOnlyKeys(Algorithm.values());
        assertThat(result.totals().values()).containsOnly(AlgorithmTotals.ZERO);
    }

    @Test
    void fullySkippedCorpusStillReportsEveryAlgorithm() {
        BatchResult result = new BatchAggregator(ScoringConfig.defaults())
                .aggregate(List.of(new SourceDocument("x", "")), keywords);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.totals()).containsOnlyKeys(Algorithm.values());
        assertThat(result.totals().get(Algorithm.KMP)).isEqualTo(AlgorithmTotals.ZERO);
    }

    @Test
    void interruptedSequentialBatchReportsUnprocessedDocuments() {
        Thread.currentThread().interrupt();
        try {
            BatchResult result = new BatchAggregator(ScoringConfig.defaults()).aggregate(corpus(), keywords);
            assertThat(result.interrupted()).isTrue();
            assertThat(result.processed()).isZero();
            assertThat(result.unprocessed()).isEqualTo(3);
            assertThat(result.skipped()).isEqualTo(3);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void interruptedParallelBatchStopsSubmitting() {
        Thread.currentThread().interrupt();
        try {
            BatchResult result = new BatchAggregator(ScoringConfig.defaults().withParallelism(2))
                    .aggregate(corpus(), keywords);
            assertThat(result.interrupted()).isTrue();
            assertThat(result.processed() + result.unprocessed() + result.skipped()).isEqualTo(corpus().size());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsMissingKeywords() {
        var none = KeywordClassification.of(List.of(), List.of(), List.of());
        assertThatThrownBy(() -> new BatchAggregator(ScoringConfig.defaults()).aggregate(corpus(), none))
                .isInstanceOf(NoKeywordsConfiguredException.class);
    }
}
