package udem.cvmatch.report;

import udem.cvmatch.batch.BatchResult;
import udem.cvmatch.batch.DocumentResult;
import udem.cvmatch.batch.RankedDocument;
import udem.cvmatch.benchmark.AlgorithmRun;
import udem.cvmatch.dto.AlgorithmReportDto;
import udem.cvmatch.dto.BatchReportDto;
import udem.cvmatch.dto.DocumentReportDto;
import udem.cvmatch.scoring.DocumentAnalysis;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shapes analysis results for the report sink.
 */
public final class Reports {

    private Reports() {
    }

    public static BatchReportDto toDto(BatchResult batch) {
        Map<String, BatchReportDto.Totals> algorithms = new LinkedHashMap<>();
        batch.totals().forEach((a, t) ->
                algorithms.put(a.displayName(), new BatchReportDto.Totals(t.comparisons(), t.timeMs())));
        // report lists documents in ranking order
        List<DocumentReportDto> docs = batch.documents().stream()
                .sorted(Comparator.comparing(DocumentResult::ranked, RankedDocument.RANKING))
                .map(Reports::toDto)
                .toList();
        return new BatchReportDto(batch.processed(), batch.skipped(), batch.unprocessed(),
                batch.totalTimeMs(), algorithms, docs);
    }

    public static DocumentReportDto toDto(DocumentResult doc) {
        List<AlgorithmReportDto> results = doc.analysis().performance().runs().values().stream()
                .map(Reports::toDto)
                .toList();
        var score = doc.analysis().score();
        return new DocumentReportDto(doc.documentId(), score.weightedScore(), score.penaltyApplied(), results);
    }

    static AlgorithmReportDto toDto(AlgorithmRun run) {
        return new AlgorithmReportDto(run.algorithm().displayName(), run.timeMs(), run.totalComparisons());
    }

    /**
     * Plain-text report for a single analysed document.
     */
    public static String singleDocument(String documentId, DocumentAnalysis analysis) {
        var sb = new StringBuilder();
        var score = analysis.score();
        sb.append("ANALYSIS REPORT FOR: ").append(documentId).append('\n');
        sb.append("===================================\n");
        sb.append(String.format(Locale.ROOT, "Relevance Score: %.2f%%%n", score.weightedScore()));
        sb.append(String.format(Locale.ROOT, "Mandatory: %.1f%%, Preferred: %.1f%%%s%n",
                score.mandatoryRatio(), score.preferredRatio(),
                score.penaltyApplied() ? " (mandatory skill penalty applied)" : ""));
        appendList(sb, "MATCHED KEYWORDS", analysis.matched());
        appendList(sb, "MISSING KEYWORDS", analysis.missing());
        sb.append("\n--- PERFORMANCE ---\n");
        for (var run : analysis.performance().runs().values()) {
            sb.append(String.format(Locale.ROOT, "%-12s %10.4f ms %,14d comparisons%n",
                    run.algorithm().displayName(), run.timeMs(), run.totalComparisons()));
        }
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String title, List<String> items) {
        sb.append("\n--- ").append(title).append(" ---\n");
        if (items.isEmpty()) sb.append("None\n");
        for (String item : items) sb.append("- ").append(item).append('\n');
    }
}
