package udem.cvmatch.batch;

import udem.cvmatch.matching.Algorithm;

import java.util.List;
import java.util.Map;

/**
 * @param ranking     documents by descending score, ties by ascending id
 * @param documents   per-document results in input order
 * @param totals      per-algorithm comparisons and time summed over all documents and keywords
 * @param skipped     documents without extractable text
 * @param unprocessed documents left out because the batch was interrupted
 * @param totalTimeMs wall-clock duration of the whole batch
 */
public record BatchResult(
        List<RankedDocument> ranking,
        List<DocumentResult> documents,
        Map<Algorithm, AlgorithmTotals> totals,
        int skipped,
        int unprocessed,
        double totalTimeMs
) {
    public int processed() {
        return documents.size();
    }

    public boolean interrupted() {
        return unprocessed > 0;
    }
}
