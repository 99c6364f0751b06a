package udem.cvmatch.scoring;

import java.util.Set;

/**
 * Weighted relevance score with a multiplicative penalty for missing mandatory keywords.
 */
public final class ScoringEngine {

    private ScoringEngine() {
    }

    /**
     * @param matched keywords (as they appear in the classification) found in the document
     */
    public static DocumentScore score(Set<String> matched, KeywordClassification keywords, ScoringConfig config) {
        int mandatoryHits = (int) keywords.mandatory().stream().filter(matched::contains).count();
        int preferredHits = (int) keywords.preferred().stream().filter(matched::contains).count();

        double mandatoryRatio = ratio(mandatoryHits, keywords.mandatory().size());
        double preferredRatio = ratio(preferredHits, keywords.preferred().size());
        double weighted = mandatoryRatio * config.mandatoryWeight() + preferredRatio * config.preferredWeight();

        boolean penalty = mandatoryHits < keywords.mandatory().size();
        if (penalty) weighted *= 1.0 - config.penaltyPercent() / 100.0;

        return new DocumentScore(mandatoryRatio, preferredRatio, weighted, penalty, mandatoryHits, preferredHits);
    }

    /**
     * An empty requirement set is vacuously satisfied.
     */
    static double ratio(int hits, int total) {
        if (total == 0) return 100.0;
        return 100.0 * hits / total;
    }
}
