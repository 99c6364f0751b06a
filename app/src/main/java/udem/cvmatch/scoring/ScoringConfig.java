package udem.cvmatch.scoring;

import java.util.Locale;

/**
 * Scoring and matching options for one analysis or batch.
 *
 * @param mandatoryWeight share of the score driven by mandatory keywords
 * @param preferredWeight share driven by preferred keywords; the two weights sum to 1.0
 * @param penaltyPercent  score reduction applied when any mandatory keyword is missing, in [0,100]
 * @param caseSensitive   when false, text and keywords are lower-cased identically
 * @param normalizeText   run {@code TextNormalizer.clean} on documents and keywords before matching
 * @param parallelism     worker threads used by the batch aggregator
 */
public record ScoringConfig(
        double mandatoryWeight,
        double preferredWeight,
        double penaltyPercent,
        boolean caseSensitive,
        boolean normalizeText,
        int parallelism
) {
    public static final double DEFAULT_MANDATORY_WEIGHT = 0.70;
    public static final double DEFAULT_PREFERRED_WEIGHT = 0.30;
    public static final double DEFAULT_PENALTY_PERCENT = 20.0;

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public static ScoringConfig defaults() {
        return new ScoringConfig(DEFAULT_MANDATORY_WEIGHT, DEFAULT_PREFERRED_WEIGHT, DEFAULT_PENALTY_PERCENT,
                false, false, 1);
    }

    public ScoringConfig validate() {
        if (!Double.isFinite(mandatoryWeight) || !Double.isFinite(preferredWeight)
                || mandatoryWeight < 0 || preferredWeight < 0)
            throw new IllegalArgumentException("Weights must be finite and non-negative: "
                    + mandatoryWeight + "/" + preferredWeight);
        if (Math.abs(mandatoryWeight + preferredWeight - 1.0) > WEIGHT_TOLERANCE)
            throw new IllegalArgumentException("Weights must sum to 1.0, got "
                    + (mandatoryWeight + preferredWeight));
        if (!(penaltyPercent >= 0 && penaltyPercent <= 100))
            throw new IllegalArgumentException("Penalty must be in [0,100]: " + penaltyPercent);
        if (parallelism < 1)
            throw new IllegalArgumentException("Parallelism must be >= 1: " + parallelism);
        return this;
    }

    public ScoringConfig withPenaltyPercent(double penalty) {
        return new ScoringConfig(mandatoryWeight, preferredWeight, penalty, caseSensitive, normalizeText, parallelism);
    }

    public ScoringConfig withWeights(double mandatory, double preferred) {
        return new ScoringConfig(mandatory, preferred, penaltyPercent, caseSensitive, normalizeText, parallelism);
    }

    public ScoringConfig withCaseSensitive(boolean flag) {
        return new ScoringConfig(mandatoryWeight, preferredWeight, penaltyPercent, flag, normalizeText, parallelism);
    }

    public ScoringConfig withNormalizeText(boolean flag) {
        return new ScoringConfig(mandatoryWeight, preferredWeight, penaltyPercent, caseSensitive, flag, parallelism);
    }

    public ScoringConfig withParallelism(int threads) {
        return new ScoringConfig(mandatoryWeight, preferredWeight, penaltyPercent, caseSensitive, normalizeText, threads);
    }

    /**
     * Case folding applied to both documents and keywords.
     */
    public String fold(String s) {
        if (s == null) return null;
        return caseSensitive ? s : s.toLowerCase(Locale.ROOT);
    }
}
