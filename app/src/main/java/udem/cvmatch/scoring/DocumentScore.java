package udem.cvmatch.scoring;

public record DocumentScore(
        double mandatoryRatio,     // % of mandatory keywords found, 100 when none configured
        double preferredRatio,     // % of preferred keywords found, 100 when none configured
        double weightedScore,      // final score, after penalty
        boolean penaltyApplied,
        int matchedMandatory,
        int matchedPreferred
) {
}
