package udem.cvmatch.batch;

public record AlgorithmTotals(long comparisons, double timeMs) {

    public static final AlgorithmTotals ZERO = new AlgorithmTotals(0L, 0.0);

    public AlgorithmTotals plus(long moreComparisons, double moreTimeMs) {
        return new AlgorithmTotals(comparisons + moreComparisons, timeMs + moreTimeMs);
    }
}
