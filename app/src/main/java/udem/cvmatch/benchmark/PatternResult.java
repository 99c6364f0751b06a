package udem.cvmatch.benchmark;

public record PatternResult(
        String pattern,
        int occurrences,
        long comparisons
) {
    public boolean matched() {
        return occurrences > 0;
    }
}
