package udem.cvmatch.matching;

public record SearchResult(
        int occurrences,           // whole-word matches
        long comparisons           // primitive comparisons, algorithm specific
) {
    public static final SearchResult EMPTY = new SearchResult(0, 0L);

    public boolean found() {
        return occurrences > 0;
    }
}
