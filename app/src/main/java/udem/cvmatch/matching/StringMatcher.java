package udem.cvmatch.matching;

/**
 * Exact single-pattern search with whole-word filtering and comparison accounting.
 * Implementations are stateless with respect to their inputs and safe to share between threads.
 */
public interface StringMatcher {

    /**
     * Counts every whole-word occurrence of {@code pattern} in {@code text}.
     * An empty pattern, or one longer than the text, yields {@link SearchResult#EMPTY}.
     */
    SearchResult countOccurrences(String text, String pattern);

    default boolean contains(String text, String pattern) {
        return countOccurrences(text, pattern).found();
    }

    static boolean isDegenerate(String text, String pattern) {
        return pattern == null || text == null || pattern.isEmpty() || pattern.length() > text.length();
    }
}
