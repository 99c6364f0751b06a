package udem.cvmatch.matching;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Knuth-Morris-Pratt search. The text cursor never moves backwards; one comparison is
 * counted per text/pattern character test. Failure tables are cached per pattern so a
 * batch builds each of them once.
 */
public class KmpMatcher implements StringMatcher {

    private final Cache<String, int[]> tables;

    public KmpMatcher() {
        this(10_000);
    }

    public KmpMatcher(int maxCachedPatterns) {
        this.tables = Caffeine.newBuilder()
                .maximumSize(maxCachedPatterns)
                .build();
    }

    /**
     * lps[i] = length of the longest proper prefix of pattern[0..i] that is also its suffix.
     */
    public static int[] failureTable(String pattern) {
        int m = pattern.length();
        int[] lps = new int[m];
        int length = 0;
        int i = 1;
        while (i < m) {
            if (pattern.charAt(i) == pattern.charAt(length)) {
                lps[i++] = ++length;
            } else if (length != 0) {
                length = lps[length - 1];
            } else {
                lps[i++] = 0;
            }
        }
        return lps;
    }

    int[] cachedTable(String pattern) {
        return tables.get(pattern, KmpMatcher::failureTable);
    }

    long cachedTables() {
        tables.cleanUp();
        return tables.estimatedSize();
    }

    @Override
    public SearchResult countOccurrences(String text, String pattern) {
        if (StringMatcher.isDegenerate(text, pattern)) return SearchResult.EMPTY;
        int n = text.length(), m = pattern.length();
        int[] lps = cachedTable(pattern);

        long comparisons = 0;
        int found = 0;
        int i = 0, j = 0;
        while (i < n) {
            comparisons++;
            if (text.charAt(i) == pattern.charAt(j)) {
                i++;
                j++;
                if (j == m) {
                    // boundary-rejected matches still fall back so overlapping hits are not lost
                    if (WordBoundary.isWholeWord(text, i - m, i)) found++;
                    j = lps[j - 1];
                }
            } else if (j != 0) {
                j = lps[j - 1];
            } else {
                i++;
            }
        }
        return new SearchResult(found, comparisons);
    }
}
