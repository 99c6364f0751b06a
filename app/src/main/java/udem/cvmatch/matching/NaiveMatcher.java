package udem.cvmatch.matching;

public class NaiveMatcher implements StringMatcher {

    @Override
    public SearchResult countOccurrences(String text, String pattern) {
        if (StringMatcher.isDegenerate(text, pattern)) return SearchResult.EMPTY;
        int n = text.length(), m = pattern.length();
        long comparisons = 0;
        int found = 0;

        for (int i = 0; i <= n - m; i++) {
            int j = 0;
            while (j < m) {
                comparisons++;
                if (text.charAt(i + j) != pattern.charAt(j)) break;
                j++;
            }
            if (j == m && WordBoundary.isWholeWord(text, i, i + m)) found++;
        }
        return new SearchResult(found, comparisons);
    }
}
