package udem.cvmatch.matching;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Algorithm {
    NAIVE("Naive", new NaiveMatcher()),
    RABIN_KARP("Rabin-Karp", new RabinKarpMatcher()),
    KMP("KMP", new KmpMatcher());

    /** Algorithm whose occurrence counts drive scoring. */
    public static final Algorithm SCORING = KMP;

    private final String displayName;
    private final StringMatcher matcher;

    Algorithm(String displayName, StringMatcher matcher) {
        this.displayName = displayName;
        this.matcher = matcher;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public SearchResult search(String text, String pattern) {
        return matcher.countOccurrences(text, pattern);
    }
}
