package udem.cvmatch.matching;

/**
 * Rolling polynomial hash over a fixed base and modulus. Every window costs one comparison
 * for the hash test; windows whose hash matches are verified character by character, one
 * comparison per character checked.
 */
public class RabinKarpMatcher implements StringMatcher {

    public static final long DEFAULT_BASE = 256L;
    /** Mersenne prime 2^61 - 1. */
    public static final long DEFAULT_MODULUS = 2_305_843_009_213_693_951L;

    private final long base;
    private final long modulus;

    public RabinKarpMatcher() {
        this(DEFAULT_BASE, DEFAULT_MODULUS);
    }

    public RabinKarpMatcher(long base, long modulus) {
        if (base < 1) throw new IllegalArgumentException("base must be positive: " + base);
        if (modulus < 1 || modulus > DEFAULT_MODULUS)
            throw new IllegalArgumentException("modulus must be in [1, 2^61-1]: " + modulus);
        this.base = base % modulus;
        this.modulus = modulus;
    }

    @Override
    public SearchResult countOccurrences(String text, String pattern) {
        if (StringMatcher.isDegenerate(text, pattern)) return SearchResult.EMPTY;
        int n = text.length(), m = pattern.length();

        long patHash = hash(pattern, m);
        long winHash = hash(text, m);
        long lead = power(m - 1); // base^(m-1) mod modulus

        long comparisons = 0;
        int found = 0;
        for (int i = 0; i <= n - m; i++) {
            comparisons++;
            if (winHash == patHash) {
                int j = 0;
                while (j < m) {
                    comparisons++;
                    if (text.charAt(i + j) != pattern.charAt(j)) break;
                    j++;
                }
                if (j == m && WordBoundary.isWholeWord(text, i, i + m)) found++;
            }
            if (i < n - m) winHash = roll(winHash, text.charAt(i), text.charAt(i + m), lead);
        }
        return new SearchResult(found, comparisons);
    }

    /**
     * Hash of the first {@code len} characters of {@code s}.
     */
    long hash(CharSequence s, int len) {
        long h = 0;
        for (int i = 0; i < len; i++) {
            h = addMod(mulMod(h, base), s.charAt(i) % modulus);
        }
        return h;
    }

    long roll(long hash, char outgoing, char incoming, long lead) {
        long h = hash - mulMod(lead, outgoing);
        if (h < 0) h += modulus;
        return addMod(mulMod(h, base), incoming % modulus);
    }

    long power(int exp) {
        long result = 1 % modulus;
        for (int i = 0; i < exp; i++) result = mulMod(result, base);
        return result;
    }

    private long addMod(long a, long b) {
        long s = a + b; // both < 2^61, no overflow
        return s >= modulus ? s - modulus : s;
    }

    // shift-and-add keeps every intermediate below 2^62
    private long mulMod(long a, long b) {
        long result = 0;
        a %= modulus;
        while (b > 0) {
            if ((b & 1L) != 0) result = addMod(result, a);
            a = addMod(a, a);
            b >>= 1;
        }
        return result;
    }
}
