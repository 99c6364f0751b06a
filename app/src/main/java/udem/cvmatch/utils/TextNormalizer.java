package udem.cvmatch.utils;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TextNormalizer {
    private static final Pattern BRACKETED_NUMBER = Pattern.compile("[(\\[{]\\d+[)\\]}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9+.#_ ]+");
    private static final Pattern COPY_MARKER = Pattern.compile("\\(\\s*\\d+\\s*\\)");
    private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");

    /** Single-character (or short) tokens that are real skills. */
    static final Set<String> SHORT_TOKENS = Set.of("c", "c++", "cv", "ml", "ai", "r", "go");

    private TextNormalizer() {
    }

    /**
     * Compatibility-decomposes, lower-cases and strips everything except letters, digits and
     * {@code + . # _}; drops one-character tokens unless they are known skill names.
     */
    public static String clean(String text) {
        if (text == null || text.isBlank()) return "";
        String t = Normalizer.normalize(text, Normalizer.Form.NFKD).toLowerCase(Locale.ROOT);
        t = BRACKETED_NUMBER.matcher(t).replaceAll("");
        t = WHITESPACE.matcher(t).replaceAll(" ");
        t = DISALLOWED.matcher(t).replaceAll("");
        return Arrays.stream(t.split(" "))
                .filter(tok -> tok.length() > 1 || SHORT_TOKENS.contains(tok))
                .collect(Collectors.joining(" "))
                .strip();
    }

    /**
     * Document id for a file name: extension and "(n)" copy markers removed, whitespace
     * replaced by underscores, lower-cased. "John Doe (2).pdf" becomes "john_doe".
     */
    public static String normalizeName(String fileName) {
        String base = EXTENSION.matcher(fileName).replaceFirst("");
        base = COPY_MARKER.matcher(base).replaceAll("");
        base = WHITESPACE.matcher(base.strip()).replaceAll("_");
        return base.toLowerCase(Locale.ROOT);
    }

    public static boolean hasCopyMarker(String fileName) {
        return COPY_MARKER.matcher(fileName).find();
    }
}
