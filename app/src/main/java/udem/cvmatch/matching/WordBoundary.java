package udem.cvmatch.matching;

/**
 * Whole-word rule shared by every matcher: a span is accepted only when the code points
 * on both sides are not alphanumeric (text edges count as a separator).
 */
public final class WordBoundary {

    private WordBoundary() {
    }

    /**
     * @param start inclusive start of the match
     * @param end   exclusive end of the match
     */
    public static boolean isWholeWord(String text, int start, int end) {
        boolean before = start > 0 && isAlphanumeric(Character.codePointBefore(text, start));
        boolean after = end < text.length() && isAlphanumeric(Character.codePointAt(text, end));
        return !before && !after;
    }

    /**
     * Letters and digits, plus numeric symbols such as superscripts and roman numerals.
     */
    static boolean isAlphanumeric(int codePoint) {
        if (Character.isLetterOrDigit(codePoint)) return true;
        int type = Character.getType(codePoint);
        return type == Character.OTHER_NUMBER || type == Character.LETTER_NUMBER;
    }
}
