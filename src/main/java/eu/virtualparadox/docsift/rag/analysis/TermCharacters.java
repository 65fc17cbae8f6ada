package eu.virtualparadox.docsift.rag.analysis;

/**
 * Character class of retrieval terms: Unicode letters ({@code \p{L}}) and numbers ({@code \p{N}}).
 * Tokenization and raw-text matching both use it, so a term boundary means the same thing in both.
 */
public final class TermCharacters {

    /**
     * Regex class matching one term character.
     */
    public static final String REGEX_CLASS = "[\\p{L}\\p{N}]";

    private TermCharacters() {
    }

    public static boolean isTermChar(final int codePoint) {
        if (Character.isLetter(codePoint)) {
            return true;
        }
        final int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }

    /**
     * Whether the code point ending right before {@code index} is a term character.
     */
    public static boolean isTermCharBefore(final CharSequence text, final int index) {
        return index > 0 && index <= text.length() && isTermChar(Character.codePointBefore(text, index));
    }

    /**
     * Whether the code point starting at {@code index} is a term character.
     */
    public static boolean isTermCharAt(final CharSequence text, final int index) {
        return index >= 0 && index < text.length() && isTermChar(Character.codePointAt(text, index));
    }
}
