package io.github.cyfko.filterexpr.core.token;

/**
 * Identifier and keyword rules of the filter expression language.
 * <p>
 * An identifier is valid iff it is non-empty, is not a reserved keyword (case-insensitive), and
 * consists only of Unicode letters, Unicode digits and {@code _}. The lexer additionally requires
 * the first character to be a letter or {@code _}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    public static boolean isKeyword(String text) {
        return Kind.lookupKeyword(text) != null;
    }

    public static boolean isIdentifierStart(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == '_';
    }

    public static boolean isIdentifierChar(int codePoint) {
        return Character.isLetter(codePoint) || Character.isDigit(codePoint) || codePoint == '_';
    }

    /**
     * @param text candidate identifier
     * @return true when {@code text} is usable as a field name
     */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || isKeyword(text)) {
            return false;
        }
        return text.codePoints().allMatch(Identifiers::isIdentifierChar);
    }
}
