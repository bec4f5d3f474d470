package org.pragmatica.querylang.peg.parser;

/**
 * Matches a single character against the body of a {@code [...]} class.
 *
 * <p>Supports ranges ({@code a-z}), the escapes {@code \n \r \t \\ \] \-} and backslash-u escapes with four hex digits.
 */
final class CharClassMatcher {

    private CharClassMatcher() {}

    static boolean matches(char c, String pattern, boolean caseInsensitive) {
        char testChar = fold(c, caseInsensitive);
        int i = 0;
        while (i < pattern.length()) {
            int consumed = 1;
            char start = pattern.charAt(i);
            if (start == '\\' && i + 1 < pattern.length()) {
                consumed = escapeLength(pattern, i);
                start = unescape(pattern, i);
            }
            i += consumed;

            // Range
            if (i + 1 < pattern.length() && pattern.charAt(i) == '-') {
                int endIndex = i + 1;
                char end = pattern.charAt(endIndex);
                int endLength = 1;
                if (end == '\\' && endIndex + 1 < pattern.length()) {
                    endLength = escapeLength(pattern, endIndex);
                    end = unescape(pattern, endIndex);
                }
                if (testChar >= fold(start, caseInsensitive) && testChar <= fold(end, caseInsensitive)) {
                    return true;
                }
                i = endIndex + endLength;
                continue;
            }

            if (testChar == fold(start, caseInsensitive)) {
                return true;
            }
        }
        return false;
    }

    private static char fold(char c, boolean caseInsensitive) {
        return caseInsensitive ? Character.toLowerCase(c) : c;
    }

    private static int escapeLength(String pattern, int backslash) {
        if (pattern.charAt(backslash + 1) == 'u' && isHex(pattern, backslash + 2, 4)) {
            return 6;
        }
        return 2;
    }

    private static char unescape(String pattern, int backslash) {
        char escaped = pattern.charAt(backslash + 1);
        switch (escaped) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 'u':
                if (isHex(pattern, backslash + 2, 4)) {
                    return (char) Integer.parseInt(pattern.substring(backslash + 2, backslash + 6), 16);
                }
                return 'u';
            default:
                return escaped;
        }
    }

    private static boolean isHex(String pattern, int from, int count) {
        if (from + count > pattern.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (Character.digit(pattern.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
