package org.smileyface.campuscrawler.util;

import java.time.Instant;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Trims leading and trailing whitespace, treating non-breaking spaces and other unicode space
     * separators as whitespace ({@link String#strip()} does not).
     *
     * @return the trimmed string, or null for null input
     */
    public static String trimWhitespace(String input) {
        if (input == null) {
            return null;
        }
        int start = 0;
        int end = input.length();
        while (start < end && isWhitespace(input.charAt(start))) start++;
        while (end > start && isWhitespace(input.charAt(end - 1))) end--;
        return input.substring(start, end);
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * Derives a filesystem-safe file name from a URL. The scheme prefix is dropped, path separators
     * become underscores, every character other than letters, digits, '_' and '-' is removed and the
     * result is truncated to {@code maxLength} characters before the ".txt" suffix is appended.
     *
     * The derivation is shared with the downstream ingestion job and must stay stable.
     */
    public static String toSafeFilename(String url, int maxLength) {
        String name = url == null ? "" : url;
        name = name.replace("https://", "").replace("http://", "").replace("/", "_");
        StringBuilder sb = new StringBuilder(name.length());
        name.codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || cp == '_' || cp == '-')
                .forEach(sb::appendCodePoint);
        String safe = sb.toString();
        if (safe.codePointCount(0, safe.length()) > maxLength) {
            safe = safe.substring(0, safe.offsetByCodePoints(0, Math.max(0, maxLength)));
        }
        return safe + ".txt";
    }

    /**
     * Number of unicode code points in the string; null counts as zero.
     */
    public static int charCount(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }

    public static long durationMs(Instant start, Instant end) {
        if (start == null || end == null) return 0L;
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }
}
