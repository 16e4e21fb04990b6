package org.smileyface.campuscrawler.crawler;

import org.jsoup.internal.StringUtil;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonicalizes candidate URLs and filters out the ones the crawler must not fetch.
 * <p>
 * A normalized URL has an http(s) scheme, a lower-cased host from the allowed set, no default port,
 * no fragment and no trailing slash. Two spellings of the same page normalize to the same string, and
 * normalizing an already normalized URL returns it unchanged.
 * <p>
 * Instances are immutable and safe to share.
 */
public class UrlNormalizer {

    private static final List<String> PSEUDO_SCHEMES = List.of("javascript:", "mailto:", "tel:");
    // unreserved marks and reserved characters of RFC 2396, as java.net.URI accepts them
    private static final String LEGAL_PUNCTUATION = "-_.!~*'();/?:@&=+$,";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Set<String> allowedDomains;
    private final List<String> skipExtensions;

    public UrlNormalizer(Collection<String> allowedDomains, Collection<String> skipExtensions) {
        if (allowedDomains == null || allowedDomains.isEmpty()) {
            throw new IllegalArgumentException("allowedDomains must not be null/empty");
        }
        this.allowedDomains = allowedDomains.stream()
                .filter(d -> d != null && !d.isBlank())
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.skipExtensions = skipExtensions == null ? List.of() : skipExtensions.stream()
                .filter(e -> e != null && !e.isBlank())
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    public UrlNormalizer(CrawlerProperties properties) {
        this(properties.getAllowedDomains(), properties.getSkipExtensions());
    }

    public Set<String> getAllowedDomains() {
        return allowedDomains;
    }

    /**
     * Resolves {@code raw} against {@code base} and returns its normalized form, or null when the
     * URL is rejected: blank input, in-page anchors, javascript/mailto/tel links, malformed syntax,
     * non-http(s) schemes, hosts outside the allowed domains and paths ending in a skipped extension.
     * Characters that are not legal in a URI, such as spaces, are percent-encoded rather than rejected.
     *
     * @param raw  absolute or relative URL as found in a page
     * @param base absolute URL to resolve relative input against; may be null for absolute input
     * @return normalized absolute URL, or null if rejected
     */
    public String normalizeAndValidate(String raw, String base) {
        if (raw == null || raw.isBlank()) return null;
        String candidate = raw.trim();
        String lower = candidate.toLowerCase(Locale.ROOT);
        if (lower.startsWith("#")) return null;
        for (String pseudo : PSEUDO_SCHEMES) {
            if (lower.contains(pseudo)) return null;
        }
        int hash = candidate.indexOf('#');
        if (hash >= 0) candidate = candidate.substring(0, hash);

        URL url = resolve(candidate, base);
        if (url == null) return null;

        String scheme = url.getProtocol().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        String host = url.getHost();
        if (host == null || host.isEmpty()) return null;
        host = host.toLowerCase(Locale.ROOT);
        if (!allowedDomains.contains(host)) return null;

        String path = quoteIllegal(url.getPath() == null ? "" : url.getPath());
        String query = url.getQuery() == null ? null : quoteIllegal(url.getQuery());
        // The extension is judged on the path as it will look once trailing slashes are gone
        String lowerPath = (query == null ? stripTrailingSlashes(path) : path).toLowerCase(Locale.ROOT);
        for (String ext : skipExtensions) {
            if (lowerPath.endsWith(ext)) return null;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        int port = url.getPort();
        if (port != -1 && port != defaultPort(scheme)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) sb.append('?').append(query);

        // Strip every trailing slash so that normalizing twice is a no-op
        int end = sb.length();
        int minLength = scheme.length() + 3 + host.length();
        while (end > minLength && sb.charAt(end - 1) == '/') end--;
        sb.setLength(end);

        String normalized = sb.toString();
        try {
            new URI(normalized);
        } catch (URISyntaxException e) {
            return null;
        }
        return normalized;
    }

    /**
     * Shorthand for {@link #normalizeAndValidate(String, String)} with an absolute URL.
     */
    public String normalize(String absoluteUrl) {
        return normalizeAndValidate(absoluteUrl, null);
    }

    public boolean isValid(String url) {
        return normalize(url) != null;
    }

    private static URL resolve(String candidate, String base) {
        try {
            return new URL(candidate);
        } catch (MalformedURLException | IllegalArgumentException notAbsolute) {
            if (base == null || base.isBlank()) return null;
        }
        try {
            return StringUtil.resolve(new URL(base.trim()), candidate);
        } catch (MalformedURLException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Percent-encodes (as UTF-8) every character that may not appear in a URI path or query.
     * Existing escapes are kept, so an already encoded URL passes through unchanged.
     */
    static String quoteIllegal(String s) {
        StringBuilder out = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean legal = c < 0x80 && (Character.isLetterOrDigit(c) || LEGAL_PUNCTUATION.indexOf(c) >= 0)
                    || c == '%' && isEscape(s, i);
            if (legal) {
                if (out != null) out.append(c);
                continue;
            }
            if (out == null) out = new StringBuilder(s.length() + 16).append(s, 0, i);
            int cp = s.codePointAt(i);
            if (Character.charCount(cp) == 2) i++;
            for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                out.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
            }
        }
        return out == null ? s : out.toString();
    }

    private static boolean isEscape(String s, int i) {
        return i + 2 < s.length() && Character.digit(s.charAt(i + 1), 16) >= 0
                && Character.digit(s.charAt(i + 2), 16) >= 0;
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') end--;
        return path.substring(0, end);
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
