package net.ogimage.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * URL parsing and canonicalization utilities.
 */
public final class UrlUtils {

    private static final String UNSAFE_ASCII = " \"<>\\^`{|}[]";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UrlUtils() {
    }

    /**
     * Parses an absolute http(s) URL with a host.
     *
     * <p>Parsing is lenient the way browsers are: characters that are not legal in a URI
     * (spaces, {@code |}, non-ASCII text) are percent-encoded after the authority, and hosts
     * containing underscores are accepted even though {@link URI#getHost()} rejects them.</p>
     *
     * @param url candidate URL
     * @return parsed URI, or empty when the value is blank, malformed, relative or not http(s)
     */
    public static Optional<URI> parseHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(encodeUnsafeCharacters(url.trim()));
            String scheme = uri.getScheme();
            if (scheme == null) {
                return Optional.empty();
            }
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!"http".equals(lowerScheme) && !"https".equals(lowerScheme)) {
                return Optional.empty();
            }
            String host = hostOf(uri);
            if (host == null || host.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException ex) {
            return Optional.empty();
        }
    }

    /**
     * Lower-cased host of an http(s) URL.
     */
    public static Optional<String> extractHost(String url) {
        return parseHttpUrl(url).map(uri -> hostOf(uri).toLowerCase(Locale.ROOT));
    }

    /**
     * Canonical form used for cache keys.
     *
     * <p>Lower-cases scheme and host, drops default ports, the fragment and trailing
     * slashes of the path. Query strings are kept as written apart from percent-encoding
     * characters that are illegal in a URI. Values that do not parse as
     * http(s) URLs are returned trimmed so the function stays total.</p>
     *
     * @example
     * <pre>
     * UrlUtils.canonicalize("HTTPS://Example.COM:443/docs/") → "https://example.com/docs"
     * UrlUtils.canonicalize("https://example.com/")         → "https://example.com"
     * </pre>
     */
    public static String canonicalize(String url) {
        if (url == null) {
            return "";
        }
        Optional<URI> parsed = parseHttpUrl(url);
        if (parsed.isEmpty()) {
            return url.trim();
        }
        URI uri = parsed.get();
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = hostOf(uri).toLowerCase(Locale.ROOT);

        StringBuilder canonical = new StringBuilder(scheme).append("://").append(host);
        int port = portOf(uri);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            canonical.append(':').append(port);
        }
        canonical.append(stripTrailingSlashes(uri.getRawPath()));
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            canonical.append('?').append(uri.getRawQuery());
        }
        return canonical.toString();
    }

    /**
     * Percent-encodes characters after the authority that {@link URI} refuses. Existing
     * escapes are left alone. The scheme and authority are passed through unchanged.
     */
    static String encodeUnsafeCharacters(String url) {
        int schemeEnd = url.indexOf("://");
        if (schemeEnd < 0) {
            return url;
        }
        int authorityEnd = url.length();
        for (int i = schemeEnd + 3; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                authorityEnd = i;
                break;
            }
        }
        StringBuilder encoded = new StringBuilder(url.length() + 16).append(url, 0, authorityEnd);
        for (int i = authorityEnd; i < url.length(); ) {
            int codePoint = url.codePointAt(i);
            if (codePoint > 0x20 && codePoint < 0x7F && UNSAFE_ASCII.indexOf(codePoint) < 0) {
                encoded.append((char) codePoint);
            } else {
                for (byte b : new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8)) {
                    encoded.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
                }
            }
            i += Character.charCount(codePoint);
        }
        return encoded.toString();
    }

    /**
     * Host of the URI. Falls back to the registry-based authority for hostnames {@link URI}
     * does not accept as server-based (underscores).
     */
    private static String hostOf(URI uri) {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        String hostAndPort = hostAndPort(uri);
        if (hostAndPort == null) {
            return null;
        }
        int colon = hostAndPort.lastIndexOf(':');
        String host = colon >= 0 ? hostAndPort.substring(0, colon) : hostAndPort;
        if (colon >= 0 && !hostAndPort.substring(colon + 1).chars().allMatch(Character::isDigit)) {
            return null;
        }
        for (int i = 0; i < host.length(); i++) {
            char c = host.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '-' && c != '.' && c != '_') {
                return null;
            }
        }
        return host;
    }

    private static int portOf(URI uri) {
        if (uri.getHost() != null) {
            return uri.getPort();
        }
        String hostAndPort = hostAndPort(uri);
        int colon = hostAndPort == null ? -1 : hostAndPort.lastIndexOf(':');
        if (colon < 0 || colon == hostAndPort.length() - 1) {
            return -1;
        }
        try {
            return Integer.parseInt(hostAndPort.substring(colon + 1));
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static String hostAndPort(URI uri) {
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        return at >= 0 ? authority.substring(at + 1) : authority;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private static String stripTrailingSlashes(String path) {
        if (path == null) {
            return "";
        }
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }
}
