package me.internalizable.sessionhub.servermanager.registry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * URL helpers for server identity.
 */
public final class ServerUrls {

    private ServerUrls() {
    }

    /**
     * Normalize a server URL: lower-case scheme and host, default port
     * dropped, query and fragment dropped, trailing slash enforced.
     *
     * @param url absolute http(s) URL
     * @return normalized URL
     * @throws IllegalArgumentException if the URL is not absolute or has no host
     */
    @Nonnull
    public static URI normalize(@Nonnull URI url) {
        Objects.requireNonNull(url, "url");

        if (url.getScheme() == null || url.getHost() == null) {
            throw new IllegalArgumentException("Not an absolute server URL: " + url);
        }

        String scheme = url.getScheme().toLowerCase(Locale.ROOT);
        String host = url.getHost().toLowerCase(Locale.ROOT);
        int port = url.getPort() == defaultPort(scheme) ? -1 : url.getPort();

        String path = url.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (!path.endsWith("/")) {
            path = path + "/";
        }

        StringBuilder normalized = new StringBuilder()
                .append(scheme).append("://").append(host);
        if (port != -1) {
            normalized.append(':').append(port);
        }
        normalized.append(path);

        return URI.create(normalized.toString());
    }

    /**
     * Parse and normalize a server URL.
     *
     * @param url URL string
     * @return normalized URL
     * @throws IllegalArgumentException if the string is not a valid server URL
     */
    @Nonnull
    public static URI parse(@Nonnull String url) {
        Objects.requireNonNull(url, "url");
        try {
            return normalize(new URI(url.trim()));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid server URL: " + url, e);
        }
    }

    /**
     * Check if a string parses as a server URL.
     *
     * @param url URL string, may be null
     * @return true if {@link #parse} would succeed
     */
    public static boolean isValid(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            parse(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Check if a host name refers to the local machine.
     *
     * @param host host name or literal address, may be bracketed IPv6
     * @return true for {@code localhost}, {@code 127.0.0.0/8} and {@code ::1}
     */
    public static boolean isLoopback(@Nullable String host) {
        if (host == null) {
            return false;
        }

        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }

        if (h.equals("localhost") || h.endsWith(".localhost")) {
            return true;
        }
        if (h.equals("::1") || h.equals("0:0:0:0:0:0:0:1")) {
            return true;
        }
        return h.startsWith("127.") && h.chars().allMatch(c -> c == '.' || Character.isDigit(c));
    }

    /**
     * Get the port of a URL, falling back to the scheme's default.
     *
     * @param url the URL
     * @return explicit port, or 80/443 for http/https, or -1
     */
    public static int effectivePort(@Nonnull URI url) {
        if (url.getPort() != -1) {
            return url.getPort();
        }
        return url.getScheme() != null ? defaultPort(url.getScheme().toLowerCase(Locale.ROOT)) : -1;
    }

    /**
     * Resolve a path relative to a server URL.
     *
     * @param serverUrl server URL
     * @param path relative path without leading slash
     * @return resolved URL
     */
    @Nonnull
    public static URI resolve(@Nonnull URI serverUrl, @Nonnull String path) {
        return normalize(serverUrl).resolve(path);
    }

    private static int defaultPort(String scheme) {
        switch (scheme) {
            case "http":
            case "ws":
                return 80;
            case "https":
            case "wss":
                return 443;
            default:
                return -1;
        }
    }
}
