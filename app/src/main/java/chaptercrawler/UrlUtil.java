package chaptercrawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public class UrlUtil {

    private UrlUtil() {
    }

    // Normalize dot segments and strip fragments so "page.html#top" and "page.html" are one identity.
    // Escapes stay as written: %2F and %26 are not decoded. Trailing slashes, default ports and host case are left alone.
    public static String normalize(String url) {
        String s;
        try {
            s = new URI(url).normalize().toString();
        } catch (URISyntaxException e) {
            s = url;
        }
        int hash = s.indexOf('#');
        return hash >= 0 ? s.substring(0, hash) : s;
    }

    // Parse and normalize the start URL, rejecting anything that is not an absolute http(s) URL.
    public static String requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Start URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed start URL: " + url + " (" + e.getMessage() + ")", e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null || !isHttpLike(uri.toString())) {
            throw new IllegalArgumentException("Start URL must be an absolute http(s) URL: " + url);
        }
        return normalize(uri.toString());
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    // Absolute link from jsoup's absUrl as a normalized http(s) identity, or null when it is not one.
    // Literal spaces are escaped, everything else must already be a valid URI.
    public static String httpLinkOrNull(String absoluteUrl) {
        if (absoluteUrl == null || absoluteUrl.isBlank()) return null;
        try {
            URI uri = new URI(absoluteUrl.trim().replace(" ", "%20"));
            if (!uri.isAbsolute() || uri.getHost() == null || !isHttpLike(uri.toString())) {
                return null;
            }
            return normalize(uri.toString());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
