package chaptercrawler;

import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

// Chapter = inner HTML of the first content-selector match; next = first next-link match, resolved against the final URL.
public class JsoupPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final String userAgent;
    private final Duration timeout;
    private final String contentSelector;
    private final Evaluator contentQuery;
    private final Evaluator nextLinkQuery;

    public JsoupPageFetcher(String userAgent, Duration timeout, String contentSelector, String nextLinkSelector) {
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.contentSelector = contentSelector;
        // fail on a bad selector now rather than on every page
        this.contentQuery = parseSelector(contentSelector);
        this.nextLinkQuery = parseSelector(nextLinkSelector);
    }

    private static Evaluator parseSelector(String selector) {
        try {
            return QueryParser.parse(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid selector '" + selector + "': " + e.getMessage(), e);
        }
    }

    public static JsoupPageFetcher from(CrawlerConfig config) {
        return new JsoupPageFetcher(config.userAgent(), config.requestTimeout(),
                config.contentSelector(), config.nextLinkSelector());
    }

    @Override
    public FetchedPage fetch(String url) throws FetchException {
        Connection.Response response;
        try {
            response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .timeout((int) timeout.toMillis())
                    .followRedirects(true)
                    .execute();
        } catch (SocketTimeoutException e) {
            throw new FetchException(FailureType.TIMEOUT, "Request timed out for " + url, e);
        } catch (UnsupportedMimeTypeException e) {
            throw new FetchException(FailureType.DECODE_FAILURE,
                    "Unsupported content type " + e.getMimeType() + " for " + url, e);
        } catch (HttpStatusException e) {
            throw new FetchException(FailureType.NETWORK_FAILURE,
                    "HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(FailureType.NETWORK_FAILURE, "Request failed for " + url + ": " + e.getMessage(), e);
        }

        Document doc;
        try {
            doc = response.parse();
        } catch (SocketTimeoutException e) {
            throw new FetchException(FailureType.TIMEOUT, "Timed out reading response from " + url, e);
        } catch (IOException e) {
            throw new FetchException(FailureType.DECODE_FAILURE,
                    "Failed to read response from " + url + ": " + e.getMessage(), e);
        }

        Element content = doc.selectFirst(contentQuery);
        if (content == null) {
            throw new FetchException(FailureType.CONTENT_NOT_FOUND,
                    "Could not find '" + contentSelector + "' on the current page: " + url);
        }

        String next = nextLink(doc);
        return next == null ? FetchedPage.last(content.html()) : FetchedPage.withNext(content.html(), next);
    }

    // A link that is missing or can't be resolved simply ends the chain here.
    // The document's base URI is the final URL after redirects, or its <base href>.
    private String nextLink(Document doc) {
        Element link = doc.selectFirst(nextLinkQuery);
        if (link == null) return null;

        String href = link.attr("href");
        if (href.isBlank()) {
            log.debug("Next link on {} has no usable href", doc.location());
            return null;
        }
        String resolved = UrlUtil.httpLinkOrNull(link.absUrl("href"));
        if (resolved == null) {
            log.debug("Could not resolve next link '{}' on {}", href, doc.location());
            return null;
        }
        return resolved;
    }
}
