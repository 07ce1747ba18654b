package chaptercrawler;

import java.nio.file.Path;
import java.time.Duration;

// Settings for one crawl run. crawlTimeout == null means wait for the chain to finish however long it takes.
public record CrawlerConfig(
        String startUrl,
        int maxConcurrency,
        Path outputPath,
        String contentSelector,
        String nextLinkSelector,
        String documentTitle,
        String userAgent,
        Duration requestTimeout,
        int maxChapters,
        Duration crawlTimeout
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 50;
    public static final Path DEFAULT_OUTPUT = Path.of("scraped_book_concurrent.html");
    public static final String DEFAULT_CONTENT_SELECTOR = "main";
    public static final String DEFAULT_NEXT_LINK_SELECTOR = "a[title='Next chapter']";
    public static final String DEFAULT_TITLE = "Scraped Documentation";
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; ChapterCrawler/1.0)";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_CHAPTERS = 10_000;

    public static CrawlerConfig defaults(String startUrl) {
        return new CrawlerConfig(startUrl, DEFAULT_MAX_CONCURRENCY, DEFAULT_OUTPUT,
                DEFAULT_CONTENT_SELECTOR, DEFAULT_NEXT_LINK_SELECTOR, DEFAULT_TITLE,
                DEFAULT_USER_AGENT, DEFAULT_REQUEST_TIMEOUT, DEFAULT_MAX_CHAPTERS, null);
    }

    public CrawlerConfig withMaxConcurrency(int maxConcurrency) {
        return new CrawlerConfig(startUrl, maxConcurrency, outputPath, contentSelector, nextLinkSelector,
                documentTitle, userAgent, requestTimeout, maxChapters, crawlTimeout);
    }

    public CrawlerConfig withOutputPath(Path outputPath) {
        return new CrawlerConfig(startUrl, maxConcurrency, outputPath, contentSelector, nextLinkSelector,
                documentTitle, userAgent, requestTimeout, maxChapters, crawlTimeout);
    }

    public CrawlerConfig withSelectors(String contentSelector, String nextLinkSelector) {
        return new CrawlerConfig(startUrl, maxConcurrency, outputPath, contentSelector, nextLinkSelector,
                documentTitle, userAgent, requestTimeout, maxChapters, crawlTimeout);
    }

    public CrawlerConfig withMaxChapters(int maxChapters) {
        return new CrawlerConfig(startUrl, maxConcurrency, outputPath, contentSelector, nextLinkSelector,
                documentTitle, userAgent, requestTimeout, maxChapters, crawlTimeout);
    }

    public CrawlerConfig withCrawlTimeout(Duration crawlTimeout) {
        return new CrawlerConfig(startUrl, maxConcurrency, outputPath, contentSelector, nextLinkSelector,
                documentTitle, userAgent, requestTimeout, maxChapters, crawlTimeout);
    }

    // Reject values that would make the run meaningless before anything is started.
    public CrawlerConfig validate() {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        if (maxChapters < 1) {
            throw new IllegalArgumentException("maxChapters must be >= 1, got " + maxChapters);
        }
        if (contentSelector == null || contentSelector.isBlank()
                || nextLinkSelector == null || nextLinkSelector.isBlank()) {
            throw new IllegalArgumentException("content and next-link selectors must not be blank");
        }
        if (outputPath == null) {
            throw new IllegalArgumentException("outputPath must be set");
        }
        if (crawlTimeout != null && (crawlTimeout.isZero() || crawlTimeout.isNegative())) {
            throw new IllegalArgumentException("crawlTimeout must be positive: " + crawlTimeout);
        }
        return this;
    }
}
