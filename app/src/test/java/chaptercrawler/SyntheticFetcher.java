package chaptercrawler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

// In-memory PageFetcher for crawl tests. Records how many fetches overlapped.
class SyntheticFetcher implements PageFetcher {
    private final Map<String, FetchedPage> pages = new ConcurrentHashMap<>();
    private final Map<String, FailureType> failures = new ConcurrentHashMap<>();
    private final Set<String> hanging = ConcurrentHashMap.newKeySet();
    private final CountDownLatch neverReleased = new CountDownLatch(1);
    private volatile Duration delay = Duration.ZERO;

    final AtomicInteger calls = new AtomicInteger();
    final AtomicInteger current = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();
    final List<String> fetched = Collections.synchronizedList(new ArrayList<>());

    static String url(int i) {
        return "https://book.test/chapter-" + i + ".html";
    }

    static String content(int i) {
        return "<p>chapter " + i + "</p>";
    }

    // chapter-0 -> chapter-1 -> ... -> chapter-(length-1), last page has no next link
    static SyntheticFetcher chain(int length) {
        SyntheticFetcher fetcher = new SyntheticFetcher();
        for (int i = 0; i < length; i++) {
            fetcher.page(url(i), content(i), i + 1 < length ? url(i + 1) : null);
        }
        return fetcher;
    }

    SyntheticFetcher page(String url, String content, String next) {
        pages.put(url, next == null ? FetchedPage.last(content) : FetchedPage.withNext(content, next));
        return this;
    }

    SyntheticFetcher failing(String url, FailureType type) {
        failures.put(url, type);
        return this;
    }

    SyntheticFetcher hanging(String url) {
        hanging.add(url);
        return this;
    }

    SyntheticFetcher withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    @Override
    public FetchedPage fetch(String url) throws FetchException {
        calls.incrementAndGet();
        fetched.add(url);
        peak.accumulateAndGet(current.incrementAndGet(), Math::max);
        try {
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            if (hanging.contains(url)) {
                neverReleased.await();
            }
            FailureType failure = failures.get(url);
            if (failure != null) {
                throw new FetchException(failure, "synthetic " + failure + " for " + url);
            }
            FetchedPage page = pages.get(url);
            if (page == null) {
                throw new FetchException(FailureType.NETWORK_FAILURE, "HTTP 404 for " + url);
            }
            return page;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FailureType.NETWORK_FAILURE, "interrupted while fetching " + url, e);
        } finally {
            current.decrementAndGet();
        }
    }
}
