package chaptercrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

// Shared state of one crawl run, handed to every ChapterTask.
public class CrawlContext {
    private static final Logger log = LoggerFactory.getLogger(CrawlContext.class);

    private final ConcurrencyLimiter limiter;
    private final VisitedGuard visited;
    private final PageFetcher fetcher;
    private final ResultCollector collector;
    private final FailureLogger failureLogger;
    private final Executor executor;
    private final int maxChapters;

    private final AtomicInteger duplicatesRejected = new AtomicInteger();
    private final AtomicInteger chaptersCapped = new AtomicInteger();
    private volatile boolean shuttingDown = false;

    public CrawlContext(ConcurrencyLimiter limiter, VisitedGuard visited, PageFetcher fetcher,
                        ResultCollector collector, FailureLogger failureLogger, Executor executor,
                        int maxChapters) {
        this.limiter = limiter;
        this.visited = visited;
        this.fetcher = fetcher;
        this.collector = collector;
        this.failureLogger = failureLogger;
        this.executor = executor;
        this.maxChapters = maxChapters;
    }

    // Registers with the collector before submitting. Returns null if nothing was scheduled.
    public ChapterTask spawn(int index, String url) {
        if (shuttingDown) {
            return null;
        }
        if (index >= maxChapters) {
            chaptersCapped.incrementAndGet();
            log.warn("Chain length cap of {} reached, not following {}", maxChapters, url);
            return null;
        }
        ChapterTask task = new ChapterTask(index, UrlUtil.normalize(url), this);
        collector.producerStarted();
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            collector.producerFinished();
            log.warn("Could not schedule chapter {} ({}): {}", index, url, e.getMessage());
            return null;
        }
        return task;
    }

    // Tasks that have not fetched yet will stop without fetching.
    public void shutDown() {
        shuttingDown = true;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    void duplicateRejected() {
        duplicatesRejected.incrementAndGet();
    }

    public int duplicatesRejected() {
        return duplicatesRejected.get();
    }

    public int chaptersCapped() {
        return chaptersCapped.get();
    }

    public ConcurrencyLimiter limiter() {
        return limiter;
    }

    public VisitedGuard visited() {
        return visited;
    }

    public PageFetcher fetcher() {
        return fetcher;
    }

    public ResultCollector collector() {
        return collector;
    }

    public FailureLogger failureLogger() {
        return failureLogger;
    }
}
