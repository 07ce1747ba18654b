package chaptercrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class ChapterCrawler {
    private static final Logger log = LoggerFactory.getLogger(ChapterCrawler.class);

    private final CrawlerConfig config;

    // Responsible for fetching + extracting the chapter and its next link
    private final PageFetcher pageFetcher;

    // Thread pool the chapter tasks run on
    private final ExecutorService pool;

    // Keep failures in memory and write them once at the end
    private final FailureLogger failureLogger = new FailureLogger();

    private final OutputManager outputManager;

    private final AtomicBoolean started = new AtomicBoolean();
    private final int workerThreads;

    // For graceful shutdown
    private volatile boolean shuttingDown = false;
    private volatile CrawlContext context;

    public ChapterCrawler(CrawlerConfig config) {
        this(config, JsoupPageFetcher.from(config.validate()));
    }

    // Wire dependencies and thread pool for a single crawl run.
    public ChapterCrawler(CrawlerConfig config, PageFetcher pageFetcher) {
        this.config = config.validate();
        this.pageFetcher = pageFetcher;
        this.outputManager = new OutputManager(config.outputPath(), failureLogger);

        // one worker per limiter slot, so the pool never caps concurrency below maxConcurrency
        this.workerThreads = this.config.maxConcurrency();
        this.pool = Executors.newFixedThreadPool(workerThreads, new NamedThreadFactory("chapter-worker"));
    }

    int workerThreads() {
        return workerThreads;
    }

    // Crawl the chain, then write the document. Bad start URL -> IllegalArgumentException, write failure -> IOException.
    public CrawlSummary run() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A ChapterCrawler can only run once");
        }

        List<ChapterResult> chapters;
        boolean cutShort = true;
        CrawlContext ctx;
        try {
            String startUrl = UrlUtil.requireHttpUrl(config.startUrl());

            ResultCollector collector = new ResultCollector();
            ctx = new CrawlContext(new ConcurrencyLimiter(config.maxConcurrency()), new VisitedGuard(),
                    pageFetcher, collector, failureLogger, pool, config.maxChapters());
            this.context = ctx;
            if (shuttingDown) ctx.shutDown();

            if (ctx.spawn(0, startUrl) == null) {
                chapters = List.of();
            } else {
                try {
                    chapters = collector.drain(config.crawlTimeout());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    chapters = collector.received();
                }
            }

            cutShort = !collector.isQuiescent() || ctx.isShuttingDown();
            if (!collector.isQuiescent()) {
                log.warn("Crawl stopped before the chain finished ({} chapters still outstanding)",
                        collector.outstanding());
                ctx.shutDown();
            }
        } finally {
            shutdownPool(cutShort);
        }

        log.debug("Peak in-flight fetches: {} of {}", ctx.limiter().peakInFlight(), ctx.limiter().capacity());
        log.info("Crawl complete. Scraped {} chapters. Sorting and saving to {}", chapters.size(), config.outputPath());
        String html = new DocumentAssembler(config.documentTitle()).assemble(chapters);

        Path written;
        try {
            written = outputManager.writeDocument(html);
        } catch (IOException e) {
            log.error("Could not write {}: {}", config.outputPath(), e.getMessage());
            throw e;
        } finally {
            outputManager.writeFailuresFile();
        }

        CrawlSummary summary = new CrawlSummary(chapters.size(), failureLogger.size(), ctx.duplicatesRejected(),
                ctx.chaptersCapped(), cutShort, written);
        printFinalSummary(summary);
        return summary;
    }

    // Called from the shutdown hook: tasks that haven't fetched yet stop, the rest finish.
    public void shutdown() {
        shuttingDown = true;
        CrawlContext ctx = context;
        if (ctx != null) ctx.shutDown();
    }

    public FailureLogger failureLogger() {
        return failureLogger;
    }

    // After a normal finish the pool is already idle. A cut-short run interrupts whatever is still running.
    private void shutdownPool(boolean interrupt) {
        if (interrupt) {
            pool.shutdownNow();
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    // Print a minimal end-of-run summary.
    private void printFinalSummary(CrawlSummary summary) {
        System.out.println("==== Run summary ====");
        System.out.println("Saved output to : " + summary.outputPath());
        System.out.println("Chapters        : " + summary.chaptersCollected());
        System.out.println("Failed          : " + summary.failures());
        System.out.println("Duplicates      : " + summary.duplicatesRejected());
        if (summary.chaptersCapped() > 0) {
            System.out.println("Over chain cap  : " + summary.chaptersCapped());
        }
        if (summary.cutShort()) {
            System.out.println("Run was stopped before the chain finished");
        }
        if (!failureLogger.isEmpty()) {
            System.out.println("Failures details: " + outputManager.failuresPath());
        }
    }
}
