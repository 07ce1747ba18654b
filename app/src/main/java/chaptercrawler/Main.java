package chaptercrawler;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

// CLI entry point that parses args and launches the crawl.
public class Main {

    private static final String USAGE = """
            Usage: <startUrl> [maxConcurrency] [outputPath] [contentSelector] [nextLinkSelector]
            Example: https://doc.rust-lang.org/stable/book/title-page.html 50 book.html main "a[title='Next chapter']"
            """;

    // Parse CLI args and launch the crawler.
    public static void main(String[] args) {
        System.exit(run(args));
    }

    // Returns the process exit status instead of exiting, so it can be called from tests.
    static int run(String[] args) {
        CrawlerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.print(USAGE);
            return 1;
        }

        ChapterCrawler crawler;
        try {
            crawler = new ChapterCrawler(config);
        } catch (IllegalArgumentException e) {
            // bad selector or out-of-range setting
            System.err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        // If user hits Ctrl+C, stop starting new fetches and give the run a moment to write what it has
        Thread mainThread = Thread.currentThread();
        AtomicBoolean finished = new AtomicBoolean();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished.get()) return;
            crawler.shutdown();
            try {
                mainThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "chapter-crawler-shutdown"));

        try {
            CrawlSummary summary = crawler.run();
            System.out.println("Successfully saved " + summary.chaptersCollected() + " chapters to " + summary.outputPath());
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Could not save output: " + e.getMessage());
            return 1;
        } finally {
            finished.set(true);
        }
    }

    static CrawlerConfig parseArgs(String[] args) {
        // Validate CLI args count
        if (args.length < 1 || args.length > 5) {
            throw new IllegalArgumentException("Expected 1 to 5 arguments, got " + args.length);
        }

        CrawlerConfig config = CrawlerConfig.defaults(args[0]);
        if (args.length > 1) {
            int maxConcurrency = parseInt(args[1], "maxConcurrency");
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be >= 1");
            }
            config = config.withMaxConcurrency(maxConcurrency);
        }
        if (args.length > 2) {
            config = config.withOutputPath(Path.of(args[2]));
        }
        if (args.length > 3) {
            String next = args.length > 4 ? args[4] : config.nextLinkSelector();
            config = config.withSelectors(args[3], next);
        }
        return config.validate();
    }

    // Strict integer parsing with a clean error message.
    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + s);
        }
    }
}
