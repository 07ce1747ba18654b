package chaptercrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Fetches one chapter and schedules the next one: slot, claim, fetch, emit, spawn.
// The slot is returned and the collector told on every path.
public class ChapterTask implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ChapterTask.class);

    private final int index;
    private final String url;
    private final CrawlContext context;

    private volatile TaskState state = TaskState.PENDING;
    private volatile TaskState outcome;
    private volatile ChapterTask continuation;

    ChapterTask(int index, String url, CrawlContext context) {
        this.index = index;
        this.url = url;
        this.context = context;
    }

    @Override
    public void run() {
        try {
            outcome = execute();
        } finally {
            state = TaskState.TERMINATED;
            context.collector().producerFinished();
        }
    }

    private TaskState execute() {
        if (context.isShuttingDown()) {
            return TaskState.CANCELLED;
        }

        ConcurrencyLimiter.Permit permit;
        try {
            permit = context.limiter().acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskState.CANCELLED;
        }

        try (permit) {
            state = TaskState.TOKEN_ACQUIRED;
            if (!context.visited().claim(url)) {
                context.duplicateRejected();
                log.debug("Already claimed, dropping chapter {}: {}", index, url);
                return TaskState.REJECTED;
            }
            state = TaskState.CLAIMED;

            if (context.isShuttingDown() || Thread.currentThread().isInterrupted()) {
                return TaskState.CANCELLED;
            }

            state = TaskState.FETCHING;
            log.info("Scraping chapter {}: {}", index, url);
            FetchedPage page;
            try {
                page = context.fetcher().fetch(url);
            } catch (FetchException e) {
                context.failureLogger().add(new FailureRecord(index, url, e.type(), e.getMessage()));
                log.warn("Error scraping chapter {} ({}): {} {}", index, url, e.type(), e.getMessage());
                return TaskState.FAILED;
            } catch (RuntimeException e) {
                context.failureLogger().add(new FailureRecord(index, url, FailureType.CRASH, String.valueOf(e)));
                log.warn("Fetcher crashed on chapter {} ({})", index, url, e);
                return TaskState.FAILED;
            }

            context.collector().emit(new ChapterResult(index, url, page.content()));
            page.nextUrl().ifPresent(next -> continuation = context.spawn(index + 1, next));
            return TaskState.SUCCEEDED;
        }
    }

    public int index() {
        return index;
    }

    public String url() {
        return url;
    }

    public TaskState state() {
        return state;
    }

    // Null until the task has terminated.
    public TaskState outcome() {
        return outcome;
    }

    // Task spawned for the next link, or null if none was.
    public ChapterTask continuation() {
        return continuation;
    }
}
