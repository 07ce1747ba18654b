package chaptercrawler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

// Gathers chapters from concurrent tasks for one consumer. A task registers its continuation
// before it finishes, so the producer count reaches zero once; then END is queued behind every result.
public class ResultCollector {
    private static final ChapterResult END = new ChapterResult(-1, "", "");

    private final BlockingQueue<ChapterResult> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final List<ChapterResult> collected = new ArrayList<>();
    private volatile boolean quiescent;

    public void producerStarted() {
        if (quiescent) {
            throw new IllegalStateException("Collector already observed quiescence");
        }
        outstanding.incrementAndGet();
    }

    public void emit(ChapterResult result) {
        queue.add(result);
    }

    public void producerFinished() {
        int left = outstanding.decrementAndGet();
        if (left == 0) {
            queue.add(END);
        } else if (left < 0) {
            throw new IllegalStateException("producerFinished() called more often than producerStarted()");
        }
    }

    public int outstanding() {
        return outstanding.get();
    }

    // True once the end marker has been consumed, i.e. nothing else can be emitted.
    public boolean isQuiescent() {
        return quiescent;
    }

    // What the consumer has taken off the queue so far. Consumer thread only.
    public List<ChapterResult> received() {
        return new ArrayList<>(collected);
    }

    // Blocks until quiescent or until timeout (null = no limit). Returns what arrived, in arrival order.
    public List<ChapterResult> drain(Duration timeout) throws InterruptedException {
        long deadline = timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
        while (!quiescent) {
            ChapterResult next;
            if (timeout == null) {
                next = queue.take();
            } else {
                long remaining = deadline - System.nanoTime();
                next = remaining > 0 ? queue.poll(remaining, TimeUnit.NANOSECONDS) : queue.poll();
                if (next == null) break;
            }
            if (next == END) {
                quiescent = true;
            } else {
                collected.add(next);
            }
        }
        return new ArrayList<>(collected);
    }
}
