package chaptercrawler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResultCollectorTest {

    @Test
    void drainReturnsOnceLastProducerFinishes() throws Exception {
        ResultCollector collector = new ResultCollector();
        collector.producerStarted();
        collector.emit(new ChapterResult(0, "u0", "zero"));
        // a producer registers its continuation before it finishes itself
        collector.producerStarted();
        collector.producerFinished();
        collector.emit(new ChapterResult(1, "u1", "one"));
        collector.producerFinished();

        List<ChapterResult> results = collector.drain(null);

        assertTrue(collector.isQuiescent());
        assertEquals(2, results.size());
        assertEquals(0, collector.outstanding());
    }

    @Test
    void resultsFedOutOfOrderAssembleInIndexOrder() throws Exception {
        ResultCollector collector = new ResultCollector();
        ExecutorService producers = Executors.newFixedThreadPool(4);
        int[] completionOrder = {3, 0, 4, 1, 2};
        for (int i = 0; i < completionOrder.length; i++) collector.producerStarted();
        for (int index : completionOrder) {
            producers.execute(() -> {
                collector.emit(new ChapterResult(index, "u" + index, "c" + index));
                collector.producerFinished();
            });
        }

        List<ChapterResult> results = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> collector.drain(null));
        producers.shutdown();
        assertTrue(producers.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(5, results.size());
        assertEquals("c0<hr />\nc1<hr />\nc2<hr />\nc3<hr />\nc4", new DocumentAssembler("t").body(results));
    }

    @Test
    void drainGivesUpAtTheDeadlineWithWhatItHas() throws Exception {
        ResultCollector collector = new ResultCollector();
        collector.producerStarted();
        collector.producerStarted();
        collector.emit(new ChapterResult(0, "u0", "zero"));
        collector.producerFinished();

        List<ChapterResult> results = collector.drain(Duration.ofMillis(100));

        assertFalse(collector.isQuiescent());
        assertEquals(1, results.size());
        assertEquals(1, collector.outstanding());
        assertEquals(results, collector.received());
    }

    @Test
    void finishingMoreProducersThanStartedIsAnError() {
        ResultCollector collector = new ResultCollector();
        collector.producerStarted();
        collector.producerFinished();

        assertThrows(IllegalStateException.class, collector::producerFinished);
    }

    @Test
    void noNewProducersAfterQuiescence() throws Exception {
        ResultCollector collector = new ResultCollector();
        collector.producerStarted();
        collector.producerFinished();
        collector.drain(null);

        assertThrows(IllegalStateException.class, collector::producerStarted);
    }
}
