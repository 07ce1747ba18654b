package chaptercrawler;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

// Caps the number of page fetches running at the same time. Tracks current and peak held permits.
public class ConcurrencyLimiter {
    private final int capacity;
    private final Semaphore slots;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public ConcurrencyLimiter(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.slots = new Semaphore(capacity, true);
    }

    // Blocks until a slot is free.
    public Permit acquire() throws InterruptedException {
        slots.acquire();
        int now = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(now, Math::max);
        return new Permit();
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    // A held slot. Closing it again is a no-op.
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.decrementAndGet();
                slots.release();
            }
        }
    }
}
