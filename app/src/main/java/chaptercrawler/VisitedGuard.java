package chaptercrawler;

import java.util.HashSet;
import java.util.Set;

// Page URLs claimed during this run. Only the first claim of a URL succeeds.
public class VisitedGuard {
    private final Object lock = new Object();
    private final Set<String> claimed = new HashSet<>();

    // Test-and-insert under the lock; never held across a fetch.
    public boolean claim(String url) {
        synchronized (lock) {
            return claimed.add(url);
        }
    }

    public int size() {
        synchronized (lock) {
            return claimed.size();
        }
    }
}
