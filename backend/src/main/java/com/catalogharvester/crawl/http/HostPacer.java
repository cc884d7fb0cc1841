package com.catalogharvester.crawl.http;

import com.catalogharvester.crawl.util.Pauses;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out request slots per host, at least {@code spacingMillis} apart. Callers sleep outside
 * the lock, so a slow host never delays requests to another one.
 */
class HostPacer {
    private final long spacingMillis;
    private final Map<String, Long> nextSlot = new HashMap<>();

    HostPacer(long spacingMillis) {
        this.spacingMillis = Math.max(0, spacingMillis);
    }

    /**
     * Claims the next slot for the host.
     *
     * @return milliseconds the caller has to wait before using it
     */
    synchronized long reserve(String host) {
        long now = System.currentTimeMillis();
        long slot = Math.max(now, nextSlot.getOrDefault(host, now));
        nextSlot.put(host, slot + spacingMillis);
        return slot - now;
    }

    /** No slot for the host is handed out before {@code millis} from now. */
    synchronized void coolDown(String host, long millis) {
        if (millis <= 0) {
            return;
        }
        nextSlot.merge(host, System.currentTimeMillis() + millis, Math::max);
    }

    /**
     * @return false when interrupted while waiting
     */
    boolean awaitTurn(String host) {
        return Pauses.sleep(reserve(host));
    }
}
