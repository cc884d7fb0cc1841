package com.catalogharvester.crawl.util;

public final class Pauses {
    private Pauses() {
    }

    /**
     * Sleeps for the given time; returns false (with the interrupt flag restored) when interrupted.
     */
    public static boolean sleep(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
