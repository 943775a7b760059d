package com.company.sentinel.util;

/**
 * Monotonic time source, nanoseconds
 */
@FunctionalInterface
public interface Ticker {

    long nanoTime();

    static Ticker system() {
        return System::nanoTime;
    }
}
