package com.whereq.easel.client;

/**
 * Source of monotonic nanosecond readings used for protocol deadlines and timings
 */
@FunctionalInterface
public interface MonotonicClock {

    MonotonicClock SYSTEM = System::nanoTime;

    long nanoTime();
}
