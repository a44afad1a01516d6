package com.linesplit.probe;

/**
 * Read-only access to the clock and allocation counters a timed run is measured with.
 */
public interface Probe {

    /**
     * @return a monotonic instant in nanoseconds, only meaningful relative to another call
     */
    long now();

    /**
     * @return the number of young-generation collections observed since the JVM started; never decreases
     */
    long collectionCount();

    /**
     * @return bytes allocated by the calling thread since it started; never decreases
     */
    long allocatedBytes();
}
