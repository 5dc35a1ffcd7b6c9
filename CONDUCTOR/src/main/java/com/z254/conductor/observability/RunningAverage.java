package com.z254.conductor.observability;

/**
 * Cumulative mean of recorded samples.
 */
public class RunningAverage {

    private long count;
    private double mean;

    public synchronized void record(double sample) {
        count++;
        mean += (sample - mean) / count;
    }

    public synchronized double getMean() {
        return mean;
    }

    public synchronized long getCount() {
        return count;
    }

    public synchronized void reset() {
        count = 0;
        mean = 0.0;
    }
}
