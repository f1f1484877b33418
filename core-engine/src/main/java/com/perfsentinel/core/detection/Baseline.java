package com.perfsentinel.core.detection;

/**
 * Summary statistics of a baseline window.
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final double mean;
    private final double stdev;
    private final int sampleCount;

    Baseline(double mean, double stdev, int sampleCount) {
        this.mean = mean;
        this.stdev = stdev;
        this.sampleCount = sampleCount;
    }

    public double getMean() {
        return mean;
    }

    /**
     * @return sample standard deviation (n - 1 denominator)
     */
    public double getStdev() {
        return stdev;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public String toString() {
        return "Baseline{mean=" + mean + ", stdev=" + stdev + ", sampleCount=" + sampleCount + '}';
    }
}
