package com.jclean.query;

/**
 * Descriptive statistics of a numeric column over its non-null values.
 * Undefined statistics are {@code NaN}: all of them for an empty column, and
 * the standard deviation for a single value.
 */
public class NumericStats {
    private final long count;
    private final double mean;
    private final double std;
    private final double min;
    private final double p25;
    private final double p50;
    private final double p75;
    private final double max;

    public NumericStats(long count, double mean, double std, double min,
                        double p25, double p50, double p75, double max) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.p25 = p25;
        this.p50 = p50;
        this.p75 = p75;
        this.max = max;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getMin() {
        return min;
    }

    public double getP25() {
        return p25;
    }

    public double getP50() {
        return p50;
    }

    public double getP75() {
        return p75;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("count=%d mean=%.4f std=%.4f min=%.4f 25%%=%.4f 50%%=%.4f 75%%=%.4f max=%.4f",
            count, mean, std, min, p25, p50, p75, max);
    }
}
