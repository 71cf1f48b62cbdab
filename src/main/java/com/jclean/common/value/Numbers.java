package com.jclean.common.value;

import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over the non-null numeric values of a column.
 */
public final class Numbers {
    private Numbers() {
    }

    /**
     * Numeric payloads of the non-null values, in order.
     */
    public static double[] nonNull(List<Value> values) {
        return values.stream()
            .filter(value -> !value.isNull())
            .mapToDouble(Value::asDouble)
            .toArray();
    }

    public static double sum(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum;
    }

    /**
     * Arithmetic mean, or NaN for no values.
     */
    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : sum(values) / values.length;
    }

    public static double median(double[] values) {
        return percentile(values, 0.5);
    }

    /**
     * Sample standard deviation (n - 1 denominator), or NaN for fewer than two values.
     */
    public static double standardDeviation(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    /**
     * Percentile by linear interpolation between closest ranks.
     *
     * @param values Values in any order
     * @param fraction Between 0 and 1, e.g. 0.25 for the first quartile
     * @return The interpolated percentile, or NaN for no values
     */
    public static double percentile(double[] values, double fraction) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
