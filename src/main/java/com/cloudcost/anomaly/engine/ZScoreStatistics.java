package com.cloudcost.anomaly.engine;

/**
 * Population statistics used by the Z-score detector.
 *
 * Standard deviation divides by N, not N-1. On short series the two conventions flag
 * different days, so callers must not assume sample statistics.
 */
public final class ZScoreStatistics {

    private ZScoreStatistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation around the given mean. Returns exactly 0 for fewer than
     * two values or when every value is identical, so a constant series never produces
     * rounding-noise deviations.
     */
    public static double populationStdDev(double[] values, double mean) {
        if (values.length < 2 || isConstant(values)) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (double v : values) {
            double dev = v - mean;
            sumSq += dev * dev;
        }
        return Math.sqrt(sumSq / values.length);
    }

    /**
     * (value - mean) / stdDev. Undefined for stdDev == 0, which is rejected rather than
     * allowed to produce NaN or Infinity.
     */
    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev <= 0.0) {
            throw new IllegalArgumentException("Z-score undefined for non-positive standard deviation: " + stdDev);
        }
        return (value - mean) / stdDev;
    }

    static boolean isConstant(double[] values) {
        double first = values[0];
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], first) != 0) {
                return false;
            }
        }
        return true;
    }
}
