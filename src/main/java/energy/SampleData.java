package energy;

import energy.ml.Matrix;

/**
 * Daily electricity consumption (kWh) with the day's mean temperature: 20 training days and
 * six further days used to check the rolling forecast.
 */
public final class SampleData {

    private SampleData() {}

    /** Days 1..20 as [day, temperature]. */
    public static Matrix initialObservations() {
        return Matrix.of(
            new double[] {1, 21.5},
            new double[] {2, 21.2},
            new double[] {3, 22.1},
            new double[] {4, 25.1},
            new double[] {5, 26.4},
            new double[] {6, 22.6},
            new double[] {7, 17.7},
            new double[] {8, 18.5},
            new double[] {9, 21.2},
            new double[] {10, 20.3},
            new double[] {11, 17},
            new double[] {12, 19.2},
            new double[] {13, 19.4},
            new double[] {14, 21.9},
            new double[] {15, 25.5},
            new double[] {16, 26.3},
            new double[] {17, 26.3},
            new double[] {18, 24.7},
            new double[] {19, 21.4},
            new double[] {20, 21.04});
    }

    /** Consumption for days 1..20. */
    public static Matrix initialConsumption() {
        return Matrix.column(
            2357.85, 2669.7, 2669.7, 2998.05, 3512.85, 3542.55, 3248.85, 3341.25,
            3453.45, 3598.65, 3413.85, 4271.85, 4393.95, 3686.1, 3682.8, 3550.8,
            4719, 3979.35, 4131.6, 4141.5);
    }

    /** Days 21..26 as [day, temperature]. */
    public static Matrix additionalObservations() {
        return Matrix.of(
            new double[] {21, 21.3},
            new double[] {22, 23},
            new double[] {23, 23.45},
            new double[] {24, 23.8},
            new double[] {25, 21.42},
            new double[] {26, 23.09});
    }

    /** Actual consumption for days 21..26. */
    public static Matrix additionalConsumption() {
        return Matrix.column(4027.65, 3986.4, 3963.3, 4026, 3936.9, 3996.3);
    }
}
