package au.edu.unimelb.processmining.inductive.miner;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of one discovery run. Values are validated on construction and never clamped; a
 * threshold outside [0,1] is rejected with an {@link IllegalArgumentException}.
 * <p>
 * The log filters ({@link #activityThreshold}, {@link #tracesThreshold}) apply to every variant,
 * {@link #noiseThreshold} only to {@link Variant#INFREQUENT}, the remaining ones only to
 * {@link Variant#APPROXIMATE}.
 */
public abstract class MinerParameters {

    public static enum Variant {
        STANDARD, INFREQUENT, APPROXIMATE;
    }

    public static final double DEFAULT_NOISE_THRESHOLD = 0.2;
    public static final double DEFAULT_SIMPLIFICATION_THRESHOLD = 0.1;
    public static final double DEFAULT_CUT_QUALITY_TOLERANCE = 0.2;
    public static final int DEFAULT_FLOWER_CAP = 10;
    public static final int DEFAULT_SIMPLIFICATION_ROUNDS = 3;
    public static final int NO_TIMEOUT = Integer.MAX_VALUE;

    public final Variant variant;
    public final double activityThreshold; // drop activities rarer than this share of the most frequent one
    public final double tracesThreshold; // drop traces rarer than this share of the most frequent one
    public final double noiseThreshold; // edge filter used when the full graph has no cut
    public final double simplificationThreshold; // strictness step of the simplification rounds
    public final double cutQualityTolerance;
    public final int flowerCap; // most activities kept in a fallthrough flower
    public final int maxSimplificationRounds;
    public final int timeoutMilliseconds; // budget for one run

    private MinerParameters(Variant variant, double activityThreshold, double tracesThreshold, double noiseThreshold,
                            double simplificationThreshold, double cutQualityTolerance, int flowerCap,
                            int maxSimplificationRounds, int timeoutMilliseconds) {
        if (variant == null) throw new IllegalArgumentException("No variant given");
        checkThreshold("activity threshold", activityThreshold);
        checkThreshold("traces threshold", tracesThreshold);
        checkThreshold("noise threshold", noiseThreshold);
        checkThreshold("simplification threshold", simplificationThreshold);
        checkThreshold("cut quality tolerance", cutQualityTolerance);
        if (flowerCap < 1) throw new IllegalArgumentException("The flower cap must be positive, was " + flowerCap);
        if (maxSimplificationRounds < 0) {
            throw new IllegalArgumentException("Simplification rounds must not be negative, was " + maxSimplificationRounds);
        }
        if (timeoutMilliseconds <= 0) {
            throw new IllegalArgumentException("The timeout must be positive, was " + timeoutMilliseconds);
        }

        this.variant = variant;
        this.activityThreshold = activityThreshold;
        this.tracesThreshold = tracesThreshold;
        this.noiseThreshold = noiseThreshold;
        this.simplificationThreshold = simplificationThreshold;
        this.cutQualityTolerance = cutQualityTolerance;
        this.flowerCap = flowerCap;
        this.maxSimplificationRounds = maxSimplificationRounds;
        this.timeoutMilliseconds = timeoutMilliseconds;
    }

    private static void checkThreshold(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("The " + name + " must be within [0,1], was " + value);
        }
    }

    public boolean hasTimeout() {
        return timeoutMilliseconds != NO_TIMEOUT;
    }

    /**
     * Reads parameters from a properties source. Recognised keys are {@code variant},
     * {@code activity.threshold}, {@code traces.threshold}, {@code noise.threshold},
     * {@code simplification.threshold}, {@code cut.quality.tolerance}, {@code flower.cap},
     * {@code simplification.rounds} and {@code timeout.ms}; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException when a value cannot be parsed or is out of range
     */
    public static MinerParameters load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return fromProperties(properties);
    }

    public static MinerParameters fromProperties(Properties properties) {
        String name = properties.getProperty("variant", Variant.STANDARD.name()).trim();
        Variant variant;
        try {
            variant = Variant.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown variant '" + name + "'", e);
        }

        // every key is checked, including those the chosen variant does not use
        double activityThreshold = readThreshold(properties, "activity.threshold", 0.0);
        double tracesThreshold = readThreshold(properties, "traces.threshold", 0.0);
        double noiseThreshold = readThreshold(properties, "noise.threshold", DEFAULT_NOISE_THRESHOLD);
        double simplificationThreshold = readThreshold(properties, "simplification.threshold",
                DEFAULT_SIMPLIFICATION_THRESHOLD);
        double tolerance = readThreshold(properties, "cut.quality.tolerance", DEFAULT_CUT_QUALITY_TOLERANCE);
        int flowerCap = readInt(properties, "flower.cap", DEFAULT_FLOWER_CAP, 1);
        int rounds = readInt(properties, "simplification.rounds", DEFAULT_SIMPLIFICATION_ROUNDS, 0);
        int timeout = readInt(properties, "timeout.ms", NO_TIMEOUT, 1);

        switch (variant) {
            case INFREQUENT:
                return new Infrequent(activityThreshold, tracesThreshold, noiseThreshold, timeout);
            case APPROXIMATE:
                return new Approximate(activityThreshold, tracesThreshold, simplificationThreshold, tolerance,
                        flowerCap, rounds, timeout);
            default:
                return new Standard(activityThreshold, tracesThreshold, timeout);
        }
    }

    private static double readThreshold(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) return fallback;
        double threshold;
        try {
            threshold = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Property " + key + " must be within [0,1], was " + value);
        }
        return threshold;
    }

    private static int readInt(Properties properties, String key, int fallback, int minimum) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) return fallback;
        int number;
        try {
            number = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
        if (number < minimum) {
            throw new IllegalArgumentException("Property " + key + " must be at least " + minimum + ", was " + value);
        }
        return number;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(variant.name().toLowerCase(Locale.ROOT));
        sb.append(" activity=").append(activityThreshold).append(" traces=").append(tracesThreshold);
        switch (variant) {
            case INFREQUENT:
                sb.append(" noise=").append(noiseThreshold);
                break;
            case APPROXIMATE:
                sb.append(" simplification=").append(simplificationThreshold)
                        .append(" tolerance=").append(cutQualityTolerance)
                        .append(" flowerCap=").append(flowerCap)
                        .append(" rounds=").append(maxSimplificationRounds);
                break;
            default:
                break;
        }
        if (hasTimeout()) sb.append(" timeout=").append(timeoutMilliseconds).append("ms");
        return sb.toString();
    }

    public final static class Standard extends MinerParameters {
        public Standard() {
            this(0.0, 0.0, NO_TIMEOUT);
        }

        public Standard(double activityThreshold, double tracesThreshold) {
            this(activityThreshold, tracesThreshold, NO_TIMEOUT);
        }

        public Standard(double activityThreshold, double tracesThreshold, int timeoutMilliseconds) {
            super(Variant.STANDARD, activityThreshold, tracesThreshold, DEFAULT_NOISE_THRESHOLD,
                    DEFAULT_SIMPLIFICATION_THRESHOLD, DEFAULT_CUT_QUALITY_TOLERANCE, DEFAULT_FLOWER_CAP,
                    DEFAULT_SIMPLIFICATION_ROUNDS, timeoutMilliseconds);
        }
    }

    public final static class Infrequent extends MinerParameters {
        public Infrequent() {
            this(DEFAULT_NOISE_THRESHOLD);
        }

        public Infrequent(double noiseThreshold) {
            this(0.0, 0.0, noiseThreshold, NO_TIMEOUT);
        }

        public Infrequent(double activityThreshold, double tracesThreshold, double noiseThreshold,
                          int timeoutMilliseconds) {
            super(Variant.INFREQUENT, activityThreshold, tracesThreshold, noiseThreshold,
                    DEFAULT_SIMPLIFICATION_THRESHOLD, DEFAULT_CUT_QUALITY_TOLERANCE, DEFAULT_FLOWER_CAP,
                    DEFAULT_SIMPLIFICATION_ROUNDS, timeoutMilliseconds);
        }
    }

    public final static class Approximate extends MinerParameters {
        public Approximate() {
            this(DEFAULT_SIMPLIFICATION_THRESHOLD);
        }

        public Approximate(double simplificationThreshold) {
            this(0.0, 0.0, simplificationThreshold, DEFAULT_CUT_QUALITY_TOLERANCE, DEFAULT_FLOWER_CAP,
                    DEFAULT_SIMPLIFICATION_ROUNDS, NO_TIMEOUT);
        }

        public Approximate(double activityThreshold, double tracesThreshold, double simplificationThreshold,
                           double cutQualityTolerance, int flowerCap, int maxSimplificationRounds,
                           int timeoutMilliseconds) {
            super(Variant.APPROXIMATE, activityThreshold, tracesThreshold, DEFAULT_NOISE_THRESHOLD,
                    simplificationThreshold, cutQualityTolerance, flowerCap, maxSimplificationRounds,
                    timeoutMilliseconds);
        }
    }
}
