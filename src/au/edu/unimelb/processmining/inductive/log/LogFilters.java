package au.edu.unimelb.processmining.inductive.log;

import gnu.trove.iterator.TObjectIntIterator;
import gnu.trove.map.TObjectIntMap;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Log-level frequency filters applied once, before discovery starts.
 */
public final class LogFilters {

    private static final Logger LOGGER = Logger.getLogger(LogFilters.class);

    private LogFilters() {
    }

    /**
     * Removes infrequent traces, then infrequent activities. Both thresholds are measured on the
     * log as given, so dropping traces does not change which activities count as infrequent.
     */
    public static EventLog filter(EventLog log, double activityThreshold, double tracesThreshold) {
        Set<String> infrequent = infrequentActivities(log, activityThreshold);
        EventLog filtered = filterTraces(log, minimumTraceFrequency(log, tracesThreshold));
        if (!infrequent.isEmpty()) {
            LOGGER.debug("Removing infrequent activities " + infrequent);
        }
        return removeActivities(filtered, infrequent);
    }

    /**
     * @return round(max trace frequency * threshold), rounding half to even
     */
    public static int minimumTraceFrequency(EventLog log, double threshold) {
        checkThreshold(threshold, "traces threshold");
        int max = 0;
        for (int frequency : log.getTraces().values()) max = Math.max(max, frequency);
        return (int) Math.rint(max * threshold);
    }

    /**
     * @return the activities whose occurrence count is below round(max activity count * threshold)
     */
    public static Set<String> infrequentActivities(EventLog log, double threshold) {
        checkThreshold(threshold, "activity threshold");
        TObjectIntMap<String> frequencies = log.activityFrequencies();
        if (frequencies.isEmpty()) return Collections.emptySet();

        int max = 0;
        for (int value : frequencies.values()) max = Math.max(max, value);
        long minimum = (long) Math.rint(max * threshold);

        Set<String> infrequent = new TreeSet<>();
        for (TObjectIntIterator<String> it = frequencies.iterator(); it.hasNext(); ) {
            it.advance();
            if (it.value() < minimum) infrequent.add(it.key());
        }
        return infrequent;
    }

    public static EventLog filterTraces(EventLog log, int minimumFrequency) {
        EventLog.Builder builder = EventLog.builder();
        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            if (entry.getValue() >= minimumFrequency) builder.add(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Projects every trace onto the remaining activities. A trace emptied by the projection is
     * dropped, a trace that was empty to begin with is kept.
     */
    public static EventLog removeActivities(EventLog log, Set<String> activities) {
        if (activities.isEmpty()) return log;

        EventLog.Builder builder = EventLog.builder();
        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            List<String> trace = entry.getKey();
            List<String> projected = new ArrayList<>(trace.size());
            for (String activity : trace) {
                if (!activities.contains(activity)) projected.add(activity);
            }
            if (projected.isEmpty() && !trace.isEmpty()) continue;
            builder.add(projected, entry.getValue());
        }
        return builder.build();
    }

    private static void checkThreshold(double threshold, String name) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("The " + name + " must be within [0,1], was " + threshold);
        }
    }
}
