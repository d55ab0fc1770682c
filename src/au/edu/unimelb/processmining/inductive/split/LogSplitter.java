package au.edu.unimelb.processmining.inductive.split;

import au.edu.unimelb.processmining.inductive.cuts.Cut;
import au.edu.unimelb.processmining.inductive.log.EventLog;

import java.util.*;

/**
 * Splits a log along a cut into one sub-log per partition, in partition order. A trace seen
 * {@code f} times contributes {@code f} to every sub-trace it is split into.
 * <p>
 * Traces that do not fit a cut found on the unfiltered graph reveal a defect in cut detection
 * and raise an {@link IllegalStateException}. Cuts found on a filtered graph are split leniently:
 * deviating events are dropped.
 */
public final class LogSplitter {

    private LogSplitter() {
    }

    public static List<EventLog> split(EventLog log, Cut cut) {
        switch (cut.getOperator()) {
            case EXCLUSIVE:
                return exclusiveSplit(log, cut);
            case SEQUENCE:
                return sequenceSplit(log, cut);
            case PARALLEL:
                return parallelSplit(log, cut);
            case LOOP:
                return loopSplit(log, cut);
            default:
                throw new IllegalArgumentException("Unknown cut operator " + cut.getOperator());
        }
    }

    /**
     * Every trace moves as a whole to the partition holding its activities.
     */
    public static List<EventLog> exclusiveSplit(EventLog log, Cut cut) {
        List<EventLog.Builder> builders = builders(cut);

        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            List<String> trace = entry.getKey();
            if (trace.isEmpty()) {
                throw new IllegalStateException("The empty trace cannot be assigned to a partition of " + cut);
            }

            int[] hits = new int[cut.size()];
            for (String activity : trace) hits[indexOf(cut, activity, trace)]++;

            int target = 0;
            for (int i = 1; i < hits.length; i++) {
                if (hits[i] > hits[target]) target = i;
            }
            if (hits[target] == trace.size()) {
                builders.get(target).add(trace, entry.getValue());
                continue;
            }

            if (!cut.isFiltered()) {
                throw new IllegalStateException("Trace " + trace + " spans several partitions of " + cut);
            }
            // keep the events of the dominant partition only
            List<String> projected = new ArrayList<>();
            for (String activity : trace) {
                if (cut.getPartitions().get(target).contains(activity)) projected.add(activity);
            }
            builders.get(target).add(projected, entry.getValue());
        }
        return build(builders);
    }

    /**
     * Walks the trace once. Events are collected while they belong to the current partition;
     * reaching a later partition flushes the collected sub-trace (possibly empty) and an empty
     * trace for every partition skipped on the way.
     */
    public static List<EventLog> sequenceSplit(EventLog log, Cut cut) {
        List<EventLog.Builder> builders = builders(cut);

        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            List<String> trace = entry.getKey();
            int frequency = entry.getValue();

            int current = 0;
            List<String> subTrace = new ArrayList<>();
            for (String activity : trace) {
                int partition = indexOf(cut, activity, trace);
                if (partition < current) {
                    if (!cut.isFiltered()) {
                        throw new IllegalStateException("Trace " + trace + " runs backwards through " + cut);
                    }
                    continue;
                }
                while (current < partition) {
                    builders.get(current).add(subTrace, frequency);
                    subTrace = new ArrayList<>();
                    current++;
                }
                subTrace.add(activity);
            }

            builders.get(current).add(subTrace, frequency);
            for (int i = current + 1; i < builders.size(); i++) {
                builders.get(i).add(Collections.<String>emptyList(), frequency);
            }
        }
        return build(builders);
    }

    /**
     * Projects every trace onto every partition, keeping the relative order of the events.
     */
    public static List<EventLog> parallelSplit(EventLog log, Cut cut) {
        List<EventLog.Builder> builders = builders(cut);

        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            List<String> trace = entry.getKey();
            List<List<String>> projections = new ArrayList<>();
            for (int i = 0; i < cut.size(); i++) projections.add(new ArrayList<>());

            for (String activity : trace) projections.get(indexOf(cut, activity, trace)).add(activity);

            for (int i = 0; i < cut.size(); i++) builders.get(i).add(projections.get(i), entry.getValue());
        }
        return build(builders);
    }

    /**
     * Cuts the trace into maximal runs of events from the same partition; each run becomes a
     * trace of that partition's sub-log.
     */
    public static List<EventLog> loopSplit(EventLog log, Cut cut) {
        List<EventLog.Builder> builders = builders(cut);

        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            List<String> trace = entry.getKey();
            if (trace.isEmpty()) {
                throw new IllegalStateException("The empty trace cannot be assigned to a partition of " + cut);
            }
            int frequency = entry.getValue();

            int current = indexOf(cut, trace.get(0), trace);
            List<String> subTrace = new ArrayList<>();
            for (String activity : trace) {
                int partition = indexOf(cut, activity, trace);
                if (partition != current) {
                    builders.get(current).add(subTrace, frequency);
                    subTrace = new ArrayList<>();
                    current = partition;
                }
                subTrace.add(activity);
            }
            builders.get(current).add(subTrace, frequency);
        }
        return build(builders);
    }

    private static int indexOf(Cut cut, String activity, List<String> trace) {
        int index = cut.partitionOf(activity);
        if (index < 0) {
            throw new IllegalStateException("Activity " + activity + " of trace " + trace + " is not covered by " + cut);
        }
        return index;
    }

    private static List<EventLog.Builder> builders(Cut cut) {
        List<EventLog.Builder> builders = new ArrayList<>(cut.size());
        for (int i = 0; i < cut.size(); i++) builders.add(EventLog.builder());
        return builders;
    }

    private static List<EventLog> build(List<EventLog.Builder> builders) {
        List<EventLog> logs = new ArrayList<>(builders.size());
        for (EventLog.Builder builder : builders) logs.add(builder.build());
        return logs;
    }
}
