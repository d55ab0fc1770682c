package au.edu.unimelb.processmining.inductive.log;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.*;

/**
 * An immutable multiset of traces. Each distinct trace (an ordered sequence of activity labels)
 * is mapped to the number of process instances that produced it. The empty trace is legal and
 * stands for instances without any recorded activity.
 * <p>
 * Iteration follows insertion order, so logs derived from the same input are iterated identically.
 */
public final class EventLog {

    private static final EventLog EMPTY = new EventLog(new LinkedHashMap<>());

    private final Map<List<String>, Integer> traces;
    private final SortedSet<String> activities;

    private EventLog(LinkedHashMap<List<String>, Integer> traces) {
        this.traces = Collections.unmodifiableMap(traces);

        SortedSet<String> alphabet = new TreeSet<>();
        for (List<String> trace : traces.keySet()) alphabet.addAll(trace);
        this.activities = Collections.unmodifiableSortedSet(alphabet);
    }

    public static EventLog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convenience factory used mostly by callers that already hold a trace-to-frequency map.
     */
    public static EventLog of(Map<List<String>, Integer> traces) {
        Builder builder = new Builder();
        for (Map.Entry<List<String>, Integer> entry : traces.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Missing frequency for trace " + entry.getKey());
            }
            builder.add(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * @return the distinct traces and their frequencies, read-only
     */
    public Map<List<String>, Integer> getTraces() {
        return traces;
    }

    public Set<List<String>> distinctTraces() {
        return traces.keySet();
    }

    public int getFrequency(List<String> trace) {
        Integer frequency = traces.get(trace);
        return frequency == null ? 0 : frequency;
    }

    /**
     * @return the activities occurring in this log, in label order
     */
    public SortedSet<String> getActivities() {
        return activities;
    }

    public boolean isEmpty() {
        return traces.isEmpty();
    }

    public int size() {
        return traces.size();
    }

    public long totalFrequency() {
        long total = 0;
        for (int frequency : traces.values()) total += frequency;
        return total;
    }

    public boolean containsEmptyTrace() {
        return traces.containsKey(Collections.<String>emptyList());
    }

    public int emptyTraceFrequency() {
        return getFrequency(Collections.<String>emptyList());
    }

    /**
     * @return a new log holding every trace of this log except the empty one
     */
    public EventLog withoutEmptyTrace() {
        if (!containsEmptyTrace()) return this;
        Builder builder = new Builder();
        for (Map.Entry<List<String>, Integer> entry : traces.entrySet()) {
            if (!entry.getKey().isEmpty()) builder.add(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Counts every occurrence of every activity, weighted by trace frequency.
     */
    public TObjectIntMap<String> activityFrequencies() {
        TObjectIntMap<String> frequencies = new TObjectIntHashMap<>();
        for (Map.Entry<List<String>, Integer> entry : traces.entrySet()) {
            for (String activity : entry.getKey()) {
                frequencies.adjustOrPutValue(activity, entry.getValue(), entry.getValue());
            }
        }
        return frequencies;
    }

    /**
     * @return how many occurrences of the given activity the log holds (frequency weighted)
     */
    public long occurrences(String activity) {
        long count = 0;
        for (Map.Entry<List<String>, Integer> entry : traces.entrySet()) {
            for (String event : entry.getKey()) {
                if (event.equals(activity)) count += entry.getValue();
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return traces.equals(((EventLog) o).traces);
    }

    @Override
    public int hashCode() {
        return traces.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<List<String>, Integer> entry : traces.entrySet()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.append('}').toString();
    }

    /**
     * Collects traces into a new log. Adding the same trace twice sums the frequencies.
     */
    public static final class Builder {

        private final LinkedHashMap<List<String>, Integer> traces = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        public Builder add(List<String> trace, int frequency) {
            if (built) throw new IllegalStateException("Builder already used");
            if (trace == null) throw new IllegalArgumentException("Trace must not be null");
            if (frequency <= 0) {
                throw new IllegalArgumentException("Frequency of trace " + trace + " must be positive, was " + frequency);
            }
            for (String activity : trace) {
                if (activity == null || activity.isEmpty()) {
                    throw new IllegalArgumentException("Trace " + trace + " contains a null or empty activity label");
                }
            }

            List<String> copy = Collections.unmodifiableList(new ArrayList<>(trace));
            Integer current = traces.get(copy);
            long sum = (current == null ? 0L : current) + frequency;
            if (sum > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Frequency of trace " + trace + " overflows");
            }
            traces.put(copy, (int) sum);
            return this;
        }

        public Builder add(int frequency, String... trace) {
            return add(Arrays.asList(trace), frequency);
        }

        public boolean isEmpty() {
            return traces.isEmpty();
        }

        public EventLog build() {
            built = true;
            if (traces.isEmpty()) return EMPTY;
            return new EventLog(traces);
        }
    }
}
