package au.edu.unimelb.processmining.inductive.cuts;

import java.util.*;

/**
 * A partition of the activities of a directly-follows graph into two or more disjoint,
 * non-empty parts, tagged with the operator it was found for.
 * <p>
 * For {@link Operator#SEQUENCE} the parts are in execution order, for {@link Operator#LOOP}
 * the first part is the do-part and the others are redo-parts. For the other operators the
 * order is stable (by smallest activity) but carries no meaning.
 */
public final class Cut {

    public enum Operator {
        EXCLUSIVE("xor"), SEQUENCE("seq"), PARALLEL("and"), LOOP("loop");

        private final String label;

        Operator(String label) {
            this.label = label;
        }

        public String toString() {
            return label;
        }
    }

    private final Operator operator;
    private final List<SortedSet<String>> partitions;
    private final boolean filtered;

    public Cut(Operator operator, List<? extends Set<String>> partitions) {
        this(operator, partitions, false);
    }

    private Cut(Operator operator, List<? extends Set<String>> partitions, boolean filtered) {
        if (partitions.size() < 2) {
            throw new IllegalArgumentException("A cut needs at least two partitions, got " + partitions);
        }
        Set<String> seen = new HashSet<>();
        List<SortedSet<String>> copy = new ArrayList<>(partitions.size());
        for (Set<String> partition : partitions) {
            if (partition.isEmpty()) throw new IllegalArgumentException("Empty partition in " + partitions);
            for (String activity : partition) {
                if (!seen.add(activity)) {
                    throw new IllegalArgumentException("Activity " + activity + " appears in more than one partition");
                }
            }
            copy.add(Collections.unmodifiableSortedSet(new TreeSet<>(partition)));
        }
        this.operator = Objects.requireNonNull(operator);
        this.partitions = Collections.unmodifiableList(copy);
        this.filtered = filtered;
    }

    /**
     * @return the same partition marked as found on a filtered or simplified graph
     */
    public Cut asFiltered() {
        return filtered ? this : new Cut(operator, partitions, true);
    }

    public Operator getOperator() {
        return operator;
    }

    public List<SortedSet<String>> getPartitions() {
        return partitions;
    }

    public int size() {
        return partitions.size();
    }

    /**
     * Traces of the log may violate a cut found on a filtered graph, so splitting has to
     * tolerate deviations.
     */
    public boolean isFiltered() {
        return filtered;
    }

    /**
     * @return the index of the partition holding the activity, -1 when none does
     */
    public int partitionOf(String activity) {
        for (int i = 0; i < partitions.size(); i++) {
            if (partitions.get(i).contains(activity)) return i;
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cut cut = (Cut) o;
        return filtered == cut.filtered && operator == cut.operator && partitions.equals(cut.partitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, partitions, filtered);
    }

    @Override
    public String toString() {
        return operator + partitions.toString() + (filtered ? " (filtered)" : "");
    }
}
