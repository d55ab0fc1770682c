package au.edu.unimelb.processmining.inductive.tree;

import au.edu.unimelb.processmining.inductive.cuts.Cut;

import java.util.*;

/**
 * Immutable process tree node: an activity leaf, the silent leaf tau, or an operator over an
 * ordered list of children. Operators always have two or more children; the first child of a
 * loop is its do-part, the others are redo-parts.
 * <p>
 * A loop produced as a complexity-capped flower model records the activities it had to leave
 * out. Such a tree is {@link #isDegraded() degraded}: it no longer describes every activity of
 * the log it was mined from.
 */
public final class ProcessTree {

    public enum Type {
        ACTIVITY, TAU, SEQ, XOR, AND, LOOP;

        public boolean isOperator() {
            return this != ACTIVITY && this != TAU;
        }
    }

    private static final ProcessTree TAU = new ProcessTree(Type.TAU, null,
            Collections.<ProcessTree>emptyList(), Collections.<String>emptySortedSet());

    private final Type type;
    private final String label;
    private final List<ProcessTree> children;
    private final SortedSet<String> omitted;

    private ProcessTree(Type type, String label, List<ProcessTree> children, SortedSet<String> omitted) {
        this.type = type;
        this.label = label;
        this.children = children;
        this.omitted = omitted;
    }

    public static ProcessTree activity(String label) {
        if (label == null || label.isEmpty()) throw new IllegalArgumentException("Activity label must not be empty");
        return new ProcessTree(Type.ACTIVITY, label, Collections.<ProcessTree>emptyList(),
                Collections.<String>emptySortedSet());
    }

    public static ProcessTree tau() {
        return TAU;
    }

    public static ProcessTree sequence(List<ProcessTree> children) {
        return operator(Type.SEQ, children);
    }

    public static ProcessTree exclusive(List<ProcessTree> children) {
        return operator(Type.XOR, children);
    }

    public static ProcessTree parallel(List<ProcessTree> children) {
        return operator(Type.AND, children);
    }

    public static ProcessTree loop(List<ProcessTree> children) {
        return operator(Type.LOOP, children);
    }

    public static ProcessTree sequence(ProcessTree... children) {
        return sequence(Arrays.asList(children));
    }

    public static ProcessTree exclusive(ProcessTree... children) {
        return exclusive(Arrays.asList(children));
    }

    public static ProcessTree parallel(ProcessTree... children) {
        return parallel(Arrays.asList(children));
    }

    public static ProcessTree loop(ProcessTree... children) {
        return loop(Arrays.asList(children));
    }

    /**
     * Operator node matching the kind of a cut.
     */
    public static ProcessTree fromCut(Cut.Operator operator, List<ProcessTree> children) {
        switch (operator) {
            case EXCLUSIVE:
                return exclusive(children);
            case SEQUENCE:
                return sequence(children);
            case PARALLEL:
                return parallel(children);
            case LOOP:
                return loop(children);
            default:
                throw new IllegalArgumentException("Unknown operator " + operator);
        }
    }

    /**
     * The flower model: a loop with a silent do-part and one redo leaf per activity, allowing
     * the activities in any order and any number of times.
     *
     * @param activities activities kept as leaves, in the order given
     * @param omitted    activities that had to be left out, empty for a faithful flower
     */
    public static ProcessTree flower(Collection<String> activities, Collection<String> omitted) {
        List<ProcessTree> children = new ArrayList<>();
        children.add(TAU);
        for (String activity : activities) children.add(activity(activity));
        if (children.size() < 2) throw new IllegalArgumentException("A flower needs at least one activity");
        return new ProcessTree(Type.LOOP, null, Collections.unmodifiableList(children),
                Collections.unmodifiableSortedSet(new TreeSet<>(omitted)));
    }

    public static ProcessTree operator(Type type, List<ProcessTree> children) {
        if (!type.isOperator()) throw new IllegalArgumentException(type + " is not an operator");
        if (children.size() < 2) {
            throw new IllegalArgumentException(type + " needs at least two children, got " + children.size());
        }
        for (ProcessTree child : children) Objects.requireNonNull(child, "child");
        return new ProcessTree(type, null, Collections.unmodifiableList(new ArrayList<>(children)),
                Collections.<String>emptySortedSet());
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the activity label of a leaf, null for tau and operators
     */
    public String getLabel() {
        return label;
    }

    public List<ProcessTree> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return !type.isOperator();
    }

    public boolean isTau() {
        return type == Type.TAU;
    }

    /**
     * @return the activities left out of complexity-capped flowers anywhere in this tree
     */
    public SortedSet<String> getOmittedActivities() {
        SortedSet<String> result = new TreeSet<>(omitted);
        for (ProcessTree child : children) result.addAll(child.getOmittedActivities());
        return result;
    }

    public boolean isDegraded() {
        if (!omitted.isEmpty()) return true;
        for (ProcessTree child : children) {
            if (child.isDegraded()) return true;
        }
        return false;
    }

    /**
     * @return the labels of all activity leaves
     */
    public SortedSet<String> getActivities() {
        SortedSet<String> result = new TreeSet<>();
        collectActivities(result);
        return result;
    }

    private void collectActivities(Set<String> result) {
        if (type == Type.ACTIVITY) result.add(label);
        for (ProcessTree child : children) child.collectActivities(result);
    }

    /**
     * @return the number of nodes of this tree
     */
    public int size() {
        int size = 1;
        for (ProcessTree child : children) size += child.size();
        return size;
    }

    public <R> R accept(ProcessTreeVisitor<R> visitor) {
        if (type == Type.ACTIVITY) return visitor.visitActivity(this);
        if (type == Type.TAU) return visitor.visitTau(this);

        List<R> results = new ArrayList<>(children.size());
        for (ProcessTree child : children) results.add(child.accept(visitor));

        switch (type) {
            case SEQ:
                return visitor.visitSequence(this, results);
            case XOR:
                return visitor.visitExclusive(this, results);
            case AND:
                return visitor.visitParallel(this, results);
            case LOOP:
                return visitor.visitLoop(this, results);
            default:
                throw new IllegalStateException("Unexpected node type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessTree that = (ProcessTree) o;
        return type == that.type && Objects.equals(label, that.label) && children.equals(that.children)
                && omitted.equals(that.omitted);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, label, children, omitted);
    }

    /**
     * Textual notation: {@code ->( )} sequence, {@code X( )} choice, {@code +( )} parallel,
     * {@code *( )} loop, {@code tau}, quoted activity labels.
     */
    @Override
    public String toString() {
        switch (type) {
            case ACTIVITY:
                return "'" + label + "'";
            case TAU:
                return "tau";
            default:
                StringBuilder sb = new StringBuilder(symbol(type)).append('(');
                for (int i = 0; i < children.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(children.get(i));
                }
                if (!omitted.isEmpty()) sb.append(" omitted=").append(omitted);
                return sb.append(')').toString();
        }
    }

    private static String symbol(Type type) {
        switch (type) {
            case SEQ:
                return "->";
            case XOR:
                return "X";
            case AND:
                return "+";
            case LOOP:
                return "*";
            default:
                return type.name();
        }
    }
}
