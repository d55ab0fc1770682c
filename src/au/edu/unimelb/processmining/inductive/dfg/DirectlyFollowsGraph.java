package au.edu.unimelb.processmining.inductive.dfg;

import gnu.trove.iterator.TObjectIntIterator;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.*;

/**
 * Weighted directly-follows graph of a log. Nodes are the activities of the log, an edge
 * {@code a->b} carries the number of times {@code a} is immediately followed by {@code b}.
 * Start and end activities are recorded with the frequency of the traces they open or close.
 * <p>
 * Instances are only produced by {@link DirectlyFollowsGraphBuilder} and {@link NoiseFilter}
 * and never change afterwards. Zero-weight edges are never stored.
 */
public final class DirectlyFollowsGraph {

    private final SortedSet<String> activities;
    private final TObjectIntMap<String> startActivities;
    private final TObjectIntMap<String> endActivities;
    private final TObjectIntMap<Edge> edges;
    private final int emptyTraceFrequency;

    private final Map<String, SortedSet<String>> successors = new HashMap<>();
    private final Map<String, SortedSet<String>> predecessors = new HashMap<>();

    DirectlyFollowsGraph(SortedSet<String> activities, TObjectIntMap<String> startActivities,
                         TObjectIntMap<String> endActivities, TObjectIntMap<Edge> edges, int emptyTraceFrequency) {
        this.activities = Collections.unmodifiableSortedSet(new TreeSet<>(activities));
        this.startActivities = startActivities;
        this.endActivities = endActivities;
        this.edges = edges;
        this.emptyTraceFrequency = emptyTraceFrequency;

        for (String activity : activities) {
            successors.put(activity, new TreeSet<>());
            predecessors.put(activity, new TreeSet<>());
        }
        for (Edge edge : edges.keySet()) {
            successors.get(edge.source).add(edge.target);
            predecessors.get(edge.target).add(edge.source);
        }
    }

    public SortedSet<String> getActivities() {
        return activities;
    }

    public SortedSet<String> getStartActivities() {
        return new TreeSet<>(startActivities.keySet());
    }

    public SortedSet<String> getEndActivities() {
        return new TreeSet<>(endActivities.keySet());
    }

    public boolean isStart(String activity) {
        return startActivities.containsKey(activity);
    }

    public boolean isEnd(String activity) {
        return endActivities.containsKey(activity);
    }

    public int getStartFrequency(String activity) {
        return startActivities.get(activity);
    }

    public int getEndFrequency(String activity) {
        return endActivities.get(activity);
    }

    public boolean hasEdge(String source, String target) {
        return edges.containsKey(new Edge(source, target));
    }

    /**
     * @return the weight of {@code source->target}, 0 when the edge is absent
     */
    public int getWeight(String source, String target) {
        return edges.get(new Edge(source, target));
    }

    public SortedSet<Edge> getEdges() {
        return new TreeSet<>(edges.keySet());
    }

    public int edgeCount() {
        return edges.size();
    }

    public int maxEdgeWeight() {
        int max = 0;
        for (int weight : edges.values()) max = Math.max(max, weight);
        return max;
    }

    public long totalEdgeWeight() {
        long total = 0;
        for (int weight : edges.values()) total += weight;
        return total;
    }

    public SortedSet<String> getSuccessors(String activity) {
        SortedSet<String> result = successors.get(activity);
        return result == null ? Collections.<String>emptySortedSet() : Collections.unmodifiableSortedSet(result);
    }

    public SortedSet<String> getPredecessors(String activity) {
        SortedSet<String> result = predecessors.get(activity);
        return result == null ? Collections.<String>emptySortedSet() : Collections.unmodifiableSortedSet(result);
    }

    /**
     * An empty trace contributes neither a start nor an end activity but makes the silent path viable.
     */
    public boolean containsEmptyTrace() {
        return emptyTraceFrequency > 0;
    }

    public int getEmptyTraceFrequency() {
        return emptyTraceFrequency;
    }

    /**
     * Copy of this graph keeping only the edges whose weight is at least {@code minimumWeight}.
     * Nodes and start/end activities are kept unchanged.
     */
    DirectlyFollowsGraph retainEdges(double minimumWeight) {
        TObjectIntMap<Edge> kept = new TObjectIntHashMap<>();
        for (TObjectIntIterator<Edge> it = edges.iterator(); it.hasNext(); ) {
            it.advance();
            if (it.value() >= minimumWeight) kept.put(it.key(), it.value());
        }
        if (kept.size() == edges.size()) return this;
        return new DirectlyFollowsGraph(activities, startActivities, endActivities, kept, emptyTraceFrequency);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DFG[start=").append(getStartActivities());
        sb.append(", end=").append(getEndActivities());
        sb.append(", edges={");
        boolean first = true;
        for (Edge edge : getEdges()) {
            if (!first) sb.append(", ");
            sb.append(edge).append(':').append(edges.get(edge));
            first = false;
        }
        sb.append("}");
        if (containsEmptyTrace()) sb.append(", empty=").append(emptyTraceFrequency);
        return sb.append(']').toString();
    }
}
