package au.edu.unimelb.processmining.inductive.dfg;

/**
 * Frequency based views of a directly-follows graph. Both policies drop every edge lighter than
 * {@code threshold * heaviest edge} and keep all nodes, so activities may end up isolated.
 */
public final class NoiseFilter {

    private NoiseFilter() {
    }

    /**
     * Infrequent-edge filtering. A threshold of 0 returns the graph unchanged, a threshold of 1
     * only keeps the heaviest edge(s).
     */
    public static DirectlyFollowsGraph filterInfrequentEdges(DirectlyFollowsGraph dfg, double noiseThreshold) {
        checkThreshold(noiseThreshold);
        if (noiseThreshold == 0.0 || dfg.edgeCount() == 0) return dfg;
        return dfg.retainEdges(dfg.maxEdgeWeight() * noiseThreshold);
    }

    /**
     * One round of progressive simplification. Start and end membership survives for nodes
     * that are left without edges; the caller decides on the strictness of the next round.
     */
    public static DirectlyFollowsGraph simplify(DirectlyFollowsGraph dfg, double simplificationThreshold) {
        checkThreshold(simplificationThreshold);
        if (simplificationThreshold == 0.0 || dfg.edgeCount() == 0) return dfg;
        return dfg.retainEdges(dfg.maxEdgeWeight() * simplificationThreshold);
    }

    private static void checkThreshold(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Threshold must be within [0,1], was " + threshold);
        }
    }
}
