package au.edu.unimelb.processmining.inductive.miner;

import au.edu.unimelb.processmining.inductive.cuts.Cut;
import au.edu.unimelb.processmining.inductive.dfg.DirectlyFollowsGraph;
import au.edu.unimelb.processmining.inductive.dfg.Edge;
import au.edu.unimelb.processmining.inductive.log.EventLog;
import org.apache.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Decides whether a cut describes its log well enough to be accepted by the approximate miner.
 * Every check is measured against the real log and its unfiltered graph, never against the
 * simplified graph the cut may have been found on.
 */
public class CutQualityValidator {

    private static final Logger LOGGER = Logger.getLogger(CutQualityValidator.class);

    /**
     * Largest share of all activities a loop's redo-parts may hold at zero tolerance. The
     * tolerance is added on top of it.
     */
    public static final double BASE_REDO_SHARE = 0.6;

    private final double tolerance;

    public CutQualityValidator(double tolerance) {
        if (!(tolerance >= 0.0 && tolerance <= 1.0)) {
            throw new IllegalArgumentException("Tolerance must be within [0,1], was " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public boolean accept(Cut cut, EventLog log, DirectlyFollowsGraph dfg) {
        boolean accepted;
        switch (cut.getOperator()) {
            case EXCLUSIVE:
                accepted = leakage(cut, dfg) <= tolerance;
                break;
            case SEQUENCE:
                accepted = orderRatio(cut, log) >= 1.0 - tolerance;
                break;
            case PARALLEL:
                accepted = minimumPresence(cut, log) >= 1.0 - tolerance;
                break;
            case LOOP:
                accepted = redoShare(cut) <= maximumRedoShare();
                break;
            default:
                throw new IllegalArgumentException("Unknown cut operator " + cut.getOperator());
        }
        if (!accepted && LOGGER.isDebugEnabled()) LOGGER.debug("Cut rejected: " + cut);
        return accepted;
    }

    public double maximumRedoShare() {
        return Math.min(1.0, BASE_REDO_SHARE + tolerance);
    }

    /**
     * @return the share of the graph's edge weight running between different partitions
     */
    public static double leakage(Cut cut, DirectlyFollowsGraph dfg) {
        long total = dfg.totalEdgeWeight();
        if (total == 0) return 0.0;

        long crossing = 0;
        for (Edge edge : dfg.getEdges()) {
            if (cut.partitionOf(edge.source) != cut.partitionOf(edge.target)) {
                crossing += dfg.getWeight(edge.source, edge.target);
            }
        }
        return crossing / (double) total;
    }

    /**
     * @return the frequency weighted share of traces that visit the partitions in order
     */
    public static double orderRatio(Cut cut, EventLog log) {
        long total = log.totalFrequency();
        if (total == 0) return 1.0;

        long ordered = 0;
        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            int current = 0;
            boolean inOrder = true;
            for (String activity : entry.getKey()) {
                int partition = cut.partitionOf(activity);
                if (partition < current) {
                    inOrder = false;
                    break;
                }
                current = partition;
            }
            if (inOrder) ordered += entry.getValue();
        }
        return ordered / (double) total;
    }

    /**
     * @return the smallest share of traces, over all partitions, that contain the partition
     */
    public static double minimumPresence(Cut cut, EventLog log) {
        long total = log.totalFrequency();
        if (total == 0) return 1.0;

        double minimum = 1.0;
        for (Set<String> partition : cut.getPartitions()) {
            long present = 0;
            for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
                for (String activity : entry.getKey()) {
                    if (partition.contains(activity)) {
                        present += entry.getValue();
                        break;
                    }
                }
            }
            minimum = Math.min(minimum, present / (double) total);
        }
        return minimum;
    }

    public static double redoShare(Cut cut) {
        int all = 0;
        int redo = 0;
        List<SortedSet<String>> partitions = cut.getPartitions();
        for (int i = 0; i < partitions.size(); i++) {
            all += partitions.get(i).size();
            if (i > 0) redo += partitions.get(i).size();
        }
        return redo / (double) all;
    }
}
