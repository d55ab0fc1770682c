package au.edu.unimelb.processmining.inductive.dfg;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.List;
import java.util.Map;

public final class DirectlyFollowsGraphBuilder {

    private DirectlyFollowsGraphBuilder() {
    }

    /**
     * Derives the directly-follows graph of a log. Every consecutive pair of a trace seen
     * {@code f} times adds {@code f} to the weight of its edge; the first and last events of
     * non-empty traces become start and end activities.
     *
     * @param log the (sub-)log
     * @return a graph reflecting exactly this log, edge-less and node-less for an empty log
     */
    public static DirectlyFollowsGraph build(EventLog log) {
        TObjectIntMap<String> starts = new TObjectIntHashMap<>();
        TObjectIntMap<String> ends = new TObjectIntHashMap<>();
        TObjectIntMap<Edge> edges = new TObjectIntHashMap<>();
        int empty = 0;

        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            List<String> trace = entry.getKey();
            int frequency = entry.getValue();

            if (trace.isEmpty()) {
                empty += frequency;
                continue;
            }

            starts.adjustOrPutValue(trace.get(0), frequency, frequency);
            ends.adjustOrPutValue(trace.get(trace.size() - 1), frequency, frequency);
            for (int i = 0; i < trace.size() - 1; i++) {
                edges.adjustOrPutValue(new Edge(trace.get(i), trace.get(i + 1)), frequency, frequency);
            }
        }

        return new DirectlyFollowsGraph(log.getActivities(), starts, ends, edges, empty);
    }
}
