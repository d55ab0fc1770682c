package au.edu.unimelb.processmining.inductive.cuts;

import au.edu.unimelb.processmining.inductive.cuts.Cut.Operator;
import au.edu.unimelb.processmining.inductive.dfg.DirectlyFollowsGraph;
import au.edu.unimelb.processmining.inductive.dfg.Edge;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Looks for a cut of a directly-follows graph. The cuts are tried in the fixed order
 * exclusive, sequence, parallel, loop and the first one with two or more parts wins.
 */
public final class CutDetector {

    private static final Logger LOGGER = Logger.getLogger(CutDetector.class);

    private CutDetector() {
    }

    /**
     * @param dfg the graph of the log to decompose
     * @return the first cut found, null if none applies. Graphs of logs holding the empty trace
     * are never cut, the empty trace is dealt with by the fallthrough.
     */
    public static Cut findCut(DirectlyFollowsGraph dfg) {
        if (dfg.containsEmptyTrace() || dfg.getActivities().size() < 2) return null;

        Cut cut = findExclusiveCut(dfg);
        if (cut == null) cut = findSequenceCut(dfg);
        if (cut == null) cut = findParallelCut(dfg);
        if (cut == null) cut = findLoopCut(dfg);

        if (cut != null && LOGGER.isDebugEnabled()) LOGGER.debug("Cut found: " + cut);
        return cut;
    }

    /**
     * Connected components of the graph with edge direction ignored.
     */
    public static Cut findExclusiveCut(DirectlyFollowsGraph dfg) {
        ActivityPartition components = new ActivityPartition(dfg.getActivities());
        for (Edge edge : dfg.getEdges()) components.union(edge.source, edge.target);
        return toCut(Operator.EXCLUSIVE, components.groups());
    }

    /**
     * Activities that reach each other, or that cannot reach each other at all, end up in the
     * same group. The remaining groups are totally ordered by reachability.
     */
    public static Cut findSequenceCut(DirectlyFollowsGraph dfg) {
        List<String> activities = new ArrayList<>(dfg.getActivities());
        Map<String, Set<String>> reachable = reachability(dfg);

        ActivityPartition groups = new ActivityPartition(activities);
        for (int i = 0; i < activities.size(); i++) {
            for (int j = i + 1; j < activities.size(); j++) {
                String a = activities.get(i);
                String b = activities.get(j);
                boolean forward = reachable.get(a).contains(b);
                boolean backward = reachable.get(b).contains(a);
                if (forward == backward) groups.union(a, b);
            }
        }

        // merging may make whole groups mutually (un)reachable, repeat until stable
        List<SortedSet<String>> parts = groups.groups();
        boolean merged = true;
        while (merged && parts.size() > 1) {
            merged = false;
            search:
            for (int i = 0; i < parts.size(); i++) {
                for (int j = i + 1; j < parts.size(); j++) {
                    boolean forward = reaches(reachable, parts.get(i), parts.get(j));
                    boolean backward = reaches(reachable, parts.get(j), parts.get(i));
                    if (forward == backward) {
                        groups.union(parts.get(i).first(), parts.get(j).first());
                        merged = true;
                        break search;
                    }
                }
            }
            parts = groups.groups();
        }
        if (parts.size() < 2) return null;

        // a group comes before every group it reaches
        List<SortedSet<String>> ordered = new ArrayList<>(parts);
        Map<SortedSet<String>, Integer> reachCount = new HashMap<>();
        for (SortedSet<String> part : ordered) {
            int count = 0;
            for (SortedSet<String> other : ordered) {
                if (other != part && reaches(reachable, part, other)) count++;
            }
            reachCount.put(part, count);
        }
        ordered.sort((p, q) -> Integer.compare(reachCount.get(q), reachCount.get(p)));

        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                if (!reaches(reachable, ordered.get(i), ordered.get(j))
                        || reaches(reachable, ordered.get(j), ordered.get(i))) {
                    return null;
                }
            }
        }
        return new Cut(Operator.SEQUENCE, ordered);
    }

    /**
     * Parts are the components of the "not connected in both directions" relation. A part
     * without a start or an end activity cannot run on its own and is merged into another part.
     */
    public static Cut findParallelCut(DirectlyFollowsGraph dfg) {
        List<String> activities = new ArrayList<>(dfg.getActivities());
        ActivityPartition groups = new ActivityPartition(activities);
        for (int i = 0; i < activities.size(); i++) {
            for (int j = i + 1; j < activities.size(); j++) {
                String a = activities.get(i);
                String b = activities.get(j);
                if (!(dfg.hasEdge(a, b) && dfg.hasEdge(b, a))) groups.union(a, b);
            }
        }
        if (groups.groupCount() < 2) return null;

        List<SortedSet<String>> complete = new ArrayList<>();
        SortedSet<String> leftovers = new TreeSet<>();
        for (SortedSet<String> part : groups.groups()) {
            if (hasStartAndEnd(dfg, part)) complete.add(part);
            else leftovers.addAll(part);
        }

        if (!leftovers.isEmpty()) {
            if (hasStartAndEnd(dfg, leftovers)) {
                complete.add(leftovers);
            } else if (complete.isEmpty()) {
                return null;
            } else {
                complete.get(0).addAll(leftovers);
            }
        }
        if (complete.size() < 2) return null;

        complete.sort((p, q) -> p.first().compareTo(q.first()));
        return new Cut(Operator.PARALLEL, complete);
    }

    /**
     * The do-part holds all start and end activities. Every other component of the graph is a
     * redo candidate; candidates breaking the redo rules of isRedoPart are absorbed into
     * the do-part until the remaining ones are stable.
     */
    public static Cut findLoopCut(DirectlyFollowsGraph dfg) {
        SortedSet<String> starts = dfg.getStartActivities();
        SortedSet<String> ends = dfg.getEndActivities();
        if (starts.isEmpty() || ends.isEmpty()) return null;

        SortedSet<String> doPart = new TreeSet<>(starts);
        doPart.addAll(ends);

        List<String> rest = new ArrayList<>(dfg.getActivities());
        rest.removeAll(doPart);
        if (rest.isEmpty()) return null;

        ActivityPartition components = new ActivityPartition(rest);
        for (Edge edge : dfg.getEdges()) {
            if (!doPart.contains(edge.source) && !doPart.contains(edge.target)) {
                components.union(edge.source, edge.target);
            }
        }

        List<SortedSet<String>> redoParts = components.groups();
        boolean absorbed = true;
        while (absorbed) {
            absorbed = false;
            for (Iterator<SortedSet<String>> it = redoParts.iterator(); it.hasNext(); ) {
                SortedSet<String> part = it.next();
                if (!isRedoPart(dfg, part, doPart, starts, ends)) {
                    doPart.addAll(part);
                    it.remove();
                    absorbed = true;
                }
            }
        }
        if (redoParts.isEmpty()) return null;

        List<SortedSet<String>> partitions = new ArrayList<>();
        partitions.add(doPart);
        partitions.addAll(redoParts);
        return new Cut(Operator.LOOP, partitions);
    }

    /**
     * A redo-part is only entered from end activities and only left towards start activities.
     * An activity entered from one end activity must be entered from all of them, an activity
     * left towards one start activity must lead to all of them.
     */
    private static boolean isRedoPart(DirectlyFollowsGraph dfg, Set<String> part, Set<String> doPart,
                                      Set<String> starts, Set<String> ends) {
        boolean fromEnd = false;
        boolean toStart = false;

        for (String activity : part) {
            boolean entered = false;
            for (String predecessor : dfg.getPredecessors(activity)) {
                if (part.contains(predecessor)) continue;
                if (!doPart.contains(predecessor) || !ends.contains(predecessor)) return false;
                entered = true;
            }
            if (entered && !dfg.getPredecessors(activity).containsAll(ends)) return false;

            boolean left = false;
            for (String successor : dfg.getSuccessors(activity)) {
                if (part.contains(successor)) continue;
                if (!doPart.contains(successor) || !starts.contains(successor)) return false;
                left = true;
            }
            if (left && !dfg.getSuccessors(activity).containsAll(starts)) return false;

            fromEnd |= entered;
            toStart |= left;
        }
        return fromEnd && toStart;
    }

    private static boolean hasStartAndEnd(DirectlyFollowsGraph dfg, Set<String> part) {
        boolean start = false;
        boolean end = false;
        for (String activity : part) {
            start |= dfg.isStart(activity);
            end |= dfg.isEnd(activity);
        }
        return start && end;
    }

    /**
     * For every activity, the activities reachable over one or more edges.
     */
    static Map<String, Set<String>> reachability(DirectlyFollowsGraph dfg) {
        Map<String, Set<String>> reachable = new HashMap<>();
        for (String activity : dfg.getActivities()) {
            Set<String> visited = new HashSet<>();
            Deque<String> toVisit = new ArrayDeque<>(dfg.getSuccessors(activity));
            while (!toVisit.isEmpty()) {
                String current = toVisit.pop();
                if (visited.add(current)) toVisit.addAll(dfg.getSuccessors(current));
            }
            reachable.put(activity, visited);
        }
        return reachable;
    }

    private static boolean reaches(Map<String, Set<String>> reachable, Set<String> from, Set<String> to) {
        for (String activity : from) {
            for (String target : reachable.get(activity)) {
                if (to.contains(target)) return true;
            }
        }
        return false;
    }

    private static Cut toCut(Operator operator, List<SortedSet<String>> partitions) {
        return partitions.size() < 2 ? null : new Cut(operator, partitions);
    }
}
