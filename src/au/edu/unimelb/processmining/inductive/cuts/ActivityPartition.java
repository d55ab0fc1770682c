package au.edu.unimelb.processmining.inductive.cuts;

import java.util.*;

/**
 * Union-find over activity labels. Groups are reported ordered by their smallest activity.
 */
final class ActivityPartition {

    private final TreeMap<String, String> parent = new TreeMap<>();

    ActivityPartition(Collection<String> activities) {
        for (String activity : activities) parent.put(activity, activity);
    }

    String find(String activity) {
        String root = activity;
        while (!parent.get(root).equals(root)) root = parent.get(root);

        // path compression
        String current = activity;
        while (!current.equals(root)) {
            String next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    /**
     * @return true if the two activities were in different groups before
     */
    boolean union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        if (rootA.equals(rootB)) return false;
        // keep the smaller label as representative, purely for readable debugging
        if (rootA.compareTo(rootB) < 0) parent.put(rootB, rootA);
        else parent.put(rootA, rootB);
        return true;
    }

    List<SortedSet<String>> groups() {
        Map<String, SortedSet<String>> byRoot = new LinkedHashMap<>();
        for (String activity : parent.keySet()) {
            byRoot.computeIfAbsent(find(activity), k -> new TreeSet<>()).add(activity);
        }
        return new ArrayList<>(byRoot.values());
    }

    int groupCount() {
        int count = 0;
        for (Map.Entry<String, String> entry : parent.entrySet()) {
            if (entry.getKey().equals(entry.getValue())) count++;
        }
        return count;
    }
}
