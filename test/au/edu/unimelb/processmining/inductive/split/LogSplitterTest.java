package au.edu.unimelb.processmining.inductive.split;

import au.edu.unimelb.processmining.inductive.cuts.Cut;
import au.edu.unimelb.processmining.inductive.cuts.Cut.Operator;
import au.edu.unimelb.processmining.inductive.log.EventLog;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class LogSplitterTest {

    private static Cut cut(Operator operator, String... partitions) {
        List<Set<String>> parts = new ArrayList<>();
        for (String partition : partitions) parts.add(new TreeSet<>(Arrays.asList(partition.split(""))));
        return new Cut(operator, parts);
    }

    private static EventLog log(Object... traceAndFrequency) {
        EventLog.Builder builder = EventLog.builder();
        for (int i = 0; i < traceAndFrequency.length; i += 2) {
            String trace = (String) traceAndFrequency[i];
            List<String> events = trace.isEmpty() ? Collections.<String>emptyList() : Arrays.asList(trace.split(""));
            builder.add(events, (Integer) traceAndFrequency[i + 1]);
        }
        return builder.build();
    }

    @Test
    void exclusiveSplitMovesWholeTraces() {
        List<EventLog> logs = LogSplitter.split(log("ab", 3, "cd", 2, "dc", 1), cut(Operator.EXCLUSIVE, "ab", "cd"));

        assertEquals(log("ab", 3), logs.get(0));
        assertEquals(log("cd", 2, "dc", 1), logs.get(1));
    }

    @Test
    void exclusiveSplitRejectsTracesSpanningPartitions() {
        assertThrows(IllegalStateException.class,
                () -> LogSplitter.split(log("ac", 1), cut(Operator.EXCLUSIVE, "ab", "cd")));
    }

    @Test
    void filteredExclusiveSplitProjectsOnTheDominantPartition() {
        Cut cut = cut(Operator.EXCLUSIVE, "a", "b").asFiltered();

        List<EventLog> logs = LogSplitter.split(log("aab", 2, "b", 1), cut);

        assertEquals(log("aa", 2), logs.get(0));
        assertEquals(log("b", 1), logs.get(1));
    }

    @Test
    void sequenceSplitEmitsEmptyTracesForSkippedPartitions() {
        List<EventLog> logs = LogSplitter.split(log("ac", 2, "abc", 1), cut(Operator.SEQUENCE, "a", "b", "c"));

        assertEquals(log("a", 3), logs.get(0));
        assertEquals(log("", 2, "b", 1), logs.get(1));
        assertEquals(log("c", 3), logs.get(2));
    }

    @Test
    void sequenceSplitOfTheEmptyTrace() {
        List<EventLog> logs = LogSplitter.split(log("", 4), cut(Operator.SEQUENCE, "a", "b"));

        assertEquals(log("", 4), logs.get(0));
        assertEquals(log("", 4), logs.get(1));
    }

    @Test
    void sequenceSplitRejectsBackwardEvents() {
        assertThrows(IllegalStateException.class,
                () -> LogSplitter.split(log("ba", 1), cut(Operator.SEQUENCE, "a", "b")));
    }

    @Test
    void filteredSequenceSplitDropsBackwardEvents() {
        Cut cut = cut(Operator.SEQUENCE, "a", "b").asFiltered();

        List<EventLog> logs = LogSplitter.split(log("ba", 1, "ab", 5), cut);

        assertEquals(log("", 1, "a", 5), logs.get(0));
        assertEquals(log("b", 6), logs.get(1));
    }

    @Test
    void parallelSplitProjectsEveryTrace() {
        List<EventLog> logs = LogSplitter.split(log("acb", 2, "bca", 1), cut(Operator.PARALLEL, "ac", "b"));

        assertEquals(log("ac", 2, "ca", 1), logs.get(0));
        assertEquals(log("b", 3), logs.get(1));
    }

    @Test
    void loopSplitCutsTracesIntoRuns() {
        List<EventLog> logs = LogSplitter.split(log("aba", 2), cut(Operator.LOOP, "a", "b"));

        assertEquals(log("a", 4), logs.get(0));
        assertEquals(log("b", 2), logs.get(1));
    }

    @Test
    void loopSplitKeepsRunsTogether() {
        List<EventLog> logs = LogSplitter.split(log("abcdab", 1, "ab", 3), cut(Operator.LOOP, "ab", "cd"));

        assertEquals(log("ab", 5), logs.get(0));
        assertEquals(log("cd", 1), logs.get(1));
    }

    @Test
    void uncoveredActivitiesAreADefect() {
        assertThrows(IllegalStateException.class,
                () -> LogSplitter.split(log("az", 1), cut(Operator.PARALLEL, "a", "b")));
    }

    @Test
    void everySubLogCarriesTheFullFrequency() {
        EventLog log = log("abc", 3, "acb", 2, "bac", 1);
        Cut cut = cut(Operator.PARALLEL, "ac", "b");

        for (EventLog subLog : LogSplitter.split(log, cut)) {
            assertEquals(log.totalFrequency(), subLog.totalFrequency());
        }
    }
}
