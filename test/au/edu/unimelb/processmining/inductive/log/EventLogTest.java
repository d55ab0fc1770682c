package au.edu.unimelb.processmining.inductive.log;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class EventLogTest {

    @Test
    void mergesDuplicateTraces() {
        EventLog log = EventLog.builder()
                .add(2, "a", "b")
                .add(3, "a", "b")
                .add(1, "b")
                .build();

        assertEquals(2, log.size());
        assertEquals(5, log.getFrequency(Arrays.asList("a", "b")));
        assertEquals(6, log.totalFrequency());
        assertEquals(new TreeSet<>(Arrays.asList("a", "b")), log.getActivities());
    }

    @Test
    void keepsInsertionOrder() {
        EventLog log = EventLog.builder().add(1, "c").add(1, "a").add(1, "b").build();

        List<List<String>> order = new ArrayList<>(log.distinctTraces());
        assertEquals(Arrays.asList(Collections.singletonList("c"), Collections.singletonList("a"),
                Collections.singletonList("b")), order);
    }

    @Test
    void rejectsInvalidTraces() {
        assertThrows(IllegalArgumentException.class, () -> EventLog.builder().add(0, "a"));
        assertThrows(IllegalArgumentException.class, () -> EventLog.builder().add(-1, "a"));
        assertThrows(IllegalArgumentException.class, () -> EventLog.builder().add(1, "a", ""));
        assertThrows(IllegalArgumentException.class, () -> EventLog.builder().add(1, "a", null));
        assertThrows(IllegalArgumentException.class, () -> EventLog.builder().add(null, 1));
    }

    @Test
    void emptyTraceIsLegal() {
        EventLog log = EventLog.builder().add(4).add(1, "a").build();

        assertTrue(log.containsEmptyTrace());
        assertEquals(4, log.emptyTraceFrequency());

        EventLog withoutEmpty = log.withoutEmptyTrace();
        assertFalse(withoutEmpty.containsEmptyTrace());
        assertEquals(1, withoutEmpty.totalFrequency());
        assertSame(withoutEmpty, withoutEmpty.withoutEmptyTrace());
    }

    @Test
    void countsActivityOccurrences() {
        EventLog log = EventLog.builder().add(3, "a", "b", "a").add(2, "b").build();

        assertEquals(6, log.occurrences("a"));
        assertEquals(5, log.occurrences("b"));
        assertEquals(0, log.occurrences("z"));
        assertEquals(6, log.activityFrequencies().get("a"));
    }

    @Test
    void emptyBuilderGivesTheEmptyLog() {
        EventLog log = EventLog.builder().build();

        assertTrue(log.isEmpty());
        assertSame(EventLog.empty(), log);
        assertTrue(log.getActivities().isEmpty());
    }

    @Test
    void equalityIgnoresInsertionOrder() {
        EventLog first = EventLog.builder().add(1, "a").add(2, "b").build();
        EventLog second = EventLog.builder().add(2, "b").add(1, "a").build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void builderCannotBeReused() {
        EventLog.Builder builder = EventLog.builder().add(1, "a");
        builder.build();

        assertThrows(IllegalStateException.class, () -> builder.add(1, "b"));
    }
}
