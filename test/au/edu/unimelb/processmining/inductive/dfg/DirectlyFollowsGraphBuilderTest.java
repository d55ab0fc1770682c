package au.edu.unimelb.processmining.inductive.dfg;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class DirectlyFollowsGraphBuilderTest {

    @Test
    void weighsEdgesByTraceFrequency() {
        EventLog log = EventLog.builder().add(3, "a", "b", "c").add(2, "a", "c").build();

        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);

        assertEquals(3, dfg.getWeight("a", "b"));
        assertEquals(3, dfg.getWeight("b", "c"));
        assertEquals(2, dfg.getWeight("a", "c"));
        assertEquals(0, dfg.getWeight("c", "a"));
        assertFalse(dfg.hasEdge("c", "a"));
        assertEquals(3, dfg.edgeCount());
        assertEquals(8, dfg.totalEdgeWeight());
        assertEquals(3, dfg.maxEdgeWeight());
    }

    @Test
    void recordsStartAndEndActivities() {
        EventLog log = EventLog.builder().add(3, "a", "b").add(2, "b", "c").build();

        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);

        assertEquals(new TreeSet<>(Arrays.asList("a", "b")), dfg.getStartActivities());
        assertEquals(new TreeSet<>(Arrays.asList("b", "c")), dfg.getEndActivities());
        assertEquals(3, dfg.getStartFrequency("a"));
        assertEquals(2, dfg.getEndFrequency("c"));
        assertTrue(dfg.isStart("b"));
        assertFalse(dfg.isEnd("a"));
    }

    @Test
    void emptyTraceIsTrackedSeparately() {
        EventLog log = EventLog.builder().add(4).add(1, "a").build();

        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);

        assertTrue(dfg.containsEmptyTrace());
        assertEquals(4, dfg.getEmptyTraceFrequency());
        assertEquals(1, dfg.getStartFrequency("a"));
        assertEquals(0, dfg.edgeCount());
    }

    @Test
    void emptyLogGivesAnEmptyGraph() {
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(EventLog.empty());

        assertTrue(dfg.getActivities().isEmpty());
        assertEquals(0, dfg.edgeCount());
        assertFalse(dfg.containsEmptyTrace());
    }

    @Test
    void selfLoopsAreEdges() {
        EventLog log = EventLog.builder().add(1, "a", "a", "a").build();

        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);

        assertEquals(2, dfg.getWeight("a", "a"));
        assertEquals(new TreeSet<>(Arrays.asList("a")), dfg.getSuccessors("a"));
        assertEquals(new TreeSet<>(Arrays.asList("a")), dfg.getPredecessors("a"));
    }
}
