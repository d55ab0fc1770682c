package au.edu.unimelb.processmining.inductive.miner;

import au.edu.unimelb.processmining.inductive.cuts.Cut;
import au.edu.unimelb.processmining.inductive.cuts.Cut.Operator;
import au.edu.unimelb.processmining.inductive.dfg.DirectlyFollowsGraph;
import au.edu.unimelb.processmining.inductive.dfg.DirectlyFollowsGraphBuilder;
import au.edu.unimelb.processmining.inductive.log.EventLog;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class CutQualityValidatorTest {

    private static Cut cut(Operator operator, String... partitions) {
        List<Set<String>> parts = new ArrayList<>();
        for (String partition : partitions) parts.add(new TreeSet<>(Arrays.asList(partition.split(""))));
        return new Cut(operator, parts).asFiltered();
    }

    @Test
    void exclusiveLeakage() {
        EventLog log = EventLog.builder().add(9, "a", "b").add(9, "c", "d").add(2, "b", "c").build();
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);
        Cut cut = cut(Operator.EXCLUSIVE, "ab", "cd");

        assertEquals(0.1, CutQualityValidator.leakage(cut, dfg), 1e-9);
        assertTrue(new CutQualityValidator(0.2).accept(cut, log, dfg));
        assertFalse(new CutQualityValidator(0.05).accept(cut, log, dfg));
    }

    @Test
    void sequenceOrderRatio() {
        EventLog log = EventLog.builder().add(3, "a", "b").add(1, "b", "a").build();
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);
        Cut cut = cut(Operator.SEQUENCE, "a", "b");

        assertEquals(0.75, CutQualityValidator.orderRatio(cut, log), 1e-9);
        assertFalse(new CutQualityValidator(0.2).accept(cut, log, dfg));
        assertTrue(new CutQualityValidator(0.3).accept(cut, log, dfg));
    }

    @Test
    void parallelBranchPresence() {
        EventLog log = EventLog.builder().add(3, "a", "b").add(1, "a").build();
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);
        Cut cut = cut(Operator.PARALLEL, "a", "b");

        assertEquals(0.75, CutQualityValidator.minimumPresence(cut, log), 1e-9);
        assertFalse(new CutQualityValidator(0.2).accept(cut, log, dfg));
        assertTrue(new CutQualityValidator(0.25).accept(cut, log, dfg));
    }

    @Test
    void loopRedoShare() {
        EventLog log = EventLog.builder().add(1, "a", "b", "a", "c", "a").build();
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);
        CutQualityValidator strict = new CutQualityValidator(0.0);

        assertEquals(0.6, strict.maximumRedoShare(), 1e-9);
        assertFalse(strict.accept(cut(Operator.LOOP, "a", "b", "c"), log, dfg));
        assertTrue(strict.accept(cut(Operator.LOOP, "ab", "c"), log, dfg));
    }

    @Test
    void loopRedoShareWidensWithTheTolerance() {
        EventLog log = EventLog.builder().add(1, "a", "b", "a", "c", "a", "d", "a").build();
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);
        Cut threeRedos = cut(Operator.LOOP, "a", "b", "c", "d");

        assertEquals(0.75, CutQualityValidator.redoShare(threeRedos), 1e-9);
        assertFalse(new CutQualityValidator(0.1).accept(threeRedos, log, dfg));
        assertTrue(new CutQualityValidator(0.2).accept(threeRedos, log, dfg));
        assertEquals(1.0, new CutQualityValidator(0.9).maximumRedoShare(), 1e-9);
    }

    @Test
    void emptyLogPassesEveryCheck() {
        Cut cut = cut(Operator.SEQUENCE, "a", "b");

        assertEquals(1.0, CutQualityValidator.orderRatio(cut, EventLog.empty()), 1e-9);
        assertEquals(1.0, CutQualityValidator.minimumPresence(cut, EventLog.empty()), 1e-9);
    }

    @Test
    void rejectsToleranceOutsideTheUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new CutQualityValidator(-0.1));
    }
}
