package au.edu.unimelb.processmining.inductive.tree;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import org.junit.jupiter.api.Test;

import static au.edu.unimelb.processmining.inductive.tree.ProcessTree.*;
import static org.junit.jupiter.api.Assertions.*;

class ReplayFitnessEvaluatorTest {

    @Test
    void fitnessIsWeightedByFrequency() {
        EventLog log = EventLog.builder().add(3, "a", "b").add(1, "b", "a").build();

        ReplayFitnessEvaluator.Result result =
                new ReplayFitnessEvaluator(log, sequence(activity("a"), activity("b"))).call();

        assertEquals(3, result.fittingTraces);
        assertEquals(4, result.totalTraces);
        assertEquals(0.75, result.fitness(), 1e-9);
        assertFalse(result.isPerfect());
    }

    @Test
    void flowerFitsEverything() {
        EventLog log = EventLog.builder().add(3, "a", "b").add(1, "b", "a").add(2).build();

        ReplayFitnessEvaluator.Result result =
                new ReplayFitnessEvaluator(log, loop(tau(), activity("a"), activity("b"))).call();

        assertTrue(result.isPerfect());
        assertEquals(1.0, result.fitness(), 1e-9);
    }

    @Test
    void emptyLogFitsPerfectly() {
        ReplayFitnessEvaluator.Result result = new ReplayFitnessEvaluator(EventLog.empty(), tau()).call();

        assertEquals(1.0, result.fitness(), 1e-9);
        assertTrue(result.isPerfect());
    }
}
