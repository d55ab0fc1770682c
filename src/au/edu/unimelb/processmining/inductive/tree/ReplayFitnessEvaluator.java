package au.edu.unimelb.processmining.inductive.tree;

import au.edu.unimelb.processmining.inductive.log.EventLog;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Replays a log on a process tree. Fitness is the frequency-weighted share of traces the tree
 * can produce exactly; an empty log fits perfectly.
 */
public class ReplayFitnessEvaluator implements Callable<ReplayFitnessEvaluator.Result> {

    private final EventLog log;
    private final ProcessTree tree;

    public ReplayFitnessEvaluator(EventLog log, ProcessTree tree) {
        this.log = log;
        this.tree = tree;
    }

    @Override
    public Result call() {
        long start = System.nanoTime();

        ProcessTreeAutomaton language = new ProcessTreeAutomaton(tree);
        long fitting = 0;
        long total = 0;
        for (Map.Entry<List<String>, Integer> entry : log.getTraces().entrySet()) {
            total += entry.getValue();
            if (language.accepts(entry.getKey())) fitting += entry.getValue();
        }

        return new Result(fitting, total, System.nanoTime() - start);
    }

    public static final class Result {

        public final long fittingTraces;
        public final long totalTraces;
        public final long elapsedNanos;

        Result(long fittingTraces, long totalTraces, long elapsedNanos) {
            this.fittingTraces = fittingTraces;
            this.totalTraces = totalTraces;
            this.elapsedNanos = elapsedNanos;
        }

        public double fitness() {
            return totalTraces == 0 ? 1.0 : fittingTraces / (double) totalTraces;
        }

        public boolean isPerfect() {
            return fittingTraces == totalTraces;
        }

        @Override
        public String toString() {
            return "fitness=" + fitness() + " (" + fittingTraces + "/" + totalTraces + ")";
        }
    }
}
