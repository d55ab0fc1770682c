package au.edu.unimelb.processmining.inductive.miner;

import au.edu.unimelb.processmining.inductive.cuts.Cut;
import au.edu.unimelb.processmining.inductive.cuts.CutDetector;
import au.edu.unimelb.processmining.inductive.dfg.DirectlyFollowsGraph;
import au.edu.unimelb.processmining.inductive.dfg.DirectlyFollowsGraphBuilder;
import au.edu.unimelb.processmining.inductive.dfg.NoiseFilter;
import au.edu.unimelb.processmining.inductive.log.EventLog;
import au.edu.unimelb.processmining.inductive.split.LogSplitter;
import au.edu.unimelb.processmining.inductive.tree.ProcessTree;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive discovery of a process tree. Every level checks the base cases, looks for a cut of
 * the log's directly-follows graph, splits the log along it and mines each sub-log; when no cut
 * is accepted the {@link FallthroughResolver} builds the node instead.
 * <p>
 * The variants only differ in how a cut is searched for:
 * <ul>
 * <li>standard: the unfiltered graph only</li>
 * <li>infrequent: the unfiltered graph, then the graph without infrequent edges</li>
 * <li>approximate: the unfiltered graph, then progressively simplified graphs, every cut
 * having to pass the {@link CutQualityValidator}</li>
 * </ul>
 * Each successful cut strictly shrinks the activities of every sub-log, so the recursion is at
 * most as deep as the log has activities. Sub-logs are mined left to right.
 * <p>
 * A miner holds no state between runs and may be shared between threads.
 */
public class InductiveMiner {

    private static final Logger LOGGER = Logger.getLogger(InductiveMiner.class);

    private final MinerParameters parameters;
    private final Canceller canceller;
    private final CutQualityValidator validator;
    private final FallthroughResolver fallthrough;

    public InductiveMiner(MinerParameters parameters) {
        this(parameters, Canceller.NEVER);
    }

    public InductiveMiner(MinerParameters parameters, Canceller canceller) {
        this.parameters = parameters;
        this.canceller = canceller;
        this.validator = new CutQualityValidator(parameters.cutQualityTolerance);
        this.fallthrough = FallthroughResolver.forParameters(parameters);
    }

    public MinerParameters getParameters() {
        return parameters;
    }

    /**
     * @throws MinerCancelledException if the canceller fires or the timeout elapses
     */
    public ProcessTree mine(EventLog log) {
        long deadline = parameters.hasTimeout()
                ? System.currentTimeMillis() + parameters.timeoutMilliseconds
                : Long.MAX_VALUE;
        return new Run(deadline).mine(log);
    }

    /**
     * Looks for a cut of the log the way the configured variant does.
     *
     * @return the accepted cut, null if the log has to fall through
     */
    Cut findCut(EventLog log) {
        DirectlyFollowsGraph dfg = DirectlyFollowsGraphBuilder.build(log);
        Cut cut = CutDetector.findCut(dfg);

        switch (parameters.variant) {
            case INFREQUENT:
                if (cut == null && parameters.noiseThreshold > 0.0) {
                    DirectlyFollowsGraph filtered = NoiseFilter.filterInfrequentEdges(dfg, parameters.noiseThreshold);
                    if (filtered != dfg) {
                        cut = CutDetector.findCut(filtered);
                        if (cut != null) {
                            cut = cut.asFiltered();
                            if (LOGGER.isDebugEnabled()) {
                                LOGGER.debug("Cut found after filtering at " + parameters.noiseThreshold + ": " + cut);
                            }
                        }
                    }
                }
                return cut;
            case APPROXIMATE:
                if (cut != null && validator.accept(cut, log, dfg)) return cut;
                return findSimplifiedCut(log, dfg);
            default:
                return cut;
        }
    }

    private Cut findSimplifiedCut(EventLog log, DirectlyFollowsGraph dfg) {
        if (parameters.simplificationThreshold == 0.0) return null;

        for (int round = 1; round <= parameters.maxSimplificationRounds; round++) {
            double threshold = Math.min(1.0, parameters.simplificationThreshold * round);
            if (LOGGER.isDebugEnabled()) LOGGER.debug("Simplification round " + round + " at " + threshold);

            Cut cut = CutDetector.findCut(NoiseFilter.simplify(dfg, threshold));
            if (cut != null) {
                cut = cut.asFiltered();
                if (validator.accept(cut, log, dfg)) return cut;
            }
            if (threshold == 1.0) break;
        }
        return null;
    }

    private final class Run {

        private final long deadline;

        Run(long deadline) {
            this.deadline = deadline;
        }

        ProcessTree mine(EventLog log) {
            checkCancelled();

            if (log.isEmpty() || (log.size() == 1 && log.containsEmptyTrace())) {
                if (LOGGER.isDebugEnabled()) LOGGER.debug("Base case: tau");
                return ProcessTree.tau();
            }
            if (log.size() == 1) {
                List<String> trace = log.distinctTraces().iterator().next();
                if (trace.size() == 1) {
                    if (LOGGER.isDebugEnabled()) LOGGER.debug("Base case: " + trace.get(0));
                    return ProcessTree.activity(trace.get(0));
                }
            }

            Cut cut = findCut(log);
            if (cut == null) return fallthrough.resolve(log, this::mine);

            List<EventLog> subLogs = LogSplitter.split(log, cut);
            List<ProcessTree> children = new ArrayList<>(subLogs.size());
            for (EventLog subLog : subLogs) children.add(mine(subLog));
            return ProcessTree.fromCut(cut.getOperator(), children);
        }

        private void checkCancelled() {
            if (canceller.isCancelled()) throw new MinerCancelledException("Discovery cancelled");
            if (System.currentTimeMillis() > deadline) {
                throw new MinerCancelledException("Discovery exceeded " + parameters.timeoutMilliseconds + " ms");
            }
        }
    }
}
