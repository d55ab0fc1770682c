package au.edu.unimelb.processmining.inductive.miner;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import au.edu.unimelb.processmining.inductive.log.LogFilters;
import au.edu.unimelb.processmining.inductive.tree.ProcessTree;
import org.apache.log4j.Logger;

/**
 * Entry point of a discovery run: filters the log by the activity and trace thresholds, then
 * mines it with the configured variant.
 */
public class ProcessTreeDiscovery {

    private static final Logger LOGGER = Logger.getLogger(ProcessTreeDiscovery.class);

    private final MinerParameters parameters;
    private final Canceller canceller;

    public ProcessTreeDiscovery(MinerParameters parameters) {
        this(parameters, Canceller.NEVER);
    }

    public ProcessTreeDiscovery(MinerParameters parameters, Canceller canceller) {
        if (parameters == null) throw new IllegalArgumentException("No parameters given");
        this.parameters = parameters;
        this.canceller = canceller == null ? Canceller.NEVER : canceller;
    }

    public static ProcessTree discover(EventLog log, MinerParameters parameters) {
        return new ProcessTreeDiscovery(parameters).discover(log);
    }

    public ProcessTree discover(EventLog log) {
        long start = System.currentTimeMillis();
        LOGGER.info("Discovery started: " + parameters + ", " + log.getActivities().size() + " activities, "
                + log.size() + " distinct traces");

        EventLog filtered = LogFilters.filter(log, parameters.activityThreshold, parameters.tracesThreshold);
        ProcessTree tree = new InductiveMiner(parameters, canceller).mine(filtered);

        LOGGER.info("Discovery finished in " + (System.currentTimeMillis() - start) + " ms: " + tree.size()
                + " nodes" + (tree.isDegraded() ? ", degraded" : ""));
        if (LOGGER.isDebugEnabled()) LOGGER.debug("Discovered " + tree);
        return tree;
    }
}
