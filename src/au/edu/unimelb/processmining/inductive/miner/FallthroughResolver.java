package au.edu.unimelb.processmining.inductive.miner;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import au.edu.unimelb.processmining.inductive.tree.ProcessTree;
import gnu.trove.map.TObjectIntMap;
import org.apache.log4j.Logger;

import java.util.*;
import java.util.function.Function;

/**
 * Builds a model for a log no cut could be found for. In order of precedence:
 * <ol>
 * <li>the log holds the empty trace: {@code X(tau, mine(log without the empty trace))}</li>
 * <li>the log has one activity only: {@code *('a', tau)}</li>
 * <li>otherwise the flower model {@code *(tau, 'a', 'b', ...)}</li>
 * </ol>
 * With a flower cap in force, a flower over more activities than the cap keeps the most
 * frequent ones and records the others as omitted.
 */
public class FallthroughResolver {

    private static final Logger LOGGER = Logger.getLogger(FallthroughResolver.class);

    private final int flowerCap;

    /**
     * @param flowerCap most activities a flower may hold, {@link Integer#MAX_VALUE} for no cap
     */
    public FallthroughResolver(int flowerCap) {
        if (flowerCap < 1) throw new IllegalArgumentException("The flower cap must be positive, was " + flowerCap);
        this.flowerCap = flowerCap;
    }

    public static FallthroughResolver forParameters(MinerParameters parameters) {
        if (parameters.variant == MinerParameters.Variant.APPROXIMATE) {
            return new FallthroughResolver(parameters.flowerCap);
        }
        return new FallthroughResolver(Integer.MAX_VALUE);
    }

    /**
     * @param log    a non-empty log
     * @param miner  discovery of a smaller log, used for the log without its empty trace
     */
    public ProcessTree resolve(EventLog log, Function<EventLog, ProcessTree> miner) {
        if (log.isEmpty()) throw new IllegalArgumentException("No fallthrough for the empty log");

        if (log.containsEmptyTrace()) {
            if (LOGGER.isDebugEnabled()) LOGGER.debug("Fallthrough: empty trace, " + log.emptyTraceFrequency() + "x");
            return ProcessTree.exclusive(ProcessTree.tau(), miner.apply(log.withoutEmptyTrace()));
        }

        SortedSet<String> activities = log.getActivities();
        if (activities.size() == 1) {
            String activity = activities.first();
            if (LOGGER.isDebugEnabled()) LOGGER.debug("Fallthrough: repeated activity " + activity);
            return ProcessTree.loop(ProcessTree.activity(activity), ProcessTree.tau());
        }

        if (activities.size() <= flowerCap) {
            if (LOGGER.isDebugEnabled()) LOGGER.debug("Fallthrough: flower over " + activities);
            return ProcessTree.flower(activities, Collections.<String>emptySet());
        }
        return cappedFlower(log);
    }

    private ProcessTree cappedFlower(EventLog log) {
        final TObjectIntMap<String> frequencies = log.activityFrequencies();
        List<String> ranked = new ArrayList<>(log.getActivities());
        ranked.sort((a, b) -> {
            int byFrequency = Integer.compare(frequencies.get(b), frequencies.get(a));
            return byFrequency != 0 ? byFrequency : a.compareTo(b);
        });

        SortedSet<String> kept = new TreeSet<>(ranked.subList(0, flowerCap));
        SortedSet<String> omitted = new TreeSet<>(ranked.subList(flowerCap, ranked.size()));
        LOGGER.warn("Flower model capped at " + flowerCap + " activities, omitted " + omitted);
        return ProcessTree.flower(kept, omitted);
    }
}
