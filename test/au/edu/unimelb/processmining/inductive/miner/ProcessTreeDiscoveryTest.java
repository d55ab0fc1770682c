package au.edu.unimelb.processmining.inductive.miner;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import au.edu.unimelb.processmining.inductive.tree.ProcessTree;
import org.junit.jupiter.api.Test;

import static au.edu.unimelb.processmining.inductive.tree.ProcessTree.*;
import static org.junit.jupiter.api.Assertions.*;

class ProcessTreeDiscoveryTest {

    private static EventLog log() {
        return EventLog.builder().add(10, "a", "b").add(1, "a", "x", "b").build();
    }

    @Test
    void withoutFilteringEveryActivityIsModelled() {
        ProcessTree tree = ProcessTreeDiscovery.discover(log(), new MinerParameters.Standard());

        assertEquals(sequence(activity("a"), exclusive(tau(), activity("x")), activity("b")), tree);
    }

    @Test
    void infrequentActivitiesAreFilteredFirst() {
        ProcessTree tree = ProcessTreeDiscovery.discover(log(), new MinerParameters.Standard(0.5, 0.0));

        assertEquals(sequence(activity("a"), activity("b")), tree);
    }

    @Test
    void infrequentTracesAreFilteredFirst() {
        ProcessTree tree = ProcessTreeDiscovery.discover(log(), new MinerParameters.Standard(0.0, 0.5));

        assertEquals(sequence(activity("a"), activity("b")), tree);
    }

    @Test
    void cancellationReachesTheMiner() {
        ProcessTreeDiscovery discovery = new ProcessTreeDiscovery(new MinerParameters.Infrequent(), () -> true);

        assertThrows(MinerCancelledException.class, () -> discovery.discover(log()));
    }

    @Test
    void missingParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessTreeDiscovery(null));
    }
}
