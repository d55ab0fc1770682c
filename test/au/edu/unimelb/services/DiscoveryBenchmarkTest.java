package au.edu.unimelb.services;

import au.edu.unimelb.processmining.inductive.miner.MinerParameters;
import au.edu.unimelb.processmining.inductive.tree.ProcessTree;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryBenchmarkTest {

    @Test
    void rediscoversEveryReferenceTreeWithPerfectFitness() throws Exception {
        Map<String, ProcessTree> trees = DiscoveryBenchmark.referenceTrees();
        List<MinerParameters> runs = Arrays.<MinerParameters>asList(new MinerParameters.Standard(),
                new MinerParameters.Approximate(0.0));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buffer, true, "UTF-8")) {
            new DiscoveryBenchmark().run(trees, runs, out);
        }

        String[] lines = buffer.toString(StandardCharsets.UTF_8.name()).trim().split("\\R");
        assertEquals("tree,variant,activities,traces,fitness,nodes,degraded,millis", lines[0]);
        assertEquals(1 + trees.size() * runs.size(), lines.length);
        for (int i = 1; i < lines.length; i++) {
            String[] columns = lines[i].split(",");
            assertEquals("1.0000", columns[4], lines[i]);
            assertEquals("false", columns[6], lines[i]);
        }
    }
}
