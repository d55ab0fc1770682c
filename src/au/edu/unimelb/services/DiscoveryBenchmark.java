package au.edu.unimelb.services;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import au.edu.unimelb.processmining.inductive.miner.MinerParameters;
import au.edu.unimelb.processmining.inductive.miner.ProcessTreeDiscovery;
import au.edu.unimelb.processmining.inductive.tree.ProcessTree;
import au.edu.unimelb.processmining.inductive.tree.ProcessTreeAutomaton;
import au.edu.unimelb.processmining.inductive.tree.ReplayFitnessEvaluator;
import org.apache.log4j.Logger;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static au.edu.unimelb.processmining.inductive.tree.ProcessTree.*;

/**
 * Rediscovery benchmark: plays out a set of reference trees into logs, mines every log with
 * every variant and reports the fitness of the result as CSV.
 * <p>
 * Usage: {@code DiscoveryBenchmark [parameters.properties] [output.csv]}. Without arguments the
 * configured run reads {@code miner.properties} from the classpath and writes to standard out.
 */
public class DiscoveryBenchmark {

    private static final Logger LOGGER = Logger.getLogger(DiscoveryBenchmark.class);

    private static final String HEADER = "tree,variant,activities,traces,fitness,nodes,degraded,millis";
    private static final int MAX_TRACE_LENGTH = 6;
    private static final int RUN_TIMEOUT = 60000;

    public static void main(String[] args) throws Exception {
        MinerParameters configured = args.length > 0 ? load(new FileInputStream(args[0])) : loadDefault();

        List<MinerParameters> runs = new ArrayList<>();
        runs.add(new MinerParameters.Standard());
        runs.add(new MinerParameters.Infrequent());
        runs.add(new MinerParameters.Approximate());
        runs.add(configured);

        PrintStream out = args.length > 1 ? new PrintStream(new FileOutputStream(args[1]), true, "UTF-8") : System.out;
        try {
            new DiscoveryBenchmark().run(referenceTrees(), runs, out);
        } finally {
            if (out != System.out) out.close();
        }
        LOGGER.info("Benchmark completed" + (args.length > 1 ? ", results written to " + args[1] : ""));
    }

    private static MinerParameters load(InputStream in) throws IOException {
        try (InputStream input = in) {
            return MinerParameters.load(input);
        }
    }

    private static MinerParameters loadDefault() throws IOException {
        InputStream in = DiscoveryBenchmark.class.getClassLoader().getResourceAsStream("miner.properties");
        if (in == null) {
            LOGGER.warn("miner.properties not found on the classpath, using the standard parameters");
            return new MinerParameters.Standard();
        }
        return load(in);
    }

    /**
     * Small models covering every operator, one of them nested three levels deep.
     */
    static Map<String, ProcessTree> referenceTrees() {
        Map<String, ProcessTree> trees = new LinkedHashMap<>();
        trees.put("sequence", sequence(activity("a"), activity("b"), activity("c")));
        trees.put("choice", sequence(activity("a"), exclusive(activity("b"), activity("c")), activity("d")));
        trees.put("parallel", sequence(activity("a"), parallel(activity("b"), activity("c")), activity("d")));
        trees.put("loop", loop(sequence(activity("a"), activity("b")), activity("c")));
        trees.put("skip", sequence(activity("a"), exclusive(tau(), activity("b")), activity("c")));
        trees.put("nested", sequence(activity("a"),
                parallel(exclusive(activity("b"), activity("c")), loop(activity("d"), activity("e"))),
                activity("f")));
        return trees;
    }

    /**
     * Mines the playout of every tree with every parameter set and writes one CSV line per run.
     * A run exceeding the time budget is cancelled and reported with fitness -1.
     */
    public void run(Map<String, ProcessTree> trees, List<MinerParameters> runs, PrintStream out)
            throws InterruptedException {
        out.println(HEADER);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            for (Map.Entry<String, ProcessTree> reference : trees.entrySet()) {
                EventLog log = new ProcessTreeAutomaton(reference.getValue()).playout(MAX_TRACE_LENGTH);
                LOGGER.info("Tree " + reference.getKey() + " " + reference.getValue() + " played out into "
                        + log.size() + " traces");

                for (MinerParameters parameters : runs) {
                    out.println(reference.getKey() + "," + evaluate(executor, log, parameters));
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private String evaluate(ExecutorService executor, final EventLog log, final MinerParameters parameters)
            throws InterruptedException {
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final ProcessTreeDiscovery discovery = new ProcessTreeDiscovery(parameters, cancelled::get);
        String variant = parameters.variant.name().toLowerCase(Locale.ROOT);
        String prefix = variant + "," + log.getActivities().size() + "," + log.totalFrequency() + ",";

        long start = System.currentTimeMillis();
        Future<ProcessTree> mined = executor.submit(() -> discovery.discover(log));
        try {
            ProcessTree tree = mined.get(RUN_TIMEOUT, TimeUnit.MILLISECONDS);
            long millis = System.currentTimeMillis() - start;

            ReplayFitnessEvaluator.Result fitness = new ReplayFitnessEvaluator(log, tree).call();
            return prefix + String.format(Locale.ROOT, "%.4f", fitness.fitness()) + "," + tree.size() + ","
                    + tree.isDegraded() + "," + millis;
        } catch (TimeoutException e) {
            LOGGER.warn("[TIMEOUT] " + variant + " exceeded " + RUN_TIMEOUT + " ms");
            cancelled.set(true);
            mined.cancel(true);
            return prefix + "-1,0,false," + RUN_TIMEOUT;
        } catch (ExecutionException e) {
            LOGGER.error("Discovery with " + parameters + " failed", e.getCause());
            return prefix + "-1,0,false," + (System.currentTimeMillis() - start);
        }
    }
}
