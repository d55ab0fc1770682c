package au.edu.unimelb.processmining.inductive.miner;

/**
 * Thrown when a discovery run is cancelled by its caller or exceeds its time budget.
 */
public class MinerCancelledException extends RuntimeException {

    public MinerCancelledException(String message) {
        super(message);
    }
}
