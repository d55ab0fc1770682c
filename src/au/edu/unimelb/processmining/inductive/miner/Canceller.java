package au.edu.unimelb.processmining.inductive.miner;

/**
 * Lets a caller stop a discovery run. Checked between recursive dispatches only.
 */
public interface Canceller {

    Canceller NEVER = new Canceller() {

        public boolean isCancelled() {
            return false;
        }

    };

    boolean isCancelled();

}
