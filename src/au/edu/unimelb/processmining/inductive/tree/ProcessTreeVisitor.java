package au.edu.unimelb.processmining.inductive.tree;

import java.util.List;

/**
 * Bottom-up fold over a process tree: operator callbacks receive the results already computed
 * for their children, in child order.
 */
public interface ProcessTreeVisitor<R> {

    R visitActivity(ProcessTree leaf);

    R visitTau(ProcessTree tau);

    R visitSequence(ProcessTree node, List<R> children);

    R visitExclusive(ProcessTree node, List<R> children);

    R visitParallel(ProcessTree node, List<R> children);

    /**
     * @param children the do-part result first, the redo-part results after it
     */
    R visitLoop(ProcessTree node, List<R> children);
}
