package analysis.lifetime.traversal;

import analysis.lifetime.ir.FunctionBody;

/**
 * Chooses the traversal bounds for a function
 */
public interface TraversalPolicy {

    /**
     * Traversal bounds to use for the given function
     *
     * @param body
     *            function about to be analyzed
     * @return history length and visit limit
     */
    TraversalConfig configFor(FunctionBody body);
}
