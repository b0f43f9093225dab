package analysis.lifetime.traversal;

import analysis.lifetime.ir.FunctionBody;

/**
 * Uses the same bounds for every function
 */
public class FixedTraversalPolicy implements TraversalPolicy {

    private final TraversalConfig config;

    public FixedTraversalPolicy(TraversalConfig config) {
        this.config = config;
    }

    @Override
    public TraversalConfig configFor(FunctionBody body) {
        return config;
    }

    @Override
    public String toString() {
        return "fixed(" + config + ")";
    }
}
