package analysis.lifetime.traversal;

import analysis.lifetime.ir.FunctionBody;

/**
 * Adjusts a base configuration to the shape of each function. Functions with more than
 * <code>largeBodyThreshold</code> blocks get a history length of at most <code>largeBodyK</code>, which limits the
 * number of distinct contexts. Functions with a loop get at least <code>loopMaxVisits</code> visits per block so
 * that state produced by a later iteration still reaches the blocks of the loop.
 */
public class BlockCountTraversalPolicy implements TraversalPolicy {

    public static final int DEFAULT_LARGE_BODY_THRESHOLD = 100;
    public static final int DEFAULT_LARGE_BODY_K = 1;
    public static final int DEFAULT_LOOP_MAX_VISITS = 4;

    private final TraversalConfig base;
    private final int largeBodyThreshold;
    private final int largeBodyK;
    private final int loopMaxVisits;

    /**
     * Create a policy
     *
     * @param base
     *            configuration for small loop-free functions
     * @param largeBodyThreshold
     *            number of blocks above which a function is considered large
     * @param largeBodyK
     *            maximum history length for large functions
     * @param loopMaxVisits
     *            minimum visit limit for functions with a loop
     */
    public BlockCountTraversalPolicy(TraversalConfig base, int largeBodyThreshold, int largeBodyK, int loopMaxVisits) {
        if (largeBodyThreshold < 0 || largeBodyK < 0 || loopMaxVisits < 1) {
            throw new IllegalArgumentException("Invalid block count policy: threshold=" + largeBodyThreshold
                    + ", k=" + largeBodyK + ", loopMaxVisits=" + loopMaxVisits);
        }
        this.base = base;
        this.largeBodyThreshold = largeBodyThreshold;
        this.largeBodyK = largeBodyK;
        this.loopMaxVisits = loopMaxVisits;
    }

    public BlockCountTraversalPolicy(TraversalConfig base) {
        this(base, DEFAULT_LARGE_BODY_THRESHOLD, DEFAULT_LARGE_BODY_K, DEFAULT_LOOP_MAX_VISITS);
    }

    @Override
    public TraversalConfig configFor(FunctionBody body) {
        int k = base.getK();
        if (body.getNumberOfBlocks() > largeBodyThreshold) {
            k = Math.min(k, largeBodyK);
        }
        int maxVisits = base.getMaxVisitsPerBlock();
        if (body.hasLoop()) {
            maxVisits = Math.max(maxVisits, loopMaxVisits);
        }
        if (k == base.getK() && maxVisits == base.getMaxVisitsPerBlock()) {
            return base;
        }
        return new TraversalConfig(k, maxVisits);
    }

    @Override
    public String toString() {
        return "blocks(" + base + ", threshold=" + largeBodyThreshold + ", largeBodyK=" + largeBodyK
                + ", loopMaxVisits=" + loopMaxVisits + ")";
    }
}
