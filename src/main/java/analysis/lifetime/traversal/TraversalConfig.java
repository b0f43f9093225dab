package analysis.lifetime.traversal;

/**
 * Bounds for one path-sensitive traversal: the number of predecessor blocks that distinguish two visits of the same
 * block, and the maximum number of times a block may be visited under any one predecessor history
 */
public final class TraversalConfig {

    /**
     * Default number of predecessors kept in a path context
     */
    public static final int DEFAULT_K = 2;
    /**
     * Default visit limit per (block, path context)
     */
    public static final int DEFAULT_MAX_VISITS = 3;
    /**
     * Configuration used when nothing else is requested
     */
    public static final TraversalConfig DEFAULT = new TraversalConfig(DEFAULT_K, DEFAULT_MAX_VISITS);

    private final int k;
    private final int maxVisitsPerBlock;

    /**
     * Create a configuration
     *
     * @param k
     *            number of predecessor blocks kept in a path context, 0 means every block is visited at most once
     * @param maxVisitsPerBlock
     *            maximum number of visits for each (block, path context) pair
     * @throws IllegalArgumentException
     *             if k is negative or maxVisitsPerBlock is less than one
     */
    public TraversalConfig(int k, int maxVisitsPerBlock) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got " + k);
        }
        if (maxVisitsPerBlock < 1) {
            throw new IllegalArgumentException("maxVisitsPerBlock must be at least 1, got " + maxVisitsPerBlock);
        }
        this.k = k;
        this.maxVisitsPerBlock = maxVisitsPerBlock;
    }

    public int getK() {
        return k;
    }

    public int getMaxVisitsPerBlock() {
        return maxVisitsPerBlock;
    }

    @Override
    public int hashCode() {
        return 31 * k + maxVisitsPerBlock;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TraversalConfig)) {
            return false;
        }
        TraversalConfig other = (TraversalConfig) obj;
        return k == other.k && maxVisitsPerBlock == other.maxVisitsPerBlock;
    }

    @Override
    public String toString() {
        return "k=" + k + ", maxVisitsPerBlock=" + maxVisitsPerBlock;
    }
}
