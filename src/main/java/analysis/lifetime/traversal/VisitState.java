package analysis.lifetime.traversal;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Visit counts and counters for one traversal run
 */
public final class VisitState {

    private final Map<VisitKey, Integer> counts = new HashMap<>();
    private final Set<Integer> blocks = new HashSet<>();
    private int attempts;
    private int visits;
    private int skippedMaxVisits;
    private int skippedDuplicatePath;

    /**
     * Number of times the block was visited with the context
     *
     * @param key
     *            (block, context) pair
     * @return number of visits so far
     */
    public int getCount(VisitKey key) {
        Integer c = counts.get(key);
        return c == null ? 0 : c;
    }

    public boolean hasVisited(VisitKey key) {
        return counts.containsKey(key);
    }

    void recordAttempt() {
        attempts++;
    }

    void recordVisit(VisitKey key) {
        counts.put(key, getCount(key) + 1);
        blocks.add(key.getBlock());
        visits++;
    }

    void recordSkippedMaxVisits() {
        skippedMaxVisits++;
    }

    void recordSkippedDuplicatePath() {
        skippedDuplicatePath++;
    }

    /**
     * Snapshot of the counters
     *
     * @return current statistics
     */
    public TraversalStatistics getStatistics() {
        return new TraversalStatistics(attempts, visits, skippedMaxVisits, skippedDuplicatePath, counts.size(),
                                       blocks.size());
    }
}
