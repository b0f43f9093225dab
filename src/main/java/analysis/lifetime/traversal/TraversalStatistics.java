package analysis.lifetime.traversal;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.lifetime.serialization.JSONSerializable;
import analysis.lifetime.serialization.JSONUtil;

/**
 * Counters describing one traversal run
 */
public final class TraversalStatistics implements JSONSerializable {

    /**
     * Statistics of a run that never started
     */
    public static final TraversalStatistics NONE = new TraversalStatistics(0, 0, 0, 0, 0, 0);

    private final int attempts;
    private final int visits;
    private final int skippedMaxVisits;
    private final int skippedDuplicatePath;
    private final int distinctKeys;
    private final int distinctBlocks;

    /**
     * Create a snapshot of traversal counters
     *
     * @param attempts
     *            frames taken off the work stack
     * @param visits
     *            frames whose block was processed
     * @param skippedMaxVisits
     *            frames dropped because their (block, context) reached the visit limit
     * @param skippedDuplicatePath
     *            frames dropped because k is 0 and the block was already visited
     * @param distinctKeys
     *            number of distinct (block, context) pairs visited
     * @param distinctBlocks
     *            number of distinct blocks visited
     */
    public TraversalStatistics(int attempts, int visits, int skippedMaxVisits, int skippedDuplicatePath,
                               int distinctKeys, int distinctBlocks) {
        this.attempts = attempts;
        this.visits = visits;
        this.skippedMaxVisits = skippedMaxVisits;
        this.skippedDuplicatePath = skippedDuplicatePath;
        this.distinctKeys = distinctKeys;
        this.distinctBlocks = distinctBlocks;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getVisits() {
        return visits;
    }

    public int getSkippedMaxVisits() {
        return skippedMaxVisits;
    }

    public int getSkippedDuplicatePath() {
        return skippedDuplicatePath;
    }

    public int getDistinctKeys() {
        return distinctKeys;
    }

    public int getDistinctBlocks() {
        return distinctBlocks;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "attempts", attempts);
        JSONUtil.addJSON(json, "visits", visits);
        JSONUtil.addJSON(json, "skippedMaxVisits", skippedMaxVisits);
        JSONUtil.addJSON(json, "skippedDuplicatePath", skippedDuplicatePath);
        JSONUtil.addJSON(json, "distinctKeys", distinctKeys);
        JSONUtil.addJSON(json, "distinctBlocks", distinctBlocks);
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + attempts;
        result = prime * result + visits;
        result = prime * result + skippedMaxVisits;
        result = prime * result + skippedDuplicatePath;
        result = prime * result + distinctKeys;
        result = prime * result + distinctBlocks;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TraversalStatistics)) {
            return false;
        }
        TraversalStatistics other = (TraversalStatistics) obj;
        return attempts == other.attempts && visits == other.visits && skippedMaxVisits == other.skippedMaxVisits
                && skippedDuplicatePath == other.skippedDuplicatePath && distinctKeys == other.distinctKeys
                && distinctBlocks == other.distinctBlocks;
    }

    @Override
    public String toString() {
        return "attempts=" + attempts + ", visits=" + visits + ", skippedMaxVisits=" + skippedMaxVisits
                + ", skippedDuplicatePath=" + skippedDuplicatePath + ", distinctKeys=" + distinctKeys
                + ", distinctBlocks=" + distinctBlocks;
    }
}
