package analysis.lifetime;

import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.lifetime.serialization.JSONSerializable;
import analysis.lifetime.serialization.JSONUtil;
import analysis.lifetime.traversal.TraversalConfig;
import analysis.lifetime.traversal.TraversalStatistics;

/**
 * Results of the lifetime analysis of one function
 */
public final class LifetimeResults implements JSONSerializable {

    private final String functionName;
    /**
     * Bounds the traversal ran with, null if the function failed before the traversal started
     */
    private final TraversalConfig config;
    /**
     * Every finding, one per visit that detected it, in detection order
     */
    private final List<Finding> findings;
    private final TraversalStatistics statistics;
    private final int numberOfBlocks;
    private final int reachableBlocks;
    /**
     * Reason the function could not be analyzed, null on success
     */
    private final String failure;

    /**
     * Results of a completed analysis
     *
     * @param functionName
     *            function analyzed
     * @param config
     *            traversal bounds used
     * @param findings
     *            findings in detection order
     * @param statistics
     *            traversal counters
     * @param numberOfBlocks
     *            number of blocks in the function
     * @param reachableBlocks
     *            number of blocks reachable from the entry
     */
    public LifetimeResults(String functionName, TraversalConfig config, List<Finding> findings,
                           TraversalStatistics statistics, int numberOfBlocks, int reachableBlocks) {
        this(functionName, config, findings, statistics, numberOfBlocks, reachableBlocks, null);
    }

    private LifetimeResults(String functionName, TraversalConfig config, List<Finding> findings,
                            TraversalStatistics statistics, int numberOfBlocks, int reachableBlocks, String failure) {
        this.functionName = functionName;
        this.config = config;
        this.findings = Collections.unmodifiableList(new ArrayList<>(findings));
        this.statistics = statistics;
        this.numberOfBlocks = numberOfBlocks;
        this.reachableBlocks = reachableBlocks;
        this.failure = failure;
    }

    /**
     * Results for a function that could not be analyzed
     *
     * @param functionName
     *            function name
     * @param failure
     *            description of the problem
     * @return results with no findings
     */
    public static LifetimeResults failed(String functionName, String failure) {
        return new LifetimeResults(functionName, null, Collections.<Finding> emptyList(), TraversalStatistics.NONE,
                                   0, 0, failure);
    }

    public String getFunctionName() {
        return functionName;
    }

    public TraversalConfig getConfig() {
        return config;
    }

    public List<Finding> getFindings() {
        return findings;
    }

    /**
     * Findings of the given kind, in detection order
     *
     * @param kind
     *            kind of finding
     * @return matching findings
     */
    public List<Finding> getFindings(FindingKind kind) {
        List<Finding> l = new ArrayList<>();
        for (Finding f : findings) {
            if (f.getKind() == kind) {
                l.add(f);
            }
        }
        return l;
    }

    /**
     * One finding per violation site (kind, place and location), the first one detected. Several visits of the same
     * block under different path contexts can detect the same violation.
     *
     * @return distinct findings in detection order
     */
    public List<Finding> getDistinctFindings() {
        Map<String, Finding> distinct = new LinkedHashMap<>();
        for (Finding f : findings) {
            if (!distinct.containsKey(f.getSiteKey())) {
                distinct.put(f.getSiteKey(), f);
            }
        }
        return new ArrayList<>(distinct.values());
    }

    /**
     * Ids of blocks containing at least one finding
     *
     * @return block ids
     */
    public Set<Integer> getBlocksWithFindings() {
        Set<Integer> s = new LinkedHashSet<>();
        for (Finding f : findings) {
            s.add(f.getBlock());
        }
        return s;
    }

    public TraversalStatistics getStatistics() {
        return statistics;
    }

    public int getNumberOfBlocks() {
        return numberOfBlocks;
    }

    public int getReachableBlocks() {
        return reachableBlocks;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public String getFailure() {
        return failure;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "function", functionName);
        if (failure != null) {
            JSONUtil.addJSON(json, "failure", failure);
            return json;
        }
        JSONObject conf = new JSONObject();
        JSONUtil.addJSON(conf, "k", config.getK());
        JSONUtil.addJSON(conf, "maxVisitsPerBlock", config.getMaxVisitsPerBlock());
        JSONArray all = new JSONArray();
        for (Finding f : getDistinctFindings()) {
            all.put(f.toJSON());
        }
        try {
            json.put("config", conf);
            json.put("findings", all);
        } catch (JSONException e) {
            System.err.println("Serialization error for " + functionName + ", message: " + e.getMessage());
        }
        JSONUtil.addJSON(json, "witnesses", findings.size());
        JSONUtil.addJSON(json, "statistics", statistics);
        JSONUtil.addJSON(json, "blocks", numberOfBlocks);
        JSONUtil.addJSON(json, "reachableBlocks", reachableBlocks);
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public String toString() {
        if (failure != null) {
            return functionName + ": FAILED " + failure;
        }
        return functionName + ": " + getDistinctFindings().size() + " distinct findings (" + findings.size()
                + " witnesses), " + statistics;
    }
}
