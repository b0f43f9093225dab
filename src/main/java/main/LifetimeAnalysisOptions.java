package main;

import java.util.ArrayList;
import java.util.List;

import analysis.lifetime.CalleeClassifier;
import analysis.lifetime.traversal.BlockCountTraversalPolicy;
import analysis.lifetime.traversal.FixedTraversalPolicy;
import analysis.lifetime.traversal.TraversalConfig;
import analysis.lifetime.traversal.TraversalPolicy;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options for {@link LifetimeAnalysisMain}
 */
public final class LifetimeAnalysisOptions {

    /**
     * Input file holding the serialized function bodies
     */
    @Parameter(names = { "-in", "-i" }, description = "JSON file containing the function bodies to analyze")
    private String inputFile;

    /**
     * Output folder default is "tests"
     */
    @Parameter(names = { "-out" }, description = "Output directory, default is the tests directory.")
    private String outputDir = "tests";

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Number of predecessor blocks that distinguish visits of the same block
     */
    @Parameter(names = { "-k" }, validateWith = LifetimeAnalysisOptions.NonNegativeValidator.class, description = "Number of predecessor blocks kept in the path context of a visit (0 visits every block once)")
    private Integer k = TraversalConfig.DEFAULT_K;

    /**
     * Maximum number of visits for each (block, path context)
     */
    @Parameter(names = { "-maxVisits" }, validateWith = LifetimeAnalysisOptions.PositiveValidator.class, description = "Maximum number of visits of a block under the same path context")
    private Integer maxVisits = TraversalConfig.DEFAULT_MAX_VISITS;

    /**
     * How traversal bounds are chosen per function
     */
    @Parameter(names = { "-policy" }, validateWith = LifetimeAnalysisOptions.PolicyValidator.class, description = "How traversal bounds are chosen for each function, see below")
    private String policy = "fixed";

    /**
     * Number of threads used to analyze functions
     */
    @Parameter(names = { "-numThreads" }, validateWith = LifetimeAnalysisOptions.PositiveValidator.class, description = "Number of threads to use, functions are analyzed in parallel")
    private Integer numThreads = 1;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * Flag for writing a graphviz "dot" file for each function as well as the JSON report
     */
    @Parameter(names = { "-writeDot" }, description = "If set, write a graphviz .dot file of the CFG of each function, with the blocks containing findings highlighted")
    private boolean writeDot = false;

    /**
     * Additional callee names treated as releasing their first argument
     */
    @Parameter(names = { "-releaseCallee" }, description = "Callee name (matched as a substring) that releases its first argument, may be repeated")
    private List<String> releaseCallees = new ArrayList<>();

    /**
     * Hide the constructor
     */
    private LifetimeAnalysisOptions() {
        // Intentionally blank
    }

    /**
     * Validate that a parameter is a non-negative integer
     */
    public static class NonNegativeValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            int n = parseInt(name, value);
            if (n < 0) {
                throw new ParameterException("Parameter " + name + " should be non-negative (found " + value + ")");
            }
        }
    }

    /**
     * Validate that a parameter is a positive integer
     */
    public static class PositiveValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            int n = parseInt(name, value);
            if (n < 1) {
                throw new ParameterException("Parameter " + name + " should be positive (found " + value + ")");
            }
        }
    }

    /**
     * Validate the requested traversal policy
     */
    public static class PolicyValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (value.equals("fixed")) {
                return;
            }
            if (value.equals("blocks")) {
                return;
            }
            System.err.println("Invalid traversal policy: " + value);
            System.err.println(policyUsage());
            throw new ParameterException("Invalid traversal policy: " + value);
        }
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParameterException("Parameter " + name + " should be an integer (found " + value + ")");
        }
    }

    /**
     * Parse the command line options
     *
     * @param args
     *            command line arguments
     * @return parsed options
     * @throws ParameterException
     *             if an option is unknown or invalid
     */
    public static LifetimeAnalysisOptions getOptions(String[] args) {
        LifetimeAnalysisOptions o = new LifetimeAnalysisOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public boolean shouldPrintUseage() {
        return help;
    }

    public String getInputFile() {
        return inputFile;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public boolean shouldWriteDot() {
        return writeDot;
    }

    public List<String> getReleaseCallees() {
        return releaseCallees;
    }

    /**
     * Traversal bounds requested on the command line
     *
     * @return configuration built from -k and -maxVisits
     */
    public TraversalConfig getTraversalConfig() {
        return new TraversalConfig(k, maxVisits);
    }

    /**
     * Policy choosing the traversal bounds for each function
     *
     * @return policy selected with -policy
     */
    public TraversalPolicy getTraversalPolicy() {
        if (policy.equals("blocks")) {
            return new BlockCountTraversalPolicy(getTraversalConfig());
        }
        return new FixedTraversalPolicy(getTraversalConfig());
    }

    /**
     * Classifier for callees, including any extra release callees
     *
     * @return callee classifier
     */
    public CalleeClassifier getCalleeClassifier() {
        return new CalleeClassifier(releaseCallees);
    }

    /**
     * Get the usage information for the command line options
     *
     * @return String containing the documentation
     */
    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        LifetimeAnalysisOptions o = new LifetimeAnalysisOptions();
        JCommander jc = new JCommander(o);
        jc.usage(sb);
        return sb.toString() + "\n" + policyUsage();
    }

    /**
     * Print the documentation for the traversal policies
     *
     * @return String containing the documentation
     */
    static String policyUsage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Supported traversal policies:\n");
        sb.append("\tfixed - use -k and -maxVisits for every function\n");
        sb.append("\tblocks - start from -k and -maxVisits, use k of at most "
                + BlockCountTraversalPolicy.DEFAULT_LARGE_BODY_K + " for functions with more than "
                + BlockCountTraversalPolicy.DEFAULT_LARGE_BODY_THRESHOLD + " blocks and at least "
                + BlockCountTraversalPolicy.DEFAULT_LOOP_MAX_VISITS + " visits per block for functions with loops\n");
        sb.append("A \"traversal\" entry in the input overrides the policy for that function.\n");
        return sb.toString();
    }
}
