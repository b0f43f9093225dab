package analysis.lifetime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import analysis.lifetime.binding.BindingManager;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.MalformedBodyException;
import analysis.lifetime.place.PlaceIdEncoder;
import analysis.lifetime.traversal.PathSensitiveTraversal;
import analysis.lifetime.traversal.TraversalConfig;
import analysis.lifetime.traversal.TraversalPolicy;
import analysis.lifetime.traversal.TraversalStatistics;

/**
 * Runs the lifetime analysis on function bodies. Each function is analyzed independently: a malformed body yields a
 * failed {@link LifetimeResults} for that function only.
 */
public class LifetimeAnalysis {

    private final TraversalPolicy policy;
    private final CalleeClassifier classifier;
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    /**
     * Create an analysis
     *
     * @param policy
     *            chooses traversal bounds for functions without their own
     * @param classifier
     *            recognizes callees with lifetime effects
     */
    public LifetimeAnalysis(TraversalPolicy policy, CalleeClassifier classifier) {
        this.policy = policy;
        this.classifier = classifier;
    }

    /**
     * Traversal bounds for a function: its own override if it has one, otherwise the policy's choice
     *
     * @param body
     *            function to analyze
     * @return bounds to use
     */
    public TraversalConfig configFor(FunctionBody body) {
        if (body.getTraversalOverride() != null) {
            return body.getTraversalOverride();
        }
        return policy.configFor(body);
    }

    /**
     * Analyze one function
     *
     * @param body
     *            function to analyze
     * @return findings and statistics, or a failure if the body is malformed
     */
    public LifetimeResults analyze(FunctionBody body) {
        long start = System.currentTimeMillis();
        try {
            body.validate();
            TraversalConfig config = configFor(body);

            PlaceIdEncoder encoder = new PlaceIdEncoder(body);
            LifetimeViolationDetector detector = new LifetimeViolationDetector(body, encoder, classifier);
            detector.setOutputLevel(outputLevel);
            PathSensitiveTraversal traversal = new PathSensitiveTraversal(body, config, detector);
            traversal.setOutputLevel(outputLevel);

            TraversalStatistics stats = traversal.run(new BindingManager(body.getName()));
            LifetimeResults results = new LifetimeResults(body.getName(), config, detector.getFindings(), stats,
                                                          body.getNumberOfBlocks(),
                                                          body.getReachableBlocks().size());
            if (outputLevel >= 1) {
                System.err.println(results + " in " + (System.currentTimeMillis() - start) + "ms");
            }
            return results;
        } catch (MalformedBodyException e) {
            if (outputLevel >= 1) {
                System.err.println("MALFORMED " + e.getMessage());
            }
            return LifetimeResults.failed(body.getName(), e.getMessage());
        }
    }

    /**
     * Analyze several functions
     *
     * @param bodies
     *            functions to analyze
     * @param numThreads
     *            number of threads to use, 1 analyzes the functions in order on the calling thread
     * @return results in the same order as <code>bodies</code>
     */
    public List<LifetimeResults> analyzeAll(List<FunctionBody> bodies, int numThreads) {
        if (numThreads < 1) {
            throw new IllegalArgumentException("numThreads must be at least 1, got " + numThreads);
        }
        List<LifetimeResults> results = new ArrayList<>(bodies.size());
        if (numThreads == 1 || bodies.size() <= 1) {
            for (FunctionBody body : bodies) {
                results.add(analyze(body));
            }
            return results;
        }

        ExecutorService exec = Executors.newFixedThreadPool(numThreads);
        try {
            List<Future<LifetimeResults>> futures = new ArrayList<>(bodies.size());
            for (final FunctionBody body : bodies) {
                futures.add(exec.submit(new Callable<LifetimeResults>() {
                    @Override
                    public LifetimeResults call() {
                        return analyze(body);
                    }
                }));
            }
            for (Future<LifetimeResults> f : futures) {
                results.add(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while analyzing functions", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Lifetime analysis failed", e.getCause());
        } finally {
            exec.shutdownNow();
        }
        return results;
    }

    /**
     * Set the level of debug output written to standard error
     *
     * @param level
     *            higher means more output
     */
    public void setOutputLevel(int level) {
        outputLevel = level;
    }

    public TraversalPolicy getPolicy() {
        return policy;
    }

    public CalleeClassifier getClassifier() {
        return classifier;
    }
}
