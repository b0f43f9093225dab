package analysis.lifetime.traversal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import analysis.lifetime.binding.BindingManager;
import analysis.lifetime.ir.BasicBlock;
import analysis.lifetime.ir.FunctionBody;

/**
 * Depth-first walk of the control flow graph of one function that distinguishes visits of the same block by the
 * last <code>k</code> blocks on the path to it. Every explored path owns its binding state: at a branch each
 * successor gets its own copy.
 * <p>
 * The walk uses an explicit stack. It terminates because each (block, context) pair is visited at most
 * <code>maxVisitsPerBlock</code> times and there are finitely many such pairs.
 */
public class PathSensitiveTraversal {

    private final FunctionBody body;
    private final TraversalConfig config;
    private final BlockVisitor visitor;
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    /**
     * Pending visit
     */
    private static final class Frame {
        final int block;
        final PathContext context;
        /**
         * Binding state on entry to the block, owned by this frame
         */
        final BindingManager state;

        Frame(int block, PathContext context, BindingManager state) {
            this.block = block;
            this.context = context;
            this.state = state;
        }
    }

    /**
     * Create a traversal
     *
     * @param body
     *            function to walk
     * @param config
     *            history length and visit limit
     * @param visitor
     *            processes each visited block
     */
    public PathSensitiveTraversal(FunctionBody body, TraversalConfig config, BlockVisitor visitor) {
        this.body = body;
        this.config = config;
        this.visitor = visitor;
    }

    /**
     * Walk the body starting at its entry block
     *
     * @param initial
     *            binding state on entry to the function, not modified
     * @return counters for the run
     */
    public TraversalStatistics run(BindingManager initial) {
        VisitState visits = new VisitState();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(body.getEntryId(), PathContext.EMPTY, initial.copy()));

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            visits.recordAttempt();
            VisitKey key = new VisitKey(f.block, f.context);

            if (visits.getCount(key) >= config.getMaxVisitsPerBlock()) {
                visits.recordSkippedMaxVisits();
                if (outputLevel >= 4) {
                    System.err.println("SKIP (max visits) " + key + " in " + body.getName());
                }
                continue;
            }
            if (config.getK() == 0 && visits.hasVisited(key)) {
                visits.recordSkippedDuplicatePath();
                if (outputLevel >= 4) {
                    System.err.println("SKIP (duplicate path) " + key + " in " + body.getName());
                }
                continue;
            }

            visits.recordVisit(key);
            BasicBlock bb = body.getBlock(f.block);
            if (outputLevel >= 3) {
                System.err.println("VISIT " + key + " in " + body.getName());
            }
            // the frame owns its state so the block can update it in place
            BindingManager post = f.state;
            visitor.visitBlock(bb, f.context, post);

            List<Integer> succs = bb.getTerminator().getSuccessors();
            if (succs.isEmpty()) {
                continue;
            }
            PathContext next = f.context.extend(f.block, config.getK());
            // push in reverse so the first successor is explored first
            for (int i = succs.size() - 1; i >= 0; i--) {
                BindingManager succState = i == 0 ? post : post.copy();
                stack.push(new Frame(succs.get(i), next, succState));
            }
        }
        TraversalStatistics stats = visits.getStatistics();
        if (outputLevel >= 2) {
            System.err.println("TRAVERSAL of " + body.getName() + " (" + config + "): " + stats);
        }
        return stats;
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

    public TraversalConfig getConfig() {
        return config;
    }
}
