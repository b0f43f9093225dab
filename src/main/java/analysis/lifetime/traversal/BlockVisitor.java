package analysis.lifetime.traversal;

import analysis.lifetime.binding.BindingManager;
import analysis.lifetime.ir.BasicBlock;

/**
 * Simulates the effect of one basic block on the binding state of the path being explored
 */
public interface BlockVisitor {

    /**
     * Process the statements and terminator of a block
     *
     * @param bb
     *            block being visited
     * @param context
     *            predecessors of this visit
     * @param state
     *            binding state owned by this visit, updated in place
     */
    void visitBlock(BasicBlock bb, PathContext context, BindingManager state);
}
