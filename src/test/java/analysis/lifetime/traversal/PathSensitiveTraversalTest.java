package analysis.lifetime.traversal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import analysis.lifetime.binding.BindingManager;
import analysis.lifetime.binding.ReleaseKind;
import analysis.lifetime.ir.BasicBlock;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.place.PlaceId;

public class PathSensitiveTraversalTest {

    /**
     * Records every visit
     */
    private static class Recorder implements BlockVisitor {
        final List<VisitKey> visits = new ArrayList<>();
        final List<BindingManager> states = new ArrayList<>();

        @Override
        public void visitBlock(BasicBlock bb, PathContext context, BindingManager state) {
            visits.add(new VisitKey(bb.getId(), context));
            states.add(state);
        }
    }

    private static Terminator jump(int target) {
        return new Terminator.Goto(target, null);
    }

    private static Terminator branch(Integer... targets) {
        return new Terminator.Switch(null, Arrays.asList(targets), null);
    }

    /**
     * bb0 -> bb1, bb1 -> {bb1, bb2}, bb2 returns
     */
    private static FunctionBody selfLoop() {
        return new FunctionBody.Builder("self_loop").block(0, jump(1))
                                                    .block(1, branch(1, 2))
                                                    .block(2, new Terminator.Return(null))
                                                    .build();
    }

    /**
     * bb0 -> {bb1, bb2}, both -> bb3
     */
    private static FunctionBody diamond() {
        return new FunctionBody.Builder("diamond").block(0, branch(1, 2))
                                                  .block(1, jump(3))
                                                  .block(2, jump(3))
                                                  .block(3, new Terminator.Return(null))
                                                  .build();
    }

    private static TraversalStatistics run(FunctionBody body, TraversalConfig config, BlockVisitor v) {
        return new PathSensitiveTraversal(body, config, v).run(new BindingManager(body.getName()));
    }

    @Test
    public void testSelfLoopWithoutHistory() {
        Recorder r = new Recorder();
        TraversalStatistics stats = run(selfLoop(), new TraversalConfig(0, 3), r);
        assertEquals(new TraversalStatistics(4, 3, 0, 1, 3, 3), stats);
        assertEquals(3, r.visits.size());
    }

    @Test
    public void testSelfLoopSingleVisit() {
        TraversalStatistics stats = run(selfLoop(), new TraversalConfig(0, 1), new Recorder());
        assertEquals(new TraversalStatistics(4, 3, 1, 0, 3, 3), stats);
    }

    @Test
    public void testSelfLoopWithHistory() {
        Recorder r = new Recorder();
        TraversalStatistics stats = run(selfLoop(), new TraversalConfig(1, 3), r);
        assertEquals(8, stats.getVisits());
        assertEquals(2, stats.getSkippedMaxVisits());
        assertEquals(0, stats.getSkippedDuplicatePath());
        assertEquals(10, stats.getAttempts());
        assertEquals(4, stats.getDistinctKeys());
        assertEquals(3, stats.getDistinctBlocks());
    }

    @Test
    public void testVisitCountNeverExceedsLimit() {
        for (int k = 0; k <= 3; k++) {
            for (int max = 1; max <= 4; max++) {
                Recorder r = new Recorder();
                TraversalStatistics stats = run(selfLoop(), new TraversalConfig(k, max), r);
                for (VisitKey key : r.visits) {
                    int count = 0;
                    for (VisitKey other : r.visits) {
                        if (other.equals(key)) {
                            count++;
                        }
                    }
                    assertTrue(count <= max);
                    assertTrue(key.getContext().size() <= k);
                }
                assertEquals(stats.getAttempts(), stats.getVisits() + stats.getSkippedMaxVisits()
                        + stats.getSkippedDuplicatePath());
            }
        }
    }

    @Test
    public void testFirstSuccessorExploredFirst() {
        Recorder r = new Recorder();
        run(diamond(), new TraversalConfig(2, 3), r);
        List<Integer> order = new ArrayList<>();
        for (VisitKey key : r.visits) {
            order.add(key.getBlock());
        }
        assertEquals(Arrays.asList(0, 1, 3, 2, 3), order);
        assertEquals(Arrays.asList(0, 1), r.visits.get(2).getContext().getBlocks());
        assertEquals(Arrays.asList(0, 2), r.visits.get(4).getContext().getBlocks());
    }

    @Test
    public void testSiblingPathsDoNotShareState() {
        final PlaceId x = PlaceId.of("x");
        BlockVisitor releaseOnLeft = new BlockVisitor() {
            @Override
            public void visitBlock(BasicBlock bb, PathContext context, BindingManager state) {
                if (bb.getId() == 1) {
                    state.release(x, ReleaseKind.IMPLICIT_SCOPE_END, bb.getLocation(-1));
                }
                if (bb.getId() == 2) {
                    assertFalse(state.isReleased(x));
                }
                if (bb.getId() == 3 && context.getBlocks().contains(1)) {
                    assertTrue(state.isReleased(x));
                }
                if (bb.getId() == 3 && context.getBlocks().contains(2)) {
                    assertFalse(state.isReleased(x));
                }
            }
        };
        TraversalStatistics stats = run(diamond(), new TraversalConfig(2, 3), releaseOnLeft);
        assertEquals(5, stats.getVisits());
    }

    @Test
    public void testInitialStateIsNotModified() {
        FunctionBody body = diamond();
        BindingManager initial = new BindingManager(body.getName());
        Recorder r = new Recorder();
        new PathSensitiveTraversal(body, TraversalConfig.DEFAULT, r).run(initial);
        for (BindingManager s : r.states) {
            assertNotSame(initial, s);
        }
        assertSame(r.states.get(0), r.states.get(1));
        assertNotSame(r.states.get(1), r.states.get(3));
    }

    @Test
    public void testBlockCountPolicy() {
        TraversalConfig base = new TraversalConfig(2, 3);
        BlockCountTraversalPolicy policy = new BlockCountTraversalPolicy(base, 3, 1, 4);

        // four blocks, no loop
        assertEquals(new TraversalConfig(1, 3), policy.configFor(diamond()));
        // three blocks with a loop
        assertEquals(new TraversalConfig(2, 4), policy.configFor(selfLoop()));

        FunctionBody small = new FunctionBody.Builder("small").block(0, new Terminator.Return(null)).build();
        assertSame(base, policy.configFor(small));
        assertSame(base, new FixedTraversalPolicy(base).configFor(diamond()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeK() {
        new TraversalConfig(-1, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroMaxVisits() {
        new TraversalConfig(2, 0);
    }
}
