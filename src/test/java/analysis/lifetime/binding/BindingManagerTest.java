package analysis.lifetime.binding;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import analysis.lifetime.ir.SourceLocation;
import analysis.lifetime.place.PlaceId;

public class BindingManagerTest {

    private static final PlaceId A = PlaceId.of("a");
    private static final PlaceId B = PlaceId.of("b");
    private static final PlaceId C = PlaceId.of("c");
    private static final PlaceId D = PlaceId.of("d");

    private static SourceLocation at(int block) {
        return new SourceLocation(block, SourceLocation.TERMINATOR, null);
    }

    @Test
    public void testUnionByRank() {
        BindingManager m = new BindingManager("f");
        assertTrue(m.bind(A, B));
        // equal ranks: second is linked under first
        assertEquals(A, m.getRoot(B));
        assertTrue(m.isBound(B));
        assertFalse(m.isBound(A));

        // lower rank root goes under higher rank root
        assertTrue(m.bind(C, A));
        assertEquals(A, m.getRoot(C));
        assertEquals(Arrays.asList(A, B, C), m.findGroup(C));
        assertEquals(1, m.getGroupCount());
        assertFalse(m.bind(B, C));
    }

    @Test
    public void testUnregisteredIds() {
        BindingManager m = new BindingManager("f");
        assertFalse(m.isReleased(A));
        assertFalse(m.isBound(A));
        assertEquals(A, m.getRoot(A));
        assertEquals(Arrays.asList(A), m.findGroup(A));
        assertFalse(m.unrelease(A));
        assertEquals(0, m.getGroupCount());
    }

    @Test
    public void testReleaseIsWholeGroup() {
        BindingManager m = new BindingManager("f");
        m.bind(A, B);
        assertNull(m.release(B, ReleaseKind.IMPLICIT_SCOPE_END, at(1)));
        assertTrue(m.isReleased(A));
        assertTrue(m.isReleased(B));
        assertFalse(m.isReleased(C));

        ReleaseRecord r = m.getReleaseState(A).getRecord();
        assertEquals(ReleaseKind.IMPLICIT_SCOPE_END, r.getKind());
        assertEquals("f", r.getFunction());
        assertEquals(at(1), r.getLocation());
    }

    @Test
    public void testSecondReleaseReturnsPreviousRecord() {
        BindingManager m = new BindingManager("f");
        m.release(A, ReleaseKind.IMPLICIT_SCOPE_END, at(1));
        ReleaseRecord previous = m.release(A, ReleaseKind.EXPLICIT_RELEASE_CALL, at(2), "g");
        assertNotNull(previous);
        assertEquals(at(1), previous.getLocation());
        ReleaseRecord latest = m.getReleaseState(A).getRecord();
        assertEquals(at(2), latest.getLocation());
        assertEquals("g", latest.getFunction());
        assertTrue(latest.getSequence() > previous.getSequence());
    }

    @Test
    public void testUnreleaseClearsWholeGroup() {
        BindingManager m = new BindingManager("f");
        m.bind(A, B);
        m.bind(B, C);
        m.release(A, ReleaseKind.IMPLICIT_SCOPE_END, at(1));
        assertTrue(m.unrelease(C));
        assertFalse(m.isReleased(A));
        assertFalse(m.isReleased(B));
        assertFalse(m.isReleased(C));
    }

    @Test
    public void testReleaseThenUnreleaseForEveryId() {
        for (PlaceId id : Arrays.asList(A, PlaceId.of("x"), PlaceId.of("y"))) {
            BindingManager m = new BindingManager("f");
            m.bind(A, B);
            m.release(id, ReleaseKind.EXPLICIT_RELEASE_CALL, at(0));
            m.unrelease(id);
            assertFalse(m.isReleased(id));
        }
    }

    @Test
    public void testMergeTakesReleasedSide() {
        BindingManager m = new BindingManager("f");
        m.release(A, ReleaseKind.IMPLICIT_SCOPE_END, at(1));
        m.bind(D, A);
        assertTrue(m.isReleased(D));
        assertEquals(at(1), m.getReleaseState(D).getRecord().getLocation());

        m.bind(B, C);
        assertFalse(m.isReleased(B));
    }

    @Test
    public void testMergeOfTwoReleasedGroupsKeepsMostRecentRecord() {
        BindingManager m = new BindingManager("f");
        m.release(A, ReleaseKind.IMPLICIT_SCOPE_END, at(1));
        m.release(B, ReleaseKind.EXPLICIT_RELEASE_CALL, at(2));
        m.bind(B, A);
        assertEquals(at(2), m.getReleaseState(A).getRecord().getLocation());

        BindingManager m2 = new BindingManager("f");
        m2.release(A, ReleaseKind.IMPLICIT_SCOPE_END, at(1));
        m2.release(B, ReleaseKind.EXPLICIT_RELEASE_CALL, at(2));
        m2.bind(A, B);
        assertEquals(at(2), m2.getReleaseState(A).getRecord().getLocation());
    }

    @Test
    public void testGroupsNeverShrink() {
        BindingManager m = new BindingManager("f");
        List<PlaceId> ids = Arrays.asList(A, B, C, D, PlaceId.of("e"), PlaceId.of("f"));
        for (PlaceId id : ids) {
            m.register(id);
        }
        int[][] binds = { { 0, 1 }, { 2, 3 }, { 1, 3 }, { 4, 5 }, { 0, 2 }, { 5, 0 } };
        int groups = m.getGroupCount();
        assertEquals(ids.size(), groups);
        for (int[] bind : binds) {
            List<PlaceId> before = m.findGroup(ids.get(bind[0]));
            m.bind(ids.get(bind[0]), ids.get(bind[1]));
            assertTrue(m.findGroup(ids.get(bind[0])).containsAll(before));
            assertTrue(m.getGroupCount() <= groups);
            groups = m.getGroupCount();
        }
        assertEquals(1, groups);
        assertEquals(ids, m.findGroup(D));
    }

    @Test
    public void testCopiesAreIndependent() {
        BindingManager s = new BindingManager("f");
        s.bind(A, B);
        BindingManager s1 = s.copy();
        BindingManager s2 = s.copy();

        s1.release(B, ReleaseKind.IMPLICIT_SCOPE_END, at(3));
        s1.bind(C, A);
        s1.markStaticDerived(D);

        assertTrue(s1.isReleased(A));
        assertFalse(s2.isReleased(A));
        assertFalse(s2.isReleased(B));
        assertFalse(s2.isRegistered(C));
        assertFalse(s2.isStaticDerived(D));
        assertFalse(s.isReleased(A));
        assertEquals(Arrays.asList(A, B), s2.findGroup(A));
    }

    @Test
    public void testStaticDerivedIsPerBase() {
        BindingManager m = new BindingManager("f");
        m.markStaticDerived(PlaceId.of("ptr"));
        assertTrue(m.isStaticDerived(PlaceId.of("ptr")));
        assertFalse(m.isStaticDerived(PlaceId.of("other")));
    }

    @Test
    public void testClearStaticDerived() {
        BindingManager m = new BindingManager("f");
        m.markStaticDerived(PlaceId.of("ptr"));
        assertTrue(m.clearStaticDerived(PlaceId.of("ptr")));
        assertFalse(m.isStaticDerived(PlaceId.of("ptr")));
        assertFalse(m.clearStaticDerived(PlaceId.of("ptr")));
    }
}
