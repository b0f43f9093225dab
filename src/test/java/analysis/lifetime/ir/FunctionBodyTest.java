package analysis.lifetime.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class FunctionBodyTest {

    private static final TypeDescriptor BYTE = TypeDescriptor.scalar("u8");
    private static final TypeDescriptor PAIR = TypeDescriptor.struct("Pair", Arrays.asList(BYTE, BYTE));
    private static final TypeDescriptor BOX = TypeDescriptor.pointer("Box<Pair>", TypeDescriptor.Kind.OWNED_POINTER,
                                                                     PAIR);

    private static FunctionBody.Builder withBox(String name) {
        return new FunctionBody.Builder(name).variable(Variable.local("b", BOX))
                                             .variable(Variable.local("x", BYTE));
    }

    @Test
    public void testTypeOfProjectedPlace() {
        FunctionBody body = withBox("f").block(0, new Terminator.Return(null)).build();
        assertEquals(PAIR, body.typeOf(Place.deref("b")));
        assertEquals(BYTE, body.typeOf(Place.of("b", Projection.deref(), Projection.field(1))));
    }

    @Test
    public void testValidBodyValidates() {
        Statement s = new Statement(Place.of("x"), Rvalue.copy(Place.of("b", Projection.deref(), Projection.field(0))));
        FunctionBody body = withBox("f").block(0, new Terminator.Goto(1, null), s)
                                        .block(1, new Terminator.Return(null))
                                        .build();
        body.validate();
        assertEquals(2, body.getNumberOfBlocks());
        assertEquals(2, body.getReachableBlocks().size());
        assertFalse(body.hasLoop());
    }

    @Test
    public void testFieldOutOfRange() {
        Statement s = new Statement(Place.of("x"), Rvalue.copy(Place.of("b", Projection.deref(), Projection.field(2))));
        FunctionBody body = withBox("f").block(0, new Terminator.Return(null), s).build();
        try {
            body.validate();
            fail("expected a malformed body");
        } catch (MalformedBodyException e) {
            assertEquals("f", e.getFunctionName());
        }
    }

    @Test(expected = MalformedBodyException.class)
    public void testDerefOfScalar() {
        withBox("f").block(0, new Terminator.Release(Place.deref("x"), 1, null, null))
                    .block(1, new Terminator.Return(null))
                    .build()
                    .validate();
    }

    @Test(expected = MalformedBodyException.class)
    public void testDowncastOfStruct() {
        FunctionBody body = withBox("f").block(0, new Terminator.Return(null)).build();
        body.typeOf(Place.of("b", Projection.deref(), Projection.downcast(0)));
    }

    @Test(expected = MalformedBodyException.class)
    public void testMissingSuccessor() {
        withBox("f").block(0, new Terminator.Goto(5, null)).build().validate();
    }

    @Test(expected = MalformedBodyException.class)
    public void testMissingEntry() {
        withBox("f").entry(3).block(0, new Terminator.Return(null)).build().validate();
    }

    @Test(expected = MalformedBodyException.class)
    public void testUndeclaredVariable() {
        withBox("f").block(0, new Terminator.Release(Place.of("y"), 0, null, null)).build().validate();
    }

    @Test(expected = MalformedBodyException.class)
    public void testDuplicateBlock() {
        withBox("f").block(0, new Terminator.Return(null)).block(0, new Terminator.Return(null));
    }

    @Test(expected = MalformedBodyException.class)
    public void testDuplicateVariable() {
        withBox("f").local("x");
    }

    @Test
    public void testOpaqueAcceptsAnyProjection() {
        FunctionBody body = new FunctionBody.Builder("f").local("o").block(0, new Terminator.Return(null)).build();
        assertEquals(TypeDescriptor.UNKNOWN, body.typeOf(Place.of("o", Projection.downcast(4), Projection.field(9),
                                                                  Projection.deref())));
    }

    @Test
    public void testUnreachableBlocksAndLoops() {
        FunctionBody body = withBox("f").block(0, new Terminator.Goto(1, null))
                                        .block(1, new Terminator.Release(Place.of("b"), 0, 2, null))
                                        .block(2, new Terminator.Unreachable(null))
                                        .block(3, new Terminator.Goto(3, null))
                                        .build();
        body.validate();
        assertEquals(3, body.getReachableBlocks().size());
        assertFalse(body.getReachableBlocks().contains(body.getBlock(3)));
        assertTrue(body.hasLoop());
    }

    @Test
    public void testSuccessorsAreDeduplicated() {
        Terminator t = new Terminator.Switch(null, Arrays.asList(2, 1, 2), null);
        assertEquals(Arrays.asList(2, 1), t.getSuccessors());
        Terminator call = new Terminator.Call("f", Collections.<Operand> emptyList(), null, 1, 1, null);
        assertEquals(Arrays.asList(1), call.getSuccessors());
        Terminator release = new Terminator.Release(Place.of("b"), 1, 2, null);
        assertEquals(Arrays.asList(1, 2), release.getSuccessors());
    }
}
