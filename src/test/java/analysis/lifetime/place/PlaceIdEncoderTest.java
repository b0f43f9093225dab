package analysis.lifetime.place;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.MalformedBodyException;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Projection;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.ir.TypeDescriptor;
import analysis.lifetime.ir.Variable;

public class PlaceIdEncoderTest {

    private static PlaceId encode(String base, Projection... ps) {
        return PlaceIdEncoder.encode(base, Arrays.asList(ps));
    }

    @Test
    public void testBareVariable() {
        PlaceId x = PlaceIdEncoder.encode("x", Collections.<Projection> emptyList());
        assertEquals("x", x.toString());
        assertTrue(x.isBase());
        assertEquals(PlaceId.of("x"), x);
    }

    @Test
    public void testPrefixDereferences() {
        assertEquals("*x", encode("x", Projection.deref()).toString());
        assertEquals("**x", encode("x", Projection.deref(), Projection.deref()).toString());
    }

    @Test
    public void testFieldThenDerefDiffersFromDerefThenField() {
        PlaceId fieldDeref = encode("x", Projection.field(0), Projection.deref());
        PlaceId derefField = encode("x", Projection.deref(), Projection.field(0));
        assertNotEquals(fieldDeref, derefField);
        assertEquals("x.0@deref", fieldDeref.toString());
        assertEquals("(*x).0", derefField.toString());
    }

    @Test
    public void testDowncastAndNestedProjections() {
        assertEquals("(x as 1).0", encode("x", Projection.downcast(1), Projection.field(0)).toString());
        assertEquals("x.0.1", encode("x", Projection.field(0), Projection.field(1)).toString());
        assertEquals("(*x).0@deref", encode("x", Projection.deref(), Projection.field(0), Projection.deref())
                                                                                                      .toString());
        assertEquals("x.0@deref@deref", encode("x", Projection.field(0), Projection.deref(), Projection.deref())
                                                                                                        .toString());
    }

    @Test
    public void testSyntacticallyEqualPlacesEncodeEqually() {
        PlaceId a = encode("y", Projection.deref(), Projection.field(2));
        PlaceId b = encode("y", Projection.deref(), Projection.field(2));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    public void testDerefOperand() {
        assertEquals("*x", encode("x", Projection.deref(), Projection.deref()).getDerefOperand().toString());
        assertEquals("x", encode("x", Projection.deref(), Projection.field(0)).getDerefOperand().toString());
        assertEquals("x", encode("x", Projection.deref()).getDerefOperand().toString());
        assertFalse(encode("x", Projection.field(0), Projection.deref()).hasPrefixDeref());
    }

    @Test
    public void testSuffixDerefPrefix() {
        PlaceId id = encode("x", Projection.field(0), Projection.deref());
        assertTrue(id.hasSuffixDeref());
        assertEquals("x.0", id.getSuffixDerefPrefix().toString());
        assertFalse(encode("x", Projection.deref()).hasSuffixDeref());
    }

    @Test(expected = IllegalStateException.class)
    public void testDerefOperandOfPlainPlace() {
        PlaceId.of("x").getDerefOperand();
    }

    @Test
    public void testStorageQueriesAndMemoization() {
        FunctionBody body = new FunctionBody.Builder("f")
                .variable(Variable.staticItem("G", TypeDescriptor.UNKNOWN))
                .variable(Variable.local("p", TypeDescriptor.pointer("*mut u8", TypeDescriptor.Kind.RAW_POINTER,
                                                                     null)))
                .block(0, new Terminator.Return(null)).build();
        PlaceIdEncoder encoder = new PlaceIdEncoder(body);

        assertTrue(encoder.isStatic(Place.deref("G")));
        assertFalse(encoder.isStatic(Place.of("p")));
        assertTrue(encoder.isRawPointer(Place.of("p")));
        assertEquals(PlaceId.of("p"), encoder.baseId(Place.deref("p")));

        Place p = Place.deref("p");
        assertSame(encoder.encode(p), encoder.encode(Place.deref("p")));
    }

    @Test(expected = MalformedBodyException.class)
    public void testUndeclaredBaseIsMalformed() {
        FunctionBody body = new FunctionBody.Builder("f").block(0, new Terminator.Return(null))
                                                         .build();
        new PlaceIdEncoder(body).isStatic(Place.of("nope"));
    }
}
