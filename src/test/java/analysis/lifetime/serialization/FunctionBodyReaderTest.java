package analysis.lifetime.serialization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import org.json.JSONException;
import org.json.JSONObject;
import org.junit.Test;

import analysis.lifetime.TestBodies;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.MalformedBodyException;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Projection;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.ir.TypeDescriptor;
import analysis.lifetime.traversal.TraversalConfig;

public class FunctionBodyReaderTest {

    private static List<JSONObject> fixture() throws JSONException {
        return TestBodies.fixtureFunctions();
    }

    @Test
    public void testReadsEveryFunctionObject() throws JSONException {
        List<JSONObject> fns = fixture();
        assertEquals(5, fns.size());
        assertEquals("use_after_release", FunctionBodyReader.functionName(fns.get(0), 0));
        assertEquals("<function 7>", FunctionBodyReader.functionName(new JSONObject(), 7));
    }

    @Test
    public void testDecodesBlocksAndStatements() throws JSONException {
        FunctionBody body = FunctionBodyReader.readFunction(fixture().get(0));
        assertEquals("use_after_release", body.getName());
        assertEquals(2, body.getNumberOfBlocks());
        assertNull(body.getReturnVariable());
        assertNull(body.getTraversalOverride());

        Terminator t = body.getBlock(0).getTerminator();
        assertEquals(Terminator.Kind.RELEASE, t.getKind());
        assertEquals(Place.of("p"), ((Terminator.Release) t).getPlace());
        assertEquals("src/lib.rs:4:5: 4:6", t.getSpan());

        Statement s = body.getBlock(1).getStatements().get(0);
        assertEquals(Place.of("x"), s.getTarget());
        assertEquals(Arrays.asList(Place.deref("p")), s.getRvalue().getReadPlaces());
        assertEquals(TypeDescriptor.Kind.OWNED_POINTER, body.getVariable("p").getType().getKind());
        body.validate();
    }

    @Test
    public void testDecodesCallsAndOverrides() throws JSONException {
        FunctionBody body = FunctionBodyReader.readFunction(fixture().get(1));
        assertEquals("_0", body.getReturnVariable());
        assertEquals(new TraversalConfig(1, 2), body.getTraversalOverride());

        Terminator.Call call = (Terminator.Call) body.getBlock(1).getTerminator();
        assertEquals("core::mem::drop", call.getCallee());
        assertNull(call.getDestination());
        assertEquals(Arrays.asList(2, 3), call.getSuccessors());
        assertEquals(Place.of("p"), ((Terminator.Call) body.getBlock(0).getTerminator()).getDestination());
        assertTrue(body.getVariable("p").getType().isRawPointer());
        body.validate();
    }

    @Test
    public void testDecodesDowncasts() throws JSONException {
        FunctionBody body = FunctionBodyReader.readFunction(fixture().get(2));
        Statement s = body.getBlock(1).getStatements().get(0);
        assertEquals(Place.of("o", Projection.downcast(1), Projection.field(0)), s.getRvalue().getSource());
        assertEquals(Place.of("d"), ((Terminator.Switch) body.getBlock(0).getTerminator()).getDiscriminant());
        assertEquals(TypeDescriptor.UNKNOWN, body.getVariable("b").getType());
        body.validate();
    }

    @Test(expected = MalformedBodyException.class)
    public void testIllTypedBodyFailsValidation() throws JSONException {
        FunctionBodyReader.readFunction(fixture().get(3)).validate();
    }

    @Test
    public void testMissingBlocks() throws JSONException {
        try {
            FunctionBodyReader.readFunction(fixture().get(4));
            fail("expected a malformed body");
        } catch (MalformedBodyException e) {
            assertEquals("missing_blocks", e.getFunctionName());
        }
    }

    @Test(expected = MalformedBodyException.class)
    public void testUnknownTerminator() throws JSONException {
        String json = "{\"name\": \"f\", \"variables\": [], \"blocks\": [{\"id\": 0, \"terminator\": {\"kind\": \"jump\"}}]}";
        FunctionBodyReader.readFunction(new JSONObject(json));
    }

    @Test(expected = MalformedBodyException.class)
    public void testNegativeFieldIndex() throws JSONException {
        String json = "{\"name\": \"f\", \"variables\": [{\"name\": \"x\"}], \"blocks\": [{\"id\": 0, \"terminator\": "
                + "{\"kind\": \"release\", \"next\": 0, \"place\": {\"base\": \"x\", \"projections\": "
                + "[{\"kind\": \"field\", \"index\": -1}]}}}]}";
        FunctionBodyReader.readFunction(new JSONObject(json));
    }

    @Test(expected = JSONException.class)
    public void testDocumentWithoutFunctions() throws JSONException {
        FunctionBodyReader.readFunctionObjects(new StringReader("{\"fns\": []}"));
    }

    @Test(expected = JSONException.class)
    public void testPlaceOfWrongShape() throws JSONException {
        FunctionBodyReader.readPlace(Integer.valueOf(3));
    }
}
