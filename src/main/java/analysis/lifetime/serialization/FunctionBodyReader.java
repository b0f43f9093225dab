package analysis.lifetime.serialization;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import analysis.lifetime.ir.BasicBlock;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.MalformedBodyException;
import analysis.lifetime.ir.Operand;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Projection;
import analysis.lifetime.ir.Rvalue;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.StorageKind;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.ir.TypeDescriptor;
import analysis.lifetime.ir.Variable;
import analysis.lifetime.traversal.TraversalConfig;

/**
 * Reads function bodies from the JSON form produced by the compiler front end:
 *
 * <pre>
 * {"functions": [{"name": ..., "entry": 0, "returnVariable": "_0",
 *                 "traversal": {"k": 2, "maxVisitsPerBlock": 3},
 *                 "variables": [{"name": "_1", "storage": "local", "type": {...}}],
 *                 "blocks": [{"id": 0, "statements": [...], "terminator": {...}}]}]}
 * </pre>
 *
 * A place is either a bare variable name or an object <code>{"base": "_1", "projections": [...]}</code>.
 */
public class FunctionBodyReader {

    /**
     * Read the list of serialized functions without decoding them, so that each function can be decoded (and fail)
     * on its own
     *
     * @param in
     *            reader for the whole document
     * @return one JSON object per function
     * @throws JSONException
     *             if the document is not valid JSON or has no "functions" array
     */
    public static List<JSONObject> readFunctionObjects(Reader in) throws JSONException {
        JSONObject doc = new JSONObject(new JSONTokener(in));
        JSONArray fns = doc.getJSONArray("functions");
        List<JSONObject> l = new ArrayList<>(fns.length());
        for (int i = 0; i < fns.length(); i++) {
            l.add(fns.getJSONObject(i));
        }
        return l;
    }

    /**
     * Read all functions in a document
     *
     * @param in
     *            reader for the whole document
     * @return decoded functions, in document order
     * @throws JSONException
     *             if the document is not valid JSON
     * @throws MalformedBodyException
     *             if any function cannot be decoded
     */
    public static List<FunctionBody> readFunctions(Reader in) throws JSONException {
        List<FunctionBody> bodies = new ArrayList<>();
        for (JSONObject fn : readFunctionObjects(in)) {
            bodies.add(readFunction(fn));
        }
        return bodies;
    }

    /**
     * Name of a serialized function, or a placeholder if it has none
     *
     * @param fn
     *            serialized function
     * @param index
     *            position of the function in its document
     * @return function name
     */
    public static String functionName(JSONObject fn, int index) {
        return fn.optString("name", "<function " + index + ">");
    }

    /**
     * Decode one function
     *
     * @param fn
     *            serialized function
     * @return decoded body (not yet validated)
     * @throws MalformedBodyException
     *             if a field is missing or has the wrong shape
     */
    public static FunctionBody readFunction(JSONObject fn) {
        String name = fn.optString("name", "<unnamed>");
        try {
            FunctionBody.Builder b = new FunctionBody.Builder(name);
            b.entry(fn.optInt("entry", 0));
            if (fn.has("returnVariable") && !fn.isNull("returnVariable")) {
                b.returnVariable(fn.getString("returnVariable"));
            }
            JSONObject traversal = fn.optJSONObject("traversal");
            if (traversal != null) {
                b.traversalOverride(new TraversalConfig(traversal.getInt("k"), traversal.getInt("maxVisitsPerBlock")));
            }
            JSONArray vars = fn.getJSONArray("variables");
            for (int i = 0; i < vars.length(); i++) {
                b.variable(readVariable(vars.getJSONObject(i)));
            }
            JSONArray blocks = fn.getJSONArray("blocks");
            for (int i = 0; i < blocks.length(); i++) {
                b.block(readBlock(blocks.getJSONObject(i)));
            }
            return b.build();
        } catch (JSONException | IllegalArgumentException e) {
            throw new MalformedBodyException(name, "cannot decode function: " + e.getMessage(), e);
        }
    }

    private static Variable readVariable(JSONObject json) throws JSONException {
        StorageKind storage = StorageKind.fromJsonName(json.optString("storage", "local"));
        JSONObject type = json.optJSONObject("type");
        return new Variable(json.getString("name"), storage, type == null ? TypeDescriptor.UNKNOWN : readType(type));
    }

    /**
     * Decode a type descriptor
     *
     * @param json
     *            serialized type
     * @return type descriptor
     * @throws JSONException
     *             if a required field is missing
     */
    public static TypeDescriptor readType(JSONObject json) throws JSONException {
        TypeDescriptor.Kind kind = TypeDescriptor.Kind.fromJsonName(json.getString("kind"));
        String name = json.optString("name", kind.getJsonName());
        switch (kind) {
        case RAW_POINTER:
        case REFERENCE:
        case OWNED_POINTER:
            JSONObject pointee = json.optJSONObject("pointee");
            return TypeDescriptor.pointer(name, kind, pointee == null ? null : readType(pointee));
        case STRUCT:
            return TypeDescriptor.struct(name, readTypes(json.optJSONArray("fields")));
        case ENUM:
            return TypeDescriptor.enumeration(name, readTypes(json.optJSONArray("variants")));
        case SCALAR:
            return TypeDescriptor.scalar(name);
        default:
            return TypeDescriptor.opaque(name);
        }
    }

    private static List<TypeDescriptor> readTypes(JSONArray array) throws JSONException {
        List<TypeDescriptor> types = new ArrayList<>();
        if (array == null) {
            return types;
        }
        for (int i = 0; i < array.length(); i++) {
            types.add(readType(array.getJSONObject(i)));
        }
        return types;
    }

    private static BasicBlock readBlock(JSONObject json) throws JSONException {
        int id = json.getInt("id");
        List<Statement> statements = new ArrayList<>();
        JSONArray ss = json.optJSONArray("statements");
        if (ss != null) {
            for (int i = 0; i < ss.length(); i++) {
                statements.add(readStatement(ss.getJSONObject(i)));
            }
        }
        return new BasicBlock(id, statements, readTerminator(json.getJSONObject("terminator")));
    }

    private static Statement readStatement(JSONObject json) throws JSONException {
        Place target = readPlace(json.get("place"));
        return new Statement(target, readRvalue(json.getJSONObject("rvalue")), optSpan(json));
    }

    private static Rvalue readRvalue(JSONObject json) throws JSONException {
        String kind = json.getString("kind");
        switch (kind) {
        case "move":
            return Rvalue.move(readPlace(json.get("place")));
        case "copy":
            return Rvalue.copy(readPlace(json.get("place")));
        case "borrow":
            return Rvalue.borrow(readPlace(json.get("place")));
        case "other":
            return Rvalue.other(json.optString("operator", "Other"), readOperands(json.optJSONArray("operands")));
        default:
            throw new JSONException("Unknown rvalue kind: " + kind);
        }
    }

    private static List<Operand> readOperands(JSONArray array) throws JSONException {
        List<Operand> ops = new ArrayList<>();
        if (array == null) {
            return ops;
        }
        for (int i = 0; i < array.length(); i++) {
            ops.add(readOperand(array.getJSONObject(i)));
        }
        return ops;
    }

    private static Operand readOperand(JSONObject json) throws JSONException {
        String kind = json.getString("kind");
        switch (kind) {
        case "move":
            return Operand.move(readPlace(json.get("place")));
        case "copy":
            return Operand.copy(readPlace(json.get("place")));
        case "constant":
            return Operand.constant(json.optString("value", "?"));
        default:
            throw new JSONException("Unknown operand kind: " + kind);
        }
    }

    private static Terminator readTerminator(JSONObject json) throws JSONException {
        String kind = json.getString("kind");
        String span = optSpan(json);
        switch (kind) {
        case "goto":
            return new Terminator.Goto(json.getInt("target"), span);
        case "switch":
            JSONArray ts = json.getJSONArray("targets");
            List<Integer> targets = new ArrayList<>(ts.length());
            for (int i = 0; i < ts.length(); i++) {
                targets.add(ts.getInt(i));
            }
            return new Terminator.Switch(optPlace(json, "discriminant"), targets, span);
        case "call":
            return new Terminator.Call(json.getString("callee"), readOperands(json.optJSONArray("args")),
                                       optPlace(json, "destination"), optInt(json, "next"), optInt(json, "unwind"),
                                       span);
        case "release":
            return new Terminator.Release(readPlace(json.get("place")), json.getInt("next"), optInt(json, "unwind"),
                                          span);
        case "return":
            return new Terminator.Return(span);
        case "unreachable":
            return new Terminator.Unreachable(span);
        default:
            throw new JSONException("Unknown terminator kind: " + kind);
        }
    }

    /**
     * Decode a place, given either as a variable name or as an object with a base and projections
     *
     * @param value
     *            serialized place
     * @return decoded place
     * @throws JSONException
     *             if the value has the wrong shape
     */
    public static Place readPlace(Object value) throws JSONException {
        if (value instanceof String) {
            return Place.of((String) value);
        }
        if (!(value instanceof JSONObject)) {
            throw new JSONException("Not a place: " + value);
        }
        JSONObject json = (JSONObject) value;
        List<Projection> projections = new ArrayList<>();
        JSONArray ps = json.optJSONArray("projections");
        if (ps != null) {
            for (int i = 0; i < ps.length(); i++) {
                projections.add(readProjection(ps.getJSONObject(i)));
            }
        }
        return new Place(json.getString("base"), projections);
    }

    private static Projection readProjection(JSONObject json) throws JSONException {
        String kind = json.getString("kind");
        switch (kind) {
        case "deref":
            return Projection.deref();
        case "field":
            return Projection.field(json.getInt("index"));
        case "downcast":
            return Projection.downcast(json.getInt("variant"));
        default:
            throw new JSONException("Unknown projection kind: " + kind);
        }
    }

    private static Place optPlace(JSONObject json, String key) throws JSONException {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        return readPlace(json.get(key));
    }

    private static Integer optInt(JSONObject json, String key) throws JSONException {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        return json.getInt(key);
    }

    private static String optSpan(JSONObject json) {
        if (!json.has("span") || json.isNull("span")) {
            return null;
        }
        return json.optString("span");
    }
}
