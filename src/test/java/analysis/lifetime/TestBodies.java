package analysis.lifetime;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Operand;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Rvalue;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.serialization.FunctionBodyReader;

/**
 * Shorthand for building small function bodies in tests
 */
public final class TestBodies {

    private TestBodies() {
        // static helpers only
    }

    /**
     * Builder with the given locals (and no statics) declared with unknown type
     */
    public static FunctionBody.Builder function(String name, String... locals) {
        FunctionBody.Builder b = new FunctionBody.Builder(name);
        for (String l : locals) {
            b.local(l);
        }
        return b;
    }

    public static Place place(String base) {
        return Place.of(base);
    }

    public static Statement assign(Place target, Rvalue rv) {
        return new Statement(target, rv);
    }

    public static Statement assign(String target, Rvalue rv) {
        return new Statement(Place.of(target), rv);
    }

    public static Rvalue move(String source) {
        return Rvalue.move(Place.of(source));
    }

    /**
     * A computed value that reads the given places
     */
    public static Rvalue read(Place... places) {
        List<Operand> ops = new ArrayList<>();
        for (Place p : places) {
            ops.add(Operand.copy(p));
        }
        return Rvalue.other("Use", ops);
    }

    public static Rvalue read(String var) {
        return read(Place.of(var));
    }

    public static Rvalue constant() {
        return Rvalue.other("Const", Arrays.asList(Operand.constant("0")));
    }

    public static Terminator jump(int target) {
        return new Terminator.Goto(target, null);
    }

    public static Terminator branch(int... targets) {
        List<Integer> l = new ArrayList<>();
        for (int t : targets) {
            l.add(t);
        }
        return new Terminator.Switch(null, l, null);
    }

    public static Terminator release(Place p, int next) {
        return new Terminator.Release(p, next, null, null);
    }

    public static Terminator release(String var, int next) {
        return release(Place.of(var), next);
    }

    public static Terminator call(String callee, Place dest, Integer next, Operand... args) {
        return new Terminator.Call(callee, Arrays.asList(args), dest, next, null, null);
    }

    public static Terminator ret() {
        return new Terminator.Return(null);
    }

    /**
     * Serialized functions from the shared test resource, undecoded
     */
    public static List<JSONObject> fixtureFunctions() throws JSONException {
        Reader in = new InputStreamReader(TestBodies.class.getResourceAsStream("/lifetime/functions.json"),
                                          StandardCharsets.UTF_8);
        return FunctionBodyReader.readFunctionObjects(in);
    }
}
