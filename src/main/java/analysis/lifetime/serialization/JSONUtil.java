package analysis.lifetime.serialization;

import java.util.Collection;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.lifetime.ir.SourceLocation;

/**
 * Helpers for building the JSON report. Serialization errors are reported on standard error and the offending entry
 * is left out.
 */
public class JSONUtil {

    /**
     * Serialize the given {@link SourceLocation}
     *
     * @param loc
     *            location to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(SourceLocation loc) {
        JSONObject json = new JSONObject();
        try {
            json.put("block", loc.getBlock());
            if (loc.isTerminator()) {
                json.put("statement", "terminator");
            } else {
                json.put("statement", loc.getIndex());
            }
            json.put("span", loc.getSpan() == null ? JSONObject.NULL : loc.getSpan());
        } catch (JSONException e) {
            System.err.println("Serialization error in " + loc + ", message: " + e.getMessage());
        }
        return json;
    }

    /**
     * Add the (key, location) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param loc
     *            location to add, JSON null if null
     */
    public static void addJSON(JSONObject json, String key, SourceLocation loc) {
        try {
            json.put(key, loc == null ? JSONObject.NULL : toJSON(loc));
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + loc + "), message: " + e.getMessage());
        }
    }

    /**
     * Add the (key, object) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            object to serialize and add, JSON null if null
     */
    public static void addJSON(JSONObject json, String key, JSONSerializable value) {
        try {
            json.put(key, value == null ? JSONObject.NULL : value.toJSON());
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }

    /**
     * Add the string form of each element of a collection as a JSON array under the given key
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param values
     *            elements to add, in iteration order
     */
    public static void addJSON(JSONObject json, String key, Collection<?> values) {
        JSONArray array = new JSONArray();
        for (Object o : values) {
            if (o instanceof JSONSerializable) {
                array.put(((JSONSerializable) o).toJSON());
            } else {
                array.put(String.valueOf(o));
            }
        }
        try {
            json.put(key, array);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + values + "), message: " + e.getMessage());
        }
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            string value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, String value) {
        try {
            json.put(key, value == null ? JSONObject.NULL : value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            boolean value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, boolean value) {
        try {
            json.put(key, value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            numeric value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, long value) {
        try {
            json.put(key, value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }
}
