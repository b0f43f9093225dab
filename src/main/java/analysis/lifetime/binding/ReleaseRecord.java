package analysis.lifetime.binding;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.lifetime.ir.SourceLocation;
import analysis.lifetime.serialization.JSONSerializable;
import analysis.lifetime.serialization.JSONUtil;

/**
 * Where, how and in which function a group was released
 */
public final class ReleaseRecord implements JSONSerializable {

    private final SourceLocation location;
    private final ReleaseKind kind;
    private final String function;
    /**
     * Position of this release among all releases performed by one binding manager, larger is more recent
     */
    private final long sequence;

    public ReleaseRecord(SourceLocation location, ReleaseKind kind, String function, long sequence) {
        this.location = location;
        this.kind = kind;
        this.function = function;
        this.sequence = sequence;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public ReleaseKind getKind() {
        return kind;
    }

    public String getFunction() {
        return function;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "kind", kind.toString());
        JSONUtil.addJSON(json, "function", function);
        JSONUtil.addJSON(json, "location", location);
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + location.hashCode();
        result = prime * result + kind.hashCode();
        result = prime * result + function.hashCode();
        result = prime * result + (int) (sequence ^ (sequence >>> 32));
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReleaseRecord)) {
            return false;
        }
        ReleaseRecord other = (ReleaseRecord) obj;
        return sequence == other.sequence && kind == other.kind && location.equals(other.location)
                && function.equals(other.function);
    }

    @Override
    public String toString() {
        return kind + " at " + location + " in " + function;
    }
}
