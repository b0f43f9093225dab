package analysis.lifetime;

import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.lifetime.binding.ReleaseRecord;
import analysis.lifetime.ir.SourceLocation;
import analysis.lifetime.place.PlaceId;
import analysis.lifetime.serialization.JSONSerializable;
import analysis.lifetime.serialization.JSONUtil;
import analysis.lifetime.traversal.PathContext;

/**
 * One detected lifetime violation, together with the path context of the visit that found it
 */
public final class Finding implements JSONSerializable {

    private final FindingKind kind;
    /**
     * Place that was used or released
     */
    private final PlaceId place;
    private final SourceLocation location;
    /**
     * Members of the group of <code>place</code> when the violation was found
     */
    private final List<PlaceId> groupMembers;
    /**
     * For a use after release the release that made the use invalid, for a double release the earlier release
     */
    private final ReleaseRecord record;
    /**
     * For a double release the second release, null otherwise
     */
    private final ReleaseRecord secondRecord;
    private final PathContext pathContext;
    /**
     * True if the access that triggered the finding dereferences a raw pointer
     */
    private final boolean throughRawPointer;

    private Finding(FindingKind kind, PlaceId place, SourceLocation location, List<PlaceId> groupMembers,
                    ReleaseRecord record, ReleaseRecord secondRecord, PathContext pathContext,
                    boolean throughRawPointer) {
        this.kind = kind;
        this.place = place;
        this.location = location;
        this.groupMembers = Collections.unmodifiableList(new ArrayList<>(groupMembers));
        this.record = record;
        this.secondRecord = secondRecord;
        this.pathContext = pathContext;
        this.throughRawPointer = throughRawPointer;
    }

    /**
     * Read of a released place
     *
     * @param place
     *            place read
     * @param location
     *            location of the read
     * @param groupMembers
     *            members of the released group
     * @param record
     *            release of the group
     * @param context
     *            path context of the visit
     * @param throughRawPointer
     *            whether the place dereferences a raw pointer
     * @return new finding
     */
    public static Finding useAfterRelease(PlaceId place, SourceLocation location, List<PlaceId> groupMembers,
                                          ReleaseRecord record, PathContext context, boolean throughRawPointer) {
        return new Finding(FindingKind.USE_AFTER_RELEASE, place, location, groupMembers, record, null, context,
                           throughRawPointer);
    }

    /**
     * Release of an already released place
     *
     * @param place
     *            place released
     * @param location
     *            location of the second release
     * @param groupMembers
     *            members of the released group
     * @param first
     *            earlier release
     * @param second
     *            the release at <code>location</code>
     * @param context
     *            path context of the visit
     * @param throughRawPointer
     *            whether the place dereferences a raw pointer
     * @return new finding
     */
    public static Finding doubleRelease(PlaceId place, SourceLocation location, List<PlaceId> groupMembers,
                                        ReleaseRecord first, ReleaseRecord second, PathContext context,
                                        boolean throughRawPointer) {
        return new Finding(FindingKind.DOUBLE_RELEASE, place, location, groupMembers, first, second, context,
                           throughRawPointer);
    }

    public FindingKind getKind() {
        return kind;
    }

    public PlaceId getPlace() {
        return place;
    }

    public int getBlock() {
        return location.getBlock();
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<PlaceId> getGroupMembers() {
        return groupMembers;
    }

    public ReleaseRecord getRecord() {
        return record;
    }

    public ReleaseRecord getSecondRecord() {
        return secondRecord;
    }

    public PathContext getPathContext() {
        return pathContext;
    }

    public boolean isThroughRawPointer() {
        return throughRawPointer;
    }

    /**
     * Key identifying the violation independently of the path that found it
     *
     * @return string combining kind, place and location
     */
    public String getSiteKey() {
        return kind + " " + place + " @ " + location;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "kind", kind.toString());
        JSONUtil.addJSON(json, "place", place.toString());
        JSONUtil.addJSON(json, "block", location.getBlock());
        JSONUtil.addJSON(json, "location", location);
        JSONUtil.addJSON(json, "group", groupMembers);
        if (kind == FindingKind.DOUBLE_RELEASE) {
            JSONUtil.addJSON(json, "firstRelease", record);
            JSONUtil.addJSON(json, "secondRelease", secondRecord);
        } else {
            JSONUtil.addJSON(json, "release", record);
        }
        JSONUtil.addJSON(json, "pathContext", pathContext.toString());
        JSONUtil.addJSON(json, "throughRawPointer", throughRawPointer);
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
        result = prime * result + kind.hashCode();
        result = prime * result + place.hashCode();
        result = prime * result + location.hashCode();
        result = prime * result + groupMembers.hashCode();
        result = prime * result + ((record == null) ? 0 : record.hashCode());
        result = prime * result + ((secondRecord == null) ? 0 : secondRecord.hashCode());
        result = prime * result + pathContext.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Finding)) {
            return false;
        }
        Finding other = (Finding) obj;
        if (kind != other.kind || throughRawPointer != other.throughRawPointer) {
            return false;
        }
        if (!place.equals(other.place) || !location.equals(other.location)) {
            return false;
        }
        if (!groupMembers.equals(other.groupMembers) || !pathContext.equals(other.pathContext)) {
            return false;
        }
        if (record == null ? other.record != null : !record.equals(other.record)) {
            return false;
        }
        return secondRecord == null ? other.secondRecord == null : secondRecord.equals(other.secondRecord);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(" of ").append(place).append(" at ").append(location);
        sb.append(" via ").append(pathContext);
        if (kind == FindingKind.DOUBLE_RELEASE) {
            sb.append(", first ").append(record).append(", then ").append(secondRecord);
        } else {
            sb.append(", released by ").append(record);
        }
        sb.append(", group ").append(groupMembers);
        return sb.toString();
    }
}
