package analysis.lifetime.binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.lifetime.ir.SourceLocation;
import analysis.lifetime.place.PlaceId;

/**
 * Union-find structure over {@link PlaceId}s that tracks which places denote the same resource and whether that
 * resource has been released. Each group has exactly one {@link ReleaseState}, stored on the group's root.
 * <p>
 * Groups only ever merge. Unions are by rank with path compression; when two roots have the same rank the root of
 * the second argument of {@link #bind(PlaceId, PlaceId)} is linked under the root of the first.
 * <p>
 * Instances are not thread safe. The path-sensitive traversal gives every explored path its own {@link #copy()}.
 */
public final class BindingManager {

    /**
     * Name of the function being analyzed, recorded in release records
     */
    private final String functionName;
    /**
     * Union-find parent pointers, keys are in registration order
     */
    private final Map<PlaceId, PlaceId> parent;
    /**
     * Upper bound on the height of the tree below each root
     */
    private final Map<PlaceId, Integer> rank;
    /**
     * Release state for each released group, keyed by the group's root
     */
    private final Map<PlaceId, ReleaseState> releaseStates;
    /**
     * Base variables that hold the address of process-wide storage
     */
    private final Set<PlaceId> staticDerived;
    /**
     * Number of releases performed so far, used to order release records
     */
    private long releaseCounter;
    /**
     * Number of distinct groups among the registered ids
     */
    private int groupCount;

    /**
     * Create an empty manager
     *
     * @param functionName
     *            function whose places are tracked
     */
    public BindingManager(String functionName) {
        this.functionName = functionName;
        this.parent = new LinkedHashMap<>();
        this.rank = new LinkedHashMap<>();
        this.releaseStates = new LinkedHashMap<>();
        this.staticDerived = new LinkedHashSet<>();
        this.releaseCounter = 0;
        this.groupCount = 0;
    }

    /**
     * Deep copy. Keys and release states are immutable so only the maps are duplicated.
     *
     * @param other
     *            manager to copy
     */
    private BindingManager(BindingManager other) {
        this.functionName = other.functionName;
        this.parent = new LinkedHashMap<>(other.parent);
        this.rank = new LinkedHashMap<>(other.rank);
        this.releaseStates = new LinkedHashMap<>(other.releaseStates);
        this.staticDerived = new LinkedHashSet<>(other.staticDerived);
        this.releaseCounter = other.releaseCounter;
        this.groupCount = other.groupCount;
    }

    /**
     * Independent copy of this manager; changes to either are never visible in the other
     *
     * @return new manager with the same groups and release states
     */
    public BindingManager copy() {
        return new BindingManager(this);
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Add an id as a singleton group if it has not been seen before
     *
     * @param id
     *            id to register
     * @return true if the id was new
     */
    public boolean register(PlaceId id) {
        if (parent.containsKey(id)) {
            return false;
        }
        parent.put(id, id);
        rank.put(id, 0);
        groupCount++;
        return true;
    }

    public boolean isRegistered(PlaceId id) {
        return parent.containsKey(id);
    }

    /**
     * Find the root of the group containing a registered id, compressing the path to it
     *
     * @param id
     *            registered id
     * @return root of the group
     */
    private PlaceId find(PlaceId id) {
        PlaceId root = id;
        PlaceId p = parent.get(root);
        while (!p.equals(root)) {
            root = p;
            p = parent.get(root);
        }
        // compress
        PlaceId current = id;
        while (!current.equals(root)) {
            PlaceId next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    /**
     * Record that the source and target denote the same resource by merging their groups. The merged group is
     * released if either group was released, with the most recent of the two release records.
     *
     * @param source
     *            id of the place the value came from
     * @param target
     *            id of the place the value was stored in
     * @return true if two distinct groups were merged
     */
    public boolean bind(PlaceId source, PlaceId target) {
        register(source);
        register(target);
        PlaceId rs = find(source);
        PlaceId rt = find(target);
        if (rs.equals(rt)) {
            return false;
        }
        ReleaseState merged = ReleaseState.merge(stateOfRoot(rs), stateOfRoot(rt));
        releaseStates.remove(rs);
        releaseStates.remove(rt);

        int rankS = rank.get(rs);
        int rankT = rank.get(rt);
        PlaceId newRoot;
        if (rankS < rankT) {
            parent.put(rs, rt);
            newRoot = rt;
        } else if (rankS > rankT) {
            parent.put(rt, rs);
            newRoot = rs;
        } else {
            parent.put(rt, rs);
            rank.put(rs, rankS + 1);
            newRoot = rs;
        }
        if (merged.isReleased()) {
            releaseStates.put(newRoot, merged);
        }
        groupCount--;
        return true;
    }

    /**
     * Mark the group containing an id as released. Releasing an already released group is allowed: the new record
     * replaces the old one and the old one is returned so the caller can report the double release.
     *
     * @param id
     *            id of the released place
     * @param kind
     *            how the place was released
     * @param location
     *            where the release happened
     * @return the record of the previous release if the group was already released, null otherwise
     */
    public ReleaseRecord release(PlaceId id, ReleaseKind kind, SourceLocation location) {
        return release(id, kind, location, functionName);
    }

    /**
     * Mark the group containing an id as released by the given function
     *
     * @param id
     *            id of the released place
     * @param kind
     *            how the place was released
     * @param location
     *            where the release happened
     * @param function
     *            function performing the release
     * @return the record of the previous release if the group was already released, null otherwise
     */
    public ReleaseRecord release(PlaceId id, ReleaseKind kind, SourceLocation location, String function) {
        register(id);
        PlaceId root = find(id);
        ReleaseState previous = stateOfRoot(root);
        releaseCounter++;
        releaseStates.put(root, ReleaseState.released(new ReleaseRecord(location, kind, function,
                                                                          releaseCounter)));
        return previous.getRecord();
    }

    /**
     * Clear the release state of the whole group containing an id
     *
     * @param id
     *            id of a reinitialized place
     * @return true if the group had been released
     */
    public boolean unrelease(PlaceId id) {
        if (!isRegistered(id)) {
            return false;
        }
        return releaseStates.remove(find(id)) != null;
    }

    /**
     * Whether the group containing an id is currently released
     *
     * @param id
     *            id to check
     * @return true if released, false if live or never seen
     */
    public boolean isReleased(PlaceId id) {
        return getReleaseState(id).isReleased();
    }

    /**
     * Release state of the group containing an id
     *
     * @param id
     *            id to check
     * @return state of the group, {@link ReleaseState#UNRELEASED} for ids never seen
     */
    public ReleaseState getReleaseState(PlaceId id) {
        if (!isRegistered(id)) {
            return ReleaseState.UNRELEASED;
        }
        return stateOfRoot(find(id));
    }

    private ReleaseState stateOfRoot(PlaceId root) {
        ReleaseState s = releaseStates.get(root);
        return s == null ? ReleaseState.UNRELEASED : s;
    }

    /**
     * Root of the group containing an id
     *
     * @param id
     *            id to look up
     * @return group root, the id itself if it was never registered
     */
    public PlaceId getRoot(PlaceId id) {
        if (!isRegistered(id)) {
            return id;
        }
        return find(id);
    }

    /**
     * Members of the group containing an id, in registration order
     *
     * @param id
     *            id to look up
     * @return members of the group, just the id itself if it was never registered
     */
    public List<PlaceId> findGroup(PlaceId id) {
        if (!isRegistered(id)) {
            return Collections.singletonList(id);
        }
        PlaceId root = find(id);
        List<PlaceId> members = new ArrayList<>();
        for (PlaceId member : new ArrayList<>(parent.keySet())) {
            if (find(member).equals(root)) {
                members.add(member);
            }
        }
        return members;
    }

    /**
     * Whether an id has been merged into a group rooted at some other id
     *
     * @param id
     *            id to check
     * @return true if the id is registered and is not the root of its group
     */
    public boolean isBound(PlaceId id) {
        return isRegistered(id) && !find(id).equals(id);
    }

    /**
     * Number of distinct groups among all registered ids
     *
     * @return number of groups
     */
    public int getGroupCount() {
        return groupCount;
    }

    /**
     * All ids seen so far, in registration order
     *
     * @return registered ids
     */
    public Set<PlaceId> getRegisteredIds() {
        return Collections.unmodifiableSet(parent.keySet());
    }

    /**
     * Record that a base variable holds the address of process-wide storage
     *
     * @param base
     *            id of the base variable
     */
    public void markStaticDerived(PlaceId base) {
        staticDerived.add(base.getBase());
    }

    public boolean isStaticDerived(PlaceId base) {
        return staticDerived.contains(base.getBase());
    }

    /**
     * Forget that a base variable holds the address of process-wide storage, because it was overwritten
     *
     * @param base
     *            id of the base variable
     * @return true if the base had been marked
     */
    public boolean clearStaticDerived(PlaceId base) {
        return staticDerived.remove(base.getBase());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("BindingManager(").append(functionName).append(")[");
        boolean first = true;
        for (PlaceId id : new ArrayList<>(parent.keySet())) {
            if (!find(id).equals(id)) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(findGroup(id)).append(": ").append(stateOfRoot(id));
        }
        sb.append("]");
        return sb.toString();
    }
}
