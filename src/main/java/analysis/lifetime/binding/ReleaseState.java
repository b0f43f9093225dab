package analysis.lifetime.binding;

/**
 * Release state of one binding group. Immutable; the binding manager replaces the state of a group rather than
 * mutating it, so copies of a manager can share state objects.
 */
public final class ReleaseState {

    /**
     * State of a group that has not been released (or was reinitialized)
     */
    public static final ReleaseState UNRELEASED = new ReleaseState(null);

    /**
     * Most recent release, null if not released
     */
    private final ReleaseRecord record;

    private ReleaseState(ReleaseRecord record) {
        this.record = record;
    }

    /**
     * State for a group released as described by the record
     *
     * @param record
     *            description of the release
     * @return released state
     */
    public static ReleaseState released(ReleaseRecord record) {
        assert record != null;
        return new ReleaseState(record);
    }

    public boolean isReleased() {
        return record != null;
    }

    /**
     * The most recent release
     *
     * @return release record, or null if the group is not released
     */
    public ReleaseRecord getRecord() {
        return record;
    }

    /**
     * State of the group formed by merging groups in the two given states: released if either is, with the record
     * of the more recent release
     *
     * @param a
     *            state of one group
     * @param b
     *            state of the other group
     * @return state of the merged group
     */
    public static ReleaseState merge(ReleaseState a, ReleaseState b) {
        if (!a.isReleased()) {
            return b;
        }
        if (!b.isReleased()) {
            return a;
        }
        return a.record.getSequence() >= b.record.getSequence() ? a : b;
    }

    @Override
    public int hashCode() {
        return record == null ? 0 : record.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReleaseState)) {
            return false;
        }
        ReleaseState other = (ReleaseState) obj;
        return record == null ? other.record == null : record.equals(other.record);
    }

    @Override
    public String toString() {
        return record == null ? "live" : "released(" + record + ")";
    }
}
