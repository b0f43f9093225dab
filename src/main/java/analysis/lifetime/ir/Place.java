package analysis.lifetime.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Syntactic memory location: a base variable followed by a (possibly empty) list of projections
 */
public final class Place {

    private final String base;
    private final List<Projection> projections;
    private final int memoizedHashCode;

    /**
     * Create a place
     *
     * @param base
     *            name of the base variable
     * @param projections
     *            projections applied to the base, in order
     */
    public Place(String base, List<Projection> projections) {
        if (base == null) {
            throw new IllegalArgumentException("Null base variable");
        }
        this.base = base;
        this.projections = Collections.unmodifiableList(new ArrayList<>(projections));
        this.memoizedHashCode = 31 * base.hashCode() + this.projections.hashCode();
    }

    /**
     * Place for the variable itself, with no projections
     *
     * @param base
     *            variable name
     * @return new place
     */
    public static Place of(String base) {
        return new Place(base, Collections.<Projection> emptyList());
    }

    public static Place of(String base, Projection... projections) {
        return new Place(base, Arrays.asList(projections));
    }

    /**
     * Place for <code>*base</code>
     *
     * @param base
     *            variable name
     * @return new place
     */
    public static Place deref(String base) {
        return of(base, Projection.deref());
    }

    /**
     * Create the place obtained by applying one more projection to this place
     *
     * @param p
     *            projection to add
     * @return new place
     */
    public Place project(Projection p) {
        List<Projection> ps = new ArrayList<>(projections);
        ps.add(p);
        return new Place(base, ps);
    }

    public String getBase() {
        return base;
    }

    public List<Projection> getProjections() {
        return projections;
    }

    /**
     * Whether this place is a bare variable
     *
     * @return true if there are no projections
     */
    public boolean isBare() {
        return projections.isEmpty();
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Place)) {
            return false;
        }
        Place other = (Place) obj;
        return base.equals(other.base) && projections.equals(other.projections);
    }

    @Override
    public String toString() {
        return base + projections;
    }
}
