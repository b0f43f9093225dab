package analysis.lifetime.ir;

/**
 * One step of a place: a field access, a downcast to an enum variant or a dereference
 */
public final class Projection {

    public enum Kind {
        FIELD, DOWNCAST, DEREF
    }

    /**
     * The only dereference projection
     */
    private static final Projection DEREF = new Projection(Kind.DEREF, -1);

    private final Kind kind;
    /**
     * Field index or variant index, -1 for dereference
     */
    private final int index;

    private Projection(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    /**
     * Access of the field with the given index
     *
     * @param index
     *            field index, must be non-negative
     * @return field projection
     */
    public static Projection field(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative field index " + index);
        }
        return new Projection(Kind.FIELD, index);
    }

    /**
     * Downcast of an enum value to the variant with the given index
     *
     * @param variant
     *            variant index, must be non-negative
     * @return downcast projection
     */
    public static Projection downcast(int variant) {
        if (variant < 0) {
            throw new IllegalArgumentException("Negative variant index " + variant);
        }
        return new Projection(Kind.DOWNCAST, variant);
    }

    public static Projection deref() {
        return DEREF;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public boolean isDeref() {
        return kind == Kind.DEREF;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Projection)) {
            return false;
        }
        Projection other = (Projection) obj;
        return kind == other.kind && index == other.index;
    }

    @Override
    public String toString() {
        switch (kind) {
        case FIELD:
            return "." + index;
        case DOWNCAST:
            return " as " + index;
        default:
            return "*";
        }
    }
}
