package analysis.lifetime.ir;

/**
 * Operand of a computed right-hand side: a place that is moved or copied, or a constant
 */
public final class Operand {

    public enum Kind {
        MOVE, COPY, CONSTANT
    }

    private final Kind kind;
    /**
     * Place read by this operand, null for constants
     */
    private final Place place;
    /**
     * Printable constant, null unless this is a constant
     */
    private final String constant;

    private Operand(Kind kind, Place place, String constant) {
        this.kind = kind;
        this.place = place;
        this.constant = constant;
    }

    public static Operand move(Place place) {
        return new Operand(Kind.MOVE, place, null);
    }

    public static Operand copy(Place place) {
        return new Operand(Kind.COPY, place, null);
    }

    public static Operand constant(String value) {
        return new Operand(Kind.CONSTANT, null, value);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Place read by this operand
     *
     * @return the place, or null if this is a constant
     */
    public Place getPlace() {
        return place;
    }

    public String getConstant() {
        return constant;
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    @Override
    public String toString() {
        switch (kind) {
        case MOVE:
            return "move " + place;
        case COPY:
            return "copy " + place;
        default:
            return "const " + constant;
        }
    }
}
