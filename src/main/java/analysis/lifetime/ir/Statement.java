package analysis.lifetime.ir;

/**
 * Assignment of a right-hand side to a place
 */
public final class Statement {

    private final Place target;
    private final Rvalue rvalue;
    private final String span;

    /**
     * Create an assignment
     *
     * @param target
     *            place written
     * @param rvalue
     *            value assigned
     * @param span
     *            source span, may be null
     */
    public Statement(Place target, Rvalue rvalue, String span) {
        this.target = target;
        this.rvalue = rvalue;
        this.span = span;
    }

    public Statement(Place target, Rvalue rvalue) {
        this(target, rvalue, null);
    }

    public Place getTarget() {
        return target;
    }

    public Rvalue getRvalue() {
        return rvalue;
    }

    public String getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return target + " = " + rvalue;
    }
}
