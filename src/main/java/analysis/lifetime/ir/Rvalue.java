package analysis.lifetime.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Right-hand side of an assignment
 */
public final class Rvalue {

    public enum Kind {
        /**
         * Ownership transfer from a place
         */
        MOVE,
        /**
         * Bitwise copy of a place
         */
        COPY,
        /**
         * Address of (or reference to) a place
         */
        BORROW,
        /**
         * Anything else: constants, arithmetic, aggregates, casts
         */
        OTHER
    }

    private final Kind kind;
    /**
     * Source place for {@link Kind#MOVE}, {@link Kind#COPY} and {@link Kind#BORROW}
     */
    private final Place source;
    /**
     * Operands for {@link Kind#OTHER}
     */
    private final List<Operand> operands;
    /**
     * Printable operator for {@link Kind#OTHER}, e.g. "Add" or "Aggregate"
     */
    private final String operator;

    private Rvalue(Kind kind, Place source, List<Operand> operands, String operator) {
        this.kind = kind;
        this.source = source;
        this.operands = operands;
        this.operator = operator;
    }

    public static Rvalue move(Place source) {
        return new Rvalue(Kind.MOVE, source, Collections.<Operand> emptyList(), null);
    }

    public static Rvalue copy(Place source) {
        return new Rvalue(Kind.COPY, source, Collections.<Operand> emptyList(), null);
    }

    public static Rvalue borrow(Place source) {
        return new Rvalue(Kind.BORROW, source, Collections.<Operand> emptyList(), null);
    }

    /**
     * Computed value
     *
     * @param operator
     *            printable name of the computation
     * @param operands
     *            operands read by the computation, may be empty
     * @return new right-hand side
     */
    public static Rvalue other(String operator, List<Operand> operands) {
        return new Rvalue(Kind.OTHER, null, Collections.unmodifiableList(new ArrayList<>(operands)), operator);
    }

    public Kind getKind() {
        return kind;
    }

    public Place getSource() {
        return source;
    }

    public List<Operand> getOperands() {
        return operands;
    }

    public String getOperator() {
        return operator;
    }

    /**
     * All places read when evaluating this right-hand side, in order
     *
     * @return list of places read
     */
    public List<Place> getReadPlaces() {
        if (source != null) {
            return Collections.singletonList(source);
        }
        List<Place> read = new ArrayList<>(operands.size());
        for (Operand o : operands) {
            if (!o.isConstant()) {
                read.add(o.getPlace());
            }
        }
        return read;
    }

    @Override
    public String toString() {
        switch (kind) {
        case MOVE:
            return "move " + source;
        case COPY:
            return "copy " + source;
        case BORROW:
            return "&" + source;
        default:
            return operator + operands;
        }
    }
}
