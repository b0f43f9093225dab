package analysis.lifetime.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line sequence of statements ended by a terminator
 */
public final class BasicBlock {

    private final int id;
    private final List<Statement> statements;
    private final Terminator terminator;

    public BasicBlock(int id, List<Statement> statements, Terminator terminator) {
        if (terminator == null) {
            throw new IllegalArgumentException("bb" + id + " has no terminator");
        }
        this.id = id;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.terminator = terminator;
    }

    public int getId() {
        return id;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    /**
     * Location of the statement with the given index
     *
     * @param index
     *            statement index, or {@link SourceLocation#TERMINATOR}
     * @return location including the source span if known
     */
    public SourceLocation getLocation(int index) {
        String span = index == SourceLocation.TERMINATOR ? terminator.getSpan() : statements.get(index).getSpan();
        return new SourceLocation(id, index, span);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BasicBlock)) {
            return false;
        }
        return id == ((BasicBlock) obj).id;
    }

    @Override
    public String toString() {
        return "bb" + id;
    }
}
