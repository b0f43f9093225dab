package analysis.lifetime.ir;

/**
 * Position of a statement or terminator within a function body
 */
public final class SourceLocation {

    /**
     * Statement index used for the terminator of a block
     */
    public static final int TERMINATOR = -1;

    private final int block;
    private final int index;
    /**
     * Source span supplied by the front end (e.g. "src/lib.rs:10:5: 10:20"), may be null
     */
    private final String span;

    /**
     * Create a location
     *
     * @param block
     *            block id
     * @param index
     *            index of the statement in the block, or {@link #TERMINATOR}
     * @param span
     *            source span, null if unknown
     */
    public SourceLocation(int block, int index, String span) {
        this.block = block;
        this.index = index;
        this.span = span;
    }

    public int getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    public boolean isTerminator() {
        return index == TERMINATOR;
    }

    public String getSpan() {
        return span;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + block;
        result = prime * result + index;
        result = prime * result + ((span == null) ? 0 : span.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        if (block != other.block || index != other.index) {
            return false;
        }
        if (span == null) {
            return other.span == null;
        }
        return span.equals(other.span);
    }

    @Override
    public String toString() {
        String pos = "bb" + block + (isTerminator() ? "[term]" : "[" + index + "]");
        return span == null ? pos : pos + " (" + span + ")";
    }
}
