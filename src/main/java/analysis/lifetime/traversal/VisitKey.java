package analysis.lifetime.traversal;

/**
 * Identity of a visit: a block together with the path context it was reached with
 */
public final class VisitKey {

    private final int block;
    private final PathContext context;

    public VisitKey(int block, PathContext context) {
        this.block = block;
        this.context = context;
    }

    public int getBlock() {
        return block;
    }

    public PathContext getContext() {
        return context;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + block;
        result = prime * result + context.hashCode();
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
        VisitKey other = (VisitKey) obj;
        return block == other.block && context.equals(other.context);
    }

    @Override
    public String toString() {
        return "bb" + block + context;
    }
}
