package analysis.lifetime.traversal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The most recently visited blocks (oldest first) on the path that led to a visit, truncated to a fixed length.
 * Immutable.
 */
public final class PathContext {

    /**
     * Context of the entry block
     */
    public static final PathContext EMPTY = new PathContext(Collections.<Integer> emptyList());

    private final List<Integer> blocks;
    private final int memoizedHashCode;

    private PathContext(List<Integer> blocks) {
        this.blocks = blocks;
        this.memoizedHashCode = blocks.hashCode();
    }

    /**
     * Context for a successor of <code>block</code> reached with this context: <code>block</code> is appended and
     * only the last <code>k</code> entries are kept
     *
     * @param block
     *            id of the block just visited
     * @param k
     *            maximum length of a context
     * @return extended context
     */
    public PathContext extend(int block, int k) {
        if (k == 0) {
            return EMPTY;
        }
        List<Integer> l = new ArrayList<>(Math.min(k, blocks.size() + 1));
        int start = Math.max(0, blocks.size() + 1 - k);
        for (int i = start; i < blocks.size(); i++) {
            l.add(blocks.get(i));
        }
        l.add(block);
        return new PathContext(Collections.unmodifiableList(l));
    }

    /**
     * Block ids in this context, oldest first
     *
     * @return block ids
     */
    public List<Integer> getBlocks() {
        return blocks;
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Most recent predecessor
     *
     * @return id of the last block in the context, or null if the context is empty
     */
    public Integer getLast() {
        return blocks.isEmpty() ? null : blocks.get(blocks.size() - 1);
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
        if (!(obj instanceof PathContext)) {
            return false;
        }
        PathContext other = (PathContext) obj;
        return memoizedHashCode == other.memoizedHashCode && blocks.equals(other.blocks);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        Iterator<Integer> iter = blocks.iterator();
        while (iter.hasNext()) {
            sb.append("bb").append(iter.next());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        sb.append("]");
        return sb.toString();
    }
}
