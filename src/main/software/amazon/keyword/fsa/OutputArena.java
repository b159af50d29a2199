package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Pool of output cells. A state's output set is a list of cells, each holding one keyword id.
 */
@NotThreadSafe
final class OutputArena extends IndexPool {

    private final int[] keywordId;
    private final int[] next;

    OutputArena(final int capacity) {
        super(capacity);
        keywordId = new int[capacity];
        next = new int[capacity];
    }

    /**
     * @return the new cell, or {@link #NO_INDEX} if the pool is exhausted
     */
    int allocate(final int id) {
        final int cell = take();
        if (cell != NO_INDEX) {
            keywordId[cell] = id;
            next[cell] = NO_INDEX;
        }
        return cell;
    }

    int releaseList(final int head) {
        int released = 0;
        int cell = head;
        while (cell != NO_INDEX) {
            final int following = next[cell];
            give(cell);
            released++;
            cell = following;
        }
        return released;
    }

    int keywordId(final int cell) {
        return keywordId[cell];
    }

    int next(final int cell) {
        return next[cell];
    }

    void setNext(final int cell, final int following) {
        next[cell] = following;
    }
}
