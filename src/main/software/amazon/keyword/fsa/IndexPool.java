package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Hands out indices in [0, capacity) from a preallocated pool. Released indices are kept on a free list threaded
 * through {@link #freeNext} and are handed out again before any never-used index, so capacity freed by one
 * automaton's teardown is available to the next build of any type.
 *
 * Subclasses keep their per-index attributes in parallel arrays of the same capacity.
 */
@NotThreadSafe
abstract class IndexPool {

    static final int NO_INDEX = -1;

    private final int capacity;
    private final int[] freeNext;
    private int freeHead = NO_INDEX;

    // indices below the high-water mark have been handed out at least once
    private int highWater;
    private int used;

    IndexPool(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.freeNext = new int[capacity];
    }

    /**
     * Takes an index from the pool.
     *
     * @return the index, or {@link #NO_INDEX} if the pool is exhausted
     */
    final int take() {
        final int index;
        if (freeHead != NO_INDEX) {
            index = freeHead;
            freeHead = freeNext[index];
        } else if (highWater < capacity) {
            index = highWater++;
        } else {
            return NO_INDEX;
        }
        used++;
        return index;
    }

    /**
     * Returns an index to the pool. The caller guarantees the index is currently taken.
     */
    final void give(final int index) {
        freeNext[index] = freeHead;
        freeHead = index;
        used--;
    }

    final int capacity() {
        return capacity;
    }

    final int used() {
        return used;
    }

    final int available() {
        return capacity - used;
    }
}
