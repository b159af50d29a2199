package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Fixed-capacity FIFO of state indices used by the breadth-first failure-link computation. Backed by a ring buffer
 * so that releasing the whole queue is just {@link #reset()}.
 */
@NotThreadSafe
final class IndexQueue {

    private final int[] elements;
    private int head;
    private int size;

    IndexQueue(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        elements = new int[capacity];
    }

    /**
     * Adds a state at the tail.
     *
     * @return false if the queue is full, in which case nothing was added
     */
    boolean offer(final int state) {
        if (size == elements.length) {
            return false;
        }
        elements[(head + size) % elements.length] = state;
        size++;
        return true;
    }

    /**
     * Removes the state at the head. The queue must not be empty.
     */
    int poll() {
        if (size == 0) {
            throw new IllegalStateException("queue is empty");
        }
        final int state = elements[head];
        head = (head + 1) % elements.length;
        size--;
        return state;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    int capacity() {
        return elements.length;
    }

    void reset() {
        head = 0;
        size = 0;
    }
}
