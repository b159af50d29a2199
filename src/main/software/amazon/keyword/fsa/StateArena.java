package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Pool of automaton states. A state is an index; its attributes live in parallel arrays:
 * depth, failure state, and the heads of its goto-transition, move-transition and output-cell lists.
 */
@NotThreadSafe
final class StateArena extends IndexPool {

    private final int[] depth;
    private final int[] failure;
    private final int[] gotoHead;
    private final int[] moveHead;
    private final int[] outputHead;

    StateArena(final int capacity) {
        super(capacity);
        depth = new int[capacity];
        failure = new int[capacity];
        gotoHead = new int[capacity];
        moveHead = new int[capacity];
        outputHead = new int[capacity];
    }

    /**
     * Allocates a state with no transitions, no outputs and no failure link yet.
     *
     * @return the state, or {@link #NO_INDEX} if the pool is exhausted
     */
    int allocate(final int stateDepth) {
        final int state = take();
        if (state != NO_INDEX) {
            depth[state] = stateDepth;
            failure[state] = NO_INDEX;
            gotoHead[state] = NO_INDEX;
            moveHead[state] = NO_INDEX;
            outputHead[state] = NO_INDEX;
        }
        return state;
    }

    void release(final int state) {
        give(state);
    }

    int depth(final int state) {
        return depth[state];
    }

    int failure(final int state) {
        return failure[state];
    }

    void setFailure(final int state, final int failureState) {
        failure[state] = failureState;
    }

    int gotoHead(final int state) {
        return gotoHead[state];
    }

    void setGotoHead(final int state, final int transition) {
        gotoHead[state] = transition;
    }

    int moveHead(final int state) {
        return moveHead[state];
    }

    void setMoveHead(final int state, final int transition) {
        moveHead[state] = transition;
    }

    int outputHead(final int state) {
        return outputHead[state];
    }

    void setOutputHead(final int state, final int cell) {
        outputHead[state] = cell;
    }
}
