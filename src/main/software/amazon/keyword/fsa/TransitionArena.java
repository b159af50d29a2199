package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Pool of transitions. Each transition carries its symbol byte and target state, and links to the next transition
 * of the list it belongs to. A state owns two such lists: goto transitions (the trie edges) and, in deterministic
 * automata, move transitions.
 */
@NotThreadSafe
final class TransitionArena extends IndexPool {

    private final byte[] symbol;
    private final int[] target;
    private final int[] next;

    TransitionArena(final int capacity) {
        super(capacity);
        symbol = new byte[capacity];
        target = new int[capacity];
        next = new int[capacity];
    }

    /**
     * @return the new transition, or {@link #NO_INDEX} if the pool is exhausted
     */
    int allocate(final byte transitionSymbol, final int targetState) {
        final int transition = take();
        if (transition != NO_INDEX) {
            symbol[transition] = transitionSymbol;
            target[transition] = targetState;
            next[transition] = NO_INDEX;
        }
        return transition;
    }

    /**
     * Follows a transition list looking for a symbol.
     *
     * @param head first transition of the list, or {@link #NO_INDEX}
     * @param value the symbol to look for
     * @return the target state, or {@link #NO_INDEX} if the list has no transition on the symbol
     */
    int find(final int head, final byte value) {
        for (int t = head; t != NO_INDEX; t = next[t]) {
            if (symbol[t] == value) {
                return target[t];
            }
        }
        return NO_INDEX;
    }

    /**
     * Releases every transition of a list.
     *
     * @return the number of transitions released
     */
    int releaseList(final int head) {
        int released = 0;
        int t = head;
        while (t != NO_INDEX) {
            final int following = next[t];
            give(t);
            released++;
            t = following;
        }
        return released;
    }

    byte symbol(final int transition) {
        return symbol[transition];
    }

    int target(final int transition) {
        return target[transition];
    }

    int next(final int transition) {
        return next[transition];
    }

    void setNext(final int transition, final int following) {
        next[transition] = following;
    }
}
