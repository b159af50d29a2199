package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;

import static software.amazon.keyword.fsa.IndexPool.NO_INDEX;

/**
 * Completes a trie into an automaton. The trie is traversed breadth first, starting from the root's children, whose
 * failure state is the root. For every state s taken from the queue and every goto transition s -(b)-> c:
 * <pre>
 *   f = failure(s)
 *   while goto(f, b) fails: f = failure(f)     // the root never fails
 *   failure(c) = goto(f, b)
 *   output(c) = output(c) + output(failure(c))
 *   enqueue c
 * </pre>
 * Since failure(c) is shallower than c, its output list is already complete when it is copied.
 *
 * For {@link TransitionMode#DETERMINISTIC} automata the move function is also built while s is dequeued:
 * move(s, b) = goto(s, b) if defined, otherwise move(failure(s), b). Moves back to the root are not stored.
 */
@NotThreadSafe
final class FailureLinkBuilder {

    private static final int ALPHABET_SIZE = 256;

    private final StateArena states;
    private final TransitionArena transitions;
    private final OutputArena outputs;
    private final IndexQueue queue;
    private final TransitionMode mode;

    FailureLinkBuilder(final Arena arena, final TransitionMode mode) {
        this.states = arena.states();
        this.transitions = arena.transitions();
        this.outputs = arena.outputs();
        this.queue = arena.queue();
        this.mode = mode;
    }

    void link(final AutomatonBuild build) {
        final int root = build.root();
        final int[] rootTable = build.rootTable();
        states.setFailure(root, root);

        try {
            // depth 1: fail to the root; bytes that start no keyword loop on the root
            for (int b = 0; b < ALPHABET_SIZE; b++) {
                final int child = rootTable[b];
                if (child == NO_INDEX) {
                    rootTable[b] = root;
                } else {
                    states.setFailure(child, root);
                    enqueue(build, child);
                }
            }

            while (!queue.isEmpty()) {
                final int state = queue.poll();
                for (int t = states.gotoHead(state); t != NO_INDEX; t = transitions.next(t)) {
                    final byte symbol = transitions.symbol(t);
                    final int child = transitions.target(t);

                    int fallback = states.failure(state);
                    int target;
                    while ((target = gotoTarget(root, rootTable, fallback, symbol)) == NO_INDEX) {
                        fallback = states.failure(fallback);
                    }
                    states.setFailure(child, target);
                    inheritOutputs(build, child, target);
                    enqueue(build, child);
                }
                if (mode == TransitionMode.DETERMINISTIC) {
                    buildMoves(build, state);
                }
            }
        } finally {
            queue.reset();
        }
    }

    private int gotoTarget(final int root, final int[] rootTable, final int state, final byte symbol) {
        if (state == root) {
            return rootTable[symbol & 0xFF];
        }
        return transitions.find(states.gotoHead(state), symbol);
    }

    private void enqueue(final AutomatonBuild build, final int state) {
        if (!queue.offer(state)) {
            throw new AutomatonException(AutomatonError.QUEUE_ARENA_EXHAUSTED,
                    "type " + build.type() + ", " + queue.capacity() + " queue elements in use");
        }
    }

    private void inheritOutputs(final AutomatonBuild build, final int state, final int failureState) {
        final int inherited = states.outputHead(failureState);
        if (inherited == NO_INDEX) {
            return;
        }

        int tail = states.outputHead(state);
        if (tail != NO_INDEX) {
            while (outputs.next(tail) != NO_INDEX) {
                tail = outputs.next(tail);
            }
        }
        for (int cell = inherited; cell != NO_INDEX; cell = outputs.next(cell)) {
            final int copy = outputs.allocate(outputs.keywordId(cell));
            if (copy == NO_INDEX) {
                throw new AutomatonException(AutomatonError.FAILURE_OUTPUT_EXHAUSTED,
                        "type " + build.type() + ", keyword id " + outputs.keywordId(cell));
            }
            build.countOutput();
            if (tail == NO_INDEX) {
                states.setOutputHead(state, copy);
            } else {
                outputs.setNext(tail, copy);
            }
            tail = copy;
        }
    }

    private void buildMoves(final AutomatonBuild build, final int state) {
        final int root = build.root();
        final int[] rootTable = build.rootTable();
        final int failure = states.failure(state);

        // symbols ascend, so each move list is sorted
        int tail = NO_INDEX;
        for (int b = 0; b < ALPHABET_SIZE; b++) {
            final byte symbol = (byte) b;
            int target = transitions.find(states.gotoHead(state), symbol);
            if (target == NO_INDEX) {
                target = move(root, rootTable, failure, symbol);
            }
            if (target == root) {
                continue;
            }

            final int transition = transitions.allocate(symbol, target);
            if (transition == NO_INDEX) {
                throw new AutomatonException(AutomatonError.TRANSITION_ARENA_EXHAUSTED,
                        "type " + build.type() + ", building move transitions, "
                                + build.transitionCount() + " transitions allocated");
            }
            build.countTransition();
            if (tail == NO_INDEX) {
                states.setMoveHead(state, transition);
            } else {
                transitions.setNext(tail, transition);
            }
            tail = transition;
        }
    }

    private int move(final int root, final int[] rootTable, final int state, final byte symbol) {
        if (state == root) {
            return rootTable[symbol & 0xFF];
        }
        final int target = transitions.find(states.moveHead(state), symbol);
        return target == NO_INDEX ? root : target;
    }
}
