package software.amazon.keyword.fsa;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

import static software.amazon.keyword.fsa.IndexPool.NO_INDEX;

/**
 * Enters keywords into the goto trie of a build. Each keyword is run through the partially built trie until a byte
 * has no goto transition; the remainder of the keyword is then added as one new state and transition per byte, and
 * the keyword's id is recorded in the output list of the state where its path ends.
 */
@NotThreadSafe
final class TrieBuilder {

    private final StateArena states;
    private final TransitionArena transitions;
    private final OutputArena outputs;
    private final boolean caseInsensitive;

    TrieBuilder(final Arena arena, final boolean caseInsensitive) {
        this.states = arena.states();
        this.transitions = arena.transitions();
        this.outputs = arena.outputs();
        this.caseInsensitive = caseInsensitive;
    }

    /**
     * Checks a type's keyword set before anything is allocated for it.
     *
     * @param type the type selector, for diagnostics
     * @param keywords the keywords the library returned, possibly null
     * @throws AutomatonException with an invalid-argument error if the set is unknown, empty or has an empty keyword
     */
    static void validate(final int type, final List<Keyword> keywords) {
        if (keywords == null) {
            throw new AutomatonException(AutomatonError.UNKNOWN_TYPE, "type " + type);
        }
        if (keywords.isEmpty()) {
            throw new AutomatonException(AutomatonError.EMPTY_KEYWORD_SET, "type " + type);
        }
        for (Keyword keyword : keywords) {
            if (keyword.length() == 0) {
                throw new AutomatonException(AutomatonError.EMPTY_KEYWORD,
                        "type " + type + ", keyword id " + keyword.getId());
            }
        }
    }

    /**
     * Allocates the root and enters every keyword.
     */
    void insertAll(final AutomatonBuild build, final List<Keyword> keywords) {
        newState(build, 0);
        for (Keyword keyword : keywords) {
            insert(build, keyword);
        }
    }

    private void insert(final AutomatonBuild build, final Keyword keyword) {
        int state = build.root();
        for (int i = 0; i < keyword.length(); i++) {
            final byte symbol = caseInsensitive ? CaseFolding.fold(keyword.byteAt(i)) : keyword.byteAt(i);
            int next = gotoTarget(build, state, symbol);
            if (next == NO_INDEX) {
                next = newState(build, states.depth(state) + 1);
                addGoto(build, state, symbol, next);
            }
            state = next;
        }
        addOutput(build, state, keyword.getId());
    }

    private int gotoTarget(final AutomatonBuild build, final int state, final byte symbol) {
        if (state == build.root()) {
            return build.rootTable()[symbol & 0xFF];
        }
        return transitions.find(states.gotoHead(state), symbol);
    }

    private int newState(final AutomatonBuild build, final int depth) {
        final int state = states.allocate(depth);
        if (state == NO_INDEX) {
            throw new AutomatonException(AutomatonError.STATE_ARENA_EXHAUSTED,
                    "type " + build.type() + ", " + build.states().size() + " states allocated");
        }
        build.recordState(state);
        return state;
    }

    private void addGoto(final AutomatonBuild build, final int from, final byte symbol, final int to) {
        final int transition = transitions.allocate(symbol, to);
        if (transition == NO_INDEX) {
            throw new AutomatonException(AutomatonError.TRANSITION_ARENA_EXHAUSTED,
                    "type " + build.type() + ", " + build.transitionCount() + " transitions allocated");
        }
        build.countTransition();

        // append, so goto lists keep keyword insertion order
        final int head = states.gotoHead(from);
        if (head == NO_INDEX) {
            states.setGotoHead(from, transition);
        } else {
            int tail = head;
            while (transitions.next(tail) != NO_INDEX) {
                tail = transitions.next(tail);
            }
            transitions.setNext(tail, transition);
        }
        if (from == build.root()) {
            build.rootTable()[symbol & 0xFF] = to;
        }
    }

    private void addOutput(final AutomatonBuild build, final int state, final int keywordId) {
        final int cell = outputs.allocate(keywordId);
        if (cell == NO_INDEX) {
            throw new AutomatonException(AutomatonError.KEYWORD_OUTPUT_EXHAUSTED,
                    "type " + build.type() + ", keyword id " + keywordId);
        }
        build.countOutput();

        final int head = states.outputHead(state);
        if (head == NO_INDEX) {
            states.setOutputHead(state, cell);
        } else {
            int tail = head;
            while (outputs.next(tail) != NO_INDEX) {
                tail = outputs.next(tail);
            }
            outputs.setNext(tail, cell);
        }
    }
}
