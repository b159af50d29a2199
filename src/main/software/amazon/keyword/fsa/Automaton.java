package software.amazon.keyword.fsa;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;

import static software.amazon.keyword.fsa.IndexPool.NO_INDEX;

/**
 * The compiled keyword set of one type. An automaton is a view onto the states it owns in a shared {@link Arena};
 * it never changes after the build that produced it, so any number of {@link ScanCursor}s may walk it concurrently.
 *
 * After its type is torn down the handle is dead: its states may already belong to another automaton, and every
 * operation fails with {@link AutomatonError#NOT_BUILT}. Tearing a type down while it is being scanned is up to the
 * caller to prevent.
 */
@ThreadSafe
public final class Automaton {

    private final int type;
    private final int root;
    private final TransitionMode mode;
    private final boolean caseInsensitive;
    private final int[] rootTable;
    private final int[] states;
    private final int[] sortedStates;
    private final int transitionCount;
    private final int outputCount;

    private final StateArena stateArena;
    private final TransitionArena transitionArena;
    private final OutputArena outputArena;

    private volatile boolean released;

    Automaton(final AutomatonBuild build, final Arena arena, final TransitionMode mode,
              final boolean caseInsensitive) {
        this.type = build.type();
        this.root = build.root();
        this.mode = mode;
        this.caseInsensitive = caseInsensitive;
        this.rootTable = build.rootTable().clone();
        this.states = build.states().toIntArray();
        this.sortedStates = states.clone();
        Arrays.sort(sortedStates);
        this.transitionCount = build.transitionCount();
        this.outputCount = build.outputCount();
        this.stateArena = arena.states();
        this.transitionArena = arena.transitions();
        this.outputArena = arena.outputs();
    }

    public int getType() {
        return type;
    }

    public TransitionMode getTransitionMode() {
        return mode;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    public int root() {
        ensureLive();
        return root;
    }

    public int stateCount() {
        return states.length;
    }

    /**
     * @return goto transitions plus, in deterministic automata, move transitions
     */
    public int transitionCount() {
        return transitionCount;
    }

    /**
     * @return output cells, counting the ones inherited along failure links
     */
    public int outputCount() {
        return outputCount;
    }

    /**
     * @return the owned states in the order they were allocated; the root comes first
     */
    public int[] states() {
        ensureLive();
        return states.clone();
    }

    public int depth(final int state) {
        checkState(state);
        return stateArena.depth(state);
    }

    /**
     * @return the failure state; the root's failure state is the root
     */
    public int failure(final int state) {
        checkState(state);
        return stateArena.failure(state);
    }

    /**
     * Returns the ids of the keywords recognized on entering a state: the keywords ending exactly there, followed by
     * the ones inherited from its failure state.
     */
    public int[] outputs(final int state) {
        checkState(state);
        final IntArrayList ids = new IntArrayList();
        for (int cell = stateArena.outputHead(state); cell != NO_INDEX; cell = outputArena.next(cell)) {
            ids.add(outputArena.keywordId(cell));
        }
        return ids.toIntArray();
    }

    /**
     * The total transition function. Case-insensitive automata fold the symbol first.
     *
     * @param state a state of this automaton
     * @param symbol the input byte
     * @return the state entered on reading the symbol
     */
    public int next(final int state, final byte symbol) {
        checkState(state);
        return step(state, symbol);
    }

    int step(int state, byte symbol) {
        if (caseInsensitive) {
            symbol = CaseFolding.fold(symbol);
        }
        if (mode == TransitionMode.DETERMINISTIC) {
            if (state == root) {
                return rootTable[symbol & 0xFF];
            }
            final int target = transitionArena.find(stateArena.moveHead(state), symbol);
            return target == NO_INDEX ? root : target;
        }

        while (state != root) {
            final int target = transitionArena.find(stateArena.gotoHead(state), symbol);
            if (target != NO_INDEX) {
                return target;
            }
            state = stateArena.failure(state);
        }
        return rootTable[symbol & 0xFF];
    }

    /**
     * Sends one event per keyword id in the state's output list.
     *
     * @return the number of events sent
     */
    int report(final int state, final long endOffset, final MatchListener listener) {
        int reported = 0;
        for (int cell = stateArena.outputHead(state); cell != NO_INDEX; cell = outputArena.next(cell)) {
            listener.onMatch(outputArena.keywordId(cell), endOffset);
            reported++;
        }
        return reported;
    }

    void ensureLive() {
        if (released) {
            throw new AutomatonException(AutomatonError.NOT_BUILT, "type " + type + " was torn down");
        }
    }

    private void checkState(final int state) {
        ensureLive();
        if (Arrays.binarySearch(sortedStates, state) < 0) {
            throw new IllegalArgumentException("State " + state + " does not belong to the automaton of type " + type);
        }
    }

    void release() {
        released = true;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Renders every state with its depth, failure state, outputs, goto transitions and, for deterministic
     * automata, move transitions. Meant for debugging small automata.
     */
    public String dump() {
        ensureLive();
        final StringBuilder sb = new StringBuilder();
        sb.append("Automaton type=").append(type)
                .append(" mode=").append(mode)
                .append(" states=").append(states.length)
                .append(" transitions=").append(transitionCount)
                .append(" outputs=").append(outputCount)
                .append('\n');
        for (int state : states) {
            sb.append("  S").append(state)
                    .append(" depth=").append(stateArena.depth(state))
                    .append(" fail=S").append(stateArena.failure(state))
                    .append(" out=").append(Arrays.toString(outputs(state)));
            if (state == root) {
                appendRootTable(sb);
            } else {
                appendTransitions(sb, " goto", stateArena.gotoHead(state));
                if (mode == TransitionMode.DETERMINISTIC) {
                    appendTransitions(sb, " move", stateArena.moveHead(state));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void appendRootTable(final StringBuilder sb) {
        sb.append(" goto={");
        boolean first = true;
        for (int b = 0; b < rootTable.length; b++) {
            if (rootTable[b] != root) {
                if (!first) {
                    sb.append(", ");
                }
                appendSymbol(sb, (byte) b).append("->S").append(rootTable[b]);
                first = false;
            }
        }
        sb.append('}');
    }

    private void appendTransitions(final StringBuilder sb, final String label, final int head) {
        sb.append(label).append("={");
        for (int t = head; t != NO_INDEX; t = transitionArena.next(t)) {
            if (t != head) {
                sb.append(", ");
            }
            appendSymbol(sb, transitionArena.symbol(t)).append("->S").append(transitionArena.target(t));
        }
        sb.append('}');
    }

    private static StringBuilder appendSymbol(final StringBuilder sb, final byte symbol) {
        final int value = symbol & 0xFF;
        if (value > 0x20 && value < 0x7F) {
            return sb.append((char) value);
        }
        return sb.append(String.format("\\x%02x", value));
    }

    @Override
    public String toString() {
        return "Automaton{" +
                "type=" + type +
                ", mode=" + mode +
                ", caseInsensitive=" + caseInsensitive +
                ", states=" + states.length +
                ", transitions=" + transitionCount +
                ", outputs=" + outputCount +
                ", released=" + released +
                '}';
    }
}
