package software.amazon.keyword.fsa;

import it.unimi.dsi.fastutil.ints.IntList;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The fixed-capacity pools shared by every automaton of a {@link KeywordAutomata}: states, transitions, output
 * cells and the transient breadth-first queue. Everything an automaton owns is reachable from its list of states,
 * which is what {@link #release(IntList)} walks on teardown.
 *
 * Writes happen only while the owning registry holds its build lock. Scans read the slots of published automata,
 * which no build touches until those automata are torn down.
 */
@NotThreadSafe
public final class Arena {

    private final ArenaConfiguration configuration;
    private final StateArena states;
    private final TransitionArena transitions;
    private final OutputArena outputs;
    private final IndexQueue queue;

    public Arena(final ArenaConfiguration configuration) {
        this.configuration = configuration;
        this.states = new StateArena(configuration.getMaxStates());
        this.transitions = new TransitionArena(configuration.getMaxTransitions());
        this.outputs = new OutputArena(configuration.getMaxOutputs());
        this.queue = new IndexQueue(configuration.getMaxQueueElements());
    }

    StateArena states() {
        return states;
    }

    TransitionArena transitions() {
        return transitions;
    }

    OutputArena outputs() {
        return outputs;
    }

    IndexQueue queue() {
        return queue;
    }

    /**
     * Releases the given states together with all their goto transitions, move transitions and output cells.
     */
    void release(final IntList ownedStates) {
        for (int i = 0; i < ownedStates.size(); i++) {
            final int state = ownedStates.getInt(i);
            transitions.releaseList(states.gotoHead(state));
            transitions.releaseList(states.moveHead(state));
            outputs.releaseList(states.outputHead(state));
            states.release(state);
        }
    }

    public ArenaConfiguration getConfiguration() {
        return configuration;
    }

    public int usedStates() {
        return states.used();
    }

    public int usedTransitions() {
        return transitions.used();
    }

    public int usedOutputs() {
        return outputs.used();
    }

    public int availableStates() {
        return states.available();
    }

    public int availableTransitions() {
        return transitions.available();
    }

    public int availableOutputs() {
        return outputs.available();
    }

    /**
     * @return true if no state, transition or output cell is allocated
     */
    public boolean isEmpty() {
        return states.used() == 0 && transitions.used() == 0 && outputs.used() == 0;
    }

    @Override
    public String toString() {
        return "Arena{" +
                "states=" + states.used() + "/" + states.capacity() +
                ", transitions=" + transitions.used() + "/" + transitions.capacity() +
                ", outputs=" + outputs.used() + "/" + outputs.capacity() +
                ", queue=" + queue.capacity() +
                '}';
    }
}
