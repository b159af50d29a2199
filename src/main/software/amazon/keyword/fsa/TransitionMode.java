package software.amazon.keyword.fsa;

/**
 * How an automaton computes the next state for an input byte.
 */
public enum TransitionMode {
    /**
     * Follow the goto transition if there is one, otherwise fall back along failure links until a state has one.
     * Stores one transition per trie edge; may take several steps for one input byte.
     */
    GOTO_FAILURE,

    /**
     * Every (state, byte) pair has a precomputed move transition, so each input byte costs exactly one lookup.
     * Stores up to 256 move transitions per state in addition to the trie edges.
     */
    DETERMINISTIC
}
