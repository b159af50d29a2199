package software.amazon.keyword.fsa;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Arrays;

import static software.amazon.keyword.fsa.IndexPool.NO_INDEX;

/**
 * The work-in-progress of one build: the root, the dense root transition table and the ledger of every state
 * allocated so far. Each state is recorded the moment it is allocated, and every transition or output cell is
 * linked into a recorded state the moment it is allocated, so releasing the ledger frees the whole build even
 * when it was aborted halfway.
 */
@NotThreadSafe
final class AutomatonBuild {

    private final int type;
    private final IntArrayList states = new IntArrayList();
    private final int[] rootTable = new int[256];
    private int root = NO_INDEX;
    private int transitionCount;
    private int outputCount;

    AutomatonBuild(final int type) {
        this.type = type;
        Arrays.fill(rootTable, NO_INDEX);
    }

    int type() {
        return type;
    }

    void recordState(final int state) {
        if (root == NO_INDEX) {
            root = state;
        }
        states.add(state);
    }

    void countTransition() {
        transitionCount++;
    }

    void countOutput() {
        outputCount++;
    }

    int root() {
        return root;
    }

    // entries are NO_INDEX until the failure-link builder points them back at the root
    int[] rootTable() {
        return rootTable;
    }

    IntArrayList states() {
        return states;
    }

    int transitionCount() {
        return transitionCount;
    }

    int outputCount() {
        return outputCount;
    }
}
