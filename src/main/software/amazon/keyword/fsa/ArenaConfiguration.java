package software.amazon.keyword.fsa;

/**
 * Capacities of the pools an {@link Arena} preallocates. Pools never grow: a build that needs more than the
 * configured capacity fails with the matching resource-exhaustion error.
 */
public class ArenaConfiguration {

    // largest state pool an arena will preallocate
    static final int MAX_STATE_CAPACITY = 1 << 23;

    private final int maxStates;
    private final int maxTransitions;
    private final int maxOutputs;
    private final int maxQueueElements;

    private ArenaConfiguration(int maxStates, int maxTransitions, int maxOutputs, int maxQueueElements) {
        this.maxStates = maxStates;
        this.maxTransitions = maxTransitions;
        this.maxOutputs = maxOutputs;
        this.maxQueueElements = maxQueueElements;
    }

    public int getMaxStates() {
        return maxStates;
    }

    public int getMaxTransitions() {
        return maxTransitions;
    }

    public int getMaxOutputs() {
        return maxOutputs;
    }

    public int getMaxQueueElements() {
        return maxQueueElements;
    }

    @Override
    public String toString() {
        return "ArenaConfiguration{" +
                "maxStates=" + maxStates +
                ", maxTransitions=" + maxTransitions +
                ", maxOutputs=" + maxOutputs +
                ", maxQueueElements=" + maxQueueElements +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        /**
         * Every automaton needs one state per distinct keyword prefix plus its root.
         */
        private int maxStates = 1 << 16;

        /**
         * One goto transition per non-root state. Deterministic automata add up to 255 move transitions per state,
         * so they need a much larger pool.
         */
        private int maxTransitions = 1 << 18;

        /**
         * One output cell per keyword, plus one per keyword inherited along a failure link.
         */
        private int maxOutputs = 1 << 16;

        /**
         * The breadth-first failure-link computation holds at most one tree level (plus one state) in its queue.
         */
        private int maxQueueElements = 1 << 16;

        Builder() {}

        public Builder withMaxStates(int maxStates) {
            this.maxStates = maxStates;
            return this;
        }

        public Builder withMaxTransitions(int maxTransitions) {
            this.maxTransitions = maxTransitions;
            return this;
        }

        public Builder withMaxOutputs(int maxOutputs) {
            this.maxOutputs = maxOutputs;
            return this;
        }

        public Builder withMaxQueueElements(int maxQueueElements) {
            this.maxQueueElements = maxQueueElements;
            return this;
        }

        public ArenaConfiguration build() {
            if (maxStates <= 0 || maxStates > MAX_STATE_CAPACITY) {
                throw new IllegalArgumentException("maxStates must be in (0, " + MAX_STATE_CAPACITY + "]");
            }
            if (maxTransitions <= 0) {
                throw new IllegalArgumentException("maxTransitions must be positive");
            }
            if (maxOutputs <= 0) {
                throw new IllegalArgumentException("maxOutputs must be positive");
            }
            if (maxQueueElements <= 0) {
                throw new IllegalArgumentException("maxQueueElements must be positive");
            }
            return new ArenaConfiguration(maxStates, maxTransitions, maxOutputs, maxQueueElements);
        }
    }
}
