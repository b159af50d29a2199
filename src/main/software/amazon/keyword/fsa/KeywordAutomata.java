package software.amazon.keyword.fsa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 *  Registry of keyword automata, one per type selector, all drawing on one shared {@link Arena}.
 *  The registry is thread safe. The concurrency strategy is:
 *  Multi-thread scanning assumed, single-thread update enforced by synchronized on build/teardown.
 *  A ConcurrentHashMap holds the registrations, so an automaton published by a build is visible to every
 *  scanning thread without locking, and scans never wait for a build of another type.
 *
 *  The caller must keep scans of a type from overlapping with that type's teardown.
 */
@ThreadSafe
public class KeywordAutomata {

    private static final Logger logger = LoggerFactory.getLogger(KeywordAutomata.class);

    private static final MatchListener IGNORE_MATCHES = (keywordId, endOffset) -> { };

    private final KeywordLibrary keywordLibrary;
    private final Arena arena;
    private final TransitionMode transitionMode;
    private final boolean caseInsensitive;
    private final TrieBuilder trieBuilder;
    private final FailureLinkBuilder failureLinkBuilder;

    /**
     * Each type maps to either a built automaton or the leftovers of a build that ran out of capacity.
     */
    private final Map<Integer, Registration> registrations = new ConcurrentHashMap<>();

    protected KeywordAutomata(final KeywordLibrary keywordLibrary, final ArenaConfiguration arenaConfiguration,
                              final TransitionMode transitionMode, final boolean caseInsensitive) {
        this.keywordLibrary = keywordLibrary;
        this.arena = new Arena(arenaConfiguration);
        this.transitionMode = transitionMode;
        this.caseInsensitive = caseInsensitive;
        this.trieBuilder = new TrieBuilder(arena, caseInsensitive);
        this.failureLinkBuilder = new FailureLinkBuilder(arena, transitionMode);
    }

    /**
     * Compiles the keywords the library holds for a type into an automaton and registers it.
     *
     * "synchronized" here is to ensure that only one build or teardown touches the arena at any point in time.
     * If the build runs out of arena capacity, what it allocated stays registered as a failed build; the type
     * must be torn down before it can be built again.
     *
     * @param type the type selector
     * @return the new automaton
     * @throws AutomatonException invalid-argument if the type is unknown, has no keywords, has an empty keyword or
     *         is already registered; resource-exhaustion if a pool ran dry
     */
    public synchronized Automaton build(final int type) {
        if (registrations.containsKey(type)) {
            throw new AutomatonException(AutomatonError.TYPE_ALREADY_BUILT, "type " + type);
        }
        final List<Keyword> keywords = keywordLibrary.getKeywords(type);
        TrieBuilder.validate(type, keywords);

        final AutomatonBuild build = new AutomatonBuild(type);
        try {
            trieBuilder.insertAll(build, keywords);
            failureLinkBuilder.link(build);
        } catch (AutomatonException e) {
            registrations.put(type, new Registration(build, e.getError()));
            logger.warn("Build of type {} failed with {} after {} states, {} transitions, {} outputs: {}",
                    type, e.getError().diagnosticId(), build.states().size(), build.transitionCount(),
                    build.outputCount(), e.getMessage());
            throw e;
        }

        final Automaton automaton = new Automaton(build, arena, transitionMode, caseInsensitive);
        registrations.put(type, new Registration(build, automaton));
        logger.info("Built type {}: {} keywords, {} states, {} transitions, {} outputs ({})",
                type, keywords.size(), automaton.stateCount(), automaton.transitionCount(),
                automaton.outputCount(), transitionMode);
        if (logger.isTraceEnabled()) {
            logger.trace("{}", automaton.dump());
        }
        return automaton;
    }

    /**
     * Releases everything a type's automaton, or its failed build, holds in the arena.
     * "synchronized" here is to ensure that only one build or teardown touches the arena at any point in time.
     *
     * @param type the type selector
     * @throws AutomatonException {@link AutomatonError#NOT_BUILT} if nothing is registered for the type
     */
    public synchronized void teardown(final int type) {
        final Registration registration = registrations.remove(type);
        if (registration == null) {
            throw new AutomatonException(AutomatonError.NOT_BUILT, "type " + type);
        }
        if (registration.automaton != null) {
            registration.automaton.release();
        }
        arena.release(registration.build.states());
        logger.debug("Tore down type {} ({} states released), arena now {}",
                type, registration.build.states().size(), arena);
    }

    /**
     * Scans one buffer from the root, appending every match to {@code matches}.
     *
     * @param type the type selector
     * @param input the bytes to scan
     * @param matches receives the (keyword id, end offset) pairs in the order they are found; may be null when only
     *        the outcome is wanted
     * @return true if at least one keyword matched
     * @throws AutomatonException {@link AutomatonError#NULL_INPUT} for a null buffer, use-before-build if the type
     *         has no automaton
     */
    public boolean scan(final int type, final byte[] input, @Nullable final Matches matches) {
        return scan(type, input, matches == null ? IGNORE_MATCHES : matches);
    }

    public boolean scan(final int type, final byte[] input, @Nonnull final MatchListener listener) {
        if (input == null) {
            throw new AutomatonException(AutomatonError.NULL_INPUT, "type " + type);
        }
        return new ScanCursor(getAutomaton(type), listener).scan(input);
    }

    /**
     * Creates a cursor for incremental scanning of a type. The cursor belongs to the calling thread.
     */
    public ScanCursor newCursor(final int type, @Nonnull final MatchListener listener) {
        return new ScanCursor(getAutomaton(type), listener);
    }

    /**
     * @throws AutomatonException {@link AutomatonError#NOT_BUILT} if the type has no registration,
     *         {@link AutomatonError#BUILD_INCOMPLETE} if its last build failed
     */
    @Nonnull
    public Automaton getAutomaton(final int type) {
        final Registration registration = registrations.get(type);
        if (registration == null) {
            throw new AutomatonException(AutomatonError.NOT_BUILT, "type " + type);
        }
        if (registration.automaton == null) {
            throw new AutomatonException(AutomatonError.BUILD_INCOMPLETE,
                    "type " + type + ", build failed with " + registration.failure.diagnosticId());
        }
        return registration.automaton;
    }

    public boolean isBuilt(final int type) {
        final Registration registration = registrations.get(type);
        return registration != null && registration.automaton != null;
    }

    /**
     * @return the types with a usable automaton, ascending
     */
    public Set<Integer> builtTypes() {
        final Set<Integer> types = new TreeSet<>();
        registrations.forEach((type, registration) -> {
            if (registration.automaton != null) {
                types.add(type);
            }
        });
        return Collections.unmodifiableSet(types);
    }

    /**
     * Exposes the shared pools for capacity inspection. Reading the counters while another thread builds gives
     * a momentary value.
     */
    public Arena getArena() {
        return arena;
    }

    public TransitionMode getTransitionMode() {
        return transitionMode;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    @Override
    public String toString() {
        return "KeywordAutomata{" +
                "builtTypes=" + builtTypes() +
                ", transitionMode=" + transitionMode +
                ", caseInsensitive=" + caseInsensitive +
                ", arena=" + arena +
                '}';
    }

    private static final class Registration {
        private final AutomatonBuild build;
        private final Automaton automaton;
        private final AutomatonError failure;

        Registration(final AutomatonBuild build, final Automaton automaton) {
            this.build = build;
            this.automaton = automaton;
            this.failure = null;
        }

        Registration(final AutomatonBuild build, final AutomatonError failure) {
            this.build = build;
            this.automaton = null;
            this.failure = failure;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private KeywordLibrary keywordLibrary;
        private ArenaConfiguration arenaConfiguration = ArenaConfiguration.builder().build();

        /**
         * Goto transitions with failure fallback need far fewer transitions; deterministic automata trade arena
         * capacity for exactly one lookup per input byte.
         */
        private TransitionMode transitionMode = TransitionMode.GOTO_FAILURE;

        /**
         * When true, keywords and input are compared after folding ASCII a-z to upper case.
         */
        private boolean caseInsensitive = false;

        Builder() {}

        public Builder withKeywordLibrary(final KeywordLibrary keywordLibrary) {
            this.keywordLibrary = keywordLibrary;
            return this;
        }

        public Builder withArenaConfiguration(final ArenaConfiguration arenaConfiguration) {
            this.arenaConfiguration = arenaConfiguration;
            return this;
        }

        public Builder withTransitionMode(final TransitionMode transitionMode) {
            this.transitionMode = transitionMode;
            return this;
        }

        public Builder withCaseInsensitive(final boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
            return this;
        }

        public KeywordAutomata build() {
            if (keywordLibrary == null) {
                throw new IllegalArgumentException("A keyword library is required");
            }
            if (arenaConfiguration == null || transitionMode == null) {
                throw new IllegalArgumentException("Arena configuration and transition mode must not be null");
            }
            return new KeywordAutomata(keywordLibrary, arenaConfiguration, transitionMode, caseInsensitive);
        }
    }
}
