package software.amazon.keyword.fsa;

import static software.amazon.keyword.fsa.ErrorCategory.INVALID_ARGUMENT;
import static software.amazon.keyword.fsa.ErrorCategory.RESOURCE_EXHAUSTION;
import static software.amazon.keyword.fsa.ErrorCategory.USE_BEFORE_BUILD;

/**
 * Diagnostic identifiers for everything that can go wrong while building, scanning or tearing down an automaton.
 * Each identifier has a stable numeric code, a category, a description of what went wrong and what to do about it.
 *
 * The resource-exhaustion identifiers name the pool and the build step that ran dry.
 */
public enum AutomatonError {
    NULL_INPUT(0, INVALID_ARGUMENT,
            "Input buffer is null",
            "Pass a non-null input"),
    UNKNOWN_TYPE(1, INVALID_ARGUMENT,
            "The keyword library has no keywords for the type",
            "Use a type selector the keyword library defines"),
    EMPTY_KEYWORD_SET(2, INVALID_ARGUMENT,
            "The keyword set for the type is empty",
            "Give the type at least one keyword"),
    EMPTY_KEYWORD(3, INVALID_ARGUMENT,
            "A keyword has no bytes",
            "Remove the empty keyword from the library"),
    TYPE_ALREADY_BUILT(4, INVALID_ARGUMENT,
            "An automaton, or a failed build, is already registered for the type",
            "Tear the type down before building it again"),

    KEYWORD_OUTPUT_EXHAUSTED(12, RESOURCE_EXHAUSTION,
            "Output arena exhausted while entering a keyword",
            "Use a smaller keyword set or raise maxOutputs"),
    FAILURE_OUTPUT_EXHAUSTED(13, RESOURCE_EXHAUSTION,
            "Output arena exhausted while propagating outputs along failure links",
            "Use a smaller keyword set or raise maxOutputs"),
    STATE_ARENA_EXHAUSTED(14, RESOURCE_EXHAUSTION,
            "State arena exhausted",
            "Use a smaller keyword set or raise maxStates"),
    TRANSITION_ARENA_EXHAUSTED(15, RESOURCE_EXHAUSTION,
            "Transition arena exhausted",
            "Use a smaller keyword set or raise maxTransitions"),
    QUEUE_ARENA_EXHAUSTED(16, RESOURCE_EXHAUSTION,
            "Queue arena exhausted while computing failure links",
            "Use a smaller keyword set or raise maxQueueElements"),

    NOT_BUILT(21, USE_BEFORE_BUILD,
            "No automaton is built for the type",
            "Build the type first"),
    BUILD_INCOMPLETE(22, USE_BEFORE_BUILD,
            "The last build of the type failed",
            "Tear the type down and build it again");

    private final int code;
    private final ErrorCategory category;
    private final String description;
    private final String remedy;

    AutomatonError(int code, ErrorCategory category, String description, String remedy) {
        this.code = code;
        this.category = category;
        this.description = description;
        this.remedy = remedy;
    }

    public int code() {
        return code;
    }

    public ErrorCategory category() {
        return category;
    }

    public String description() {
        return description;
    }

    public String remedy() {
        return remedy;
    }

    /**
     * Returns the identifier in the form {@code E[014]MEM}.
     *
     * @return the diagnostic identifier
     */
    public String diagnosticId() {
        return String.format("E[%03d]%s", code, category.tag());
    }
}
