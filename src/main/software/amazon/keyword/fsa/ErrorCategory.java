package software.amazon.keyword.fsa;

/**
 * The causes an {@link AutomatonException} can have. The tag appears in every diagnostic identifier.
 */
public enum ErrorCategory {
    INVALID_ARGUMENT("ARG"),    // a type selector, keyword set or input violates a precondition
    RESOURCE_EXHAUSTION("MEM"), // an arena pool ran out of capacity during a build
    USE_BEFORE_BUILD("USE");    // scan or teardown of a type with no completed automaton

    private final String tag;

    ErrorCategory(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
