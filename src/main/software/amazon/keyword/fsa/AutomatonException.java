package software.amazon.keyword.fsa;

/**
 * A RuntimeException that reports why a build, scan or teardown was refused or aborted. No operation that throws
 * this leaves a usable partial result behind.
 */
public class AutomatonException extends RuntimeException {

    private final AutomatonError error;
    private final String detail;

    public AutomatonException(AutomatonError error, String detail) {
        super(error.diagnosticId() + " " + error.description() + " (" + detail + "). " + error.remedy() + ".");
        this.error = error;
        this.detail = detail;
    }

    public AutomatonError getError() {
        return error;
    }

    public ErrorCategory getCategory() {
        return error.category();
    }

    /**
     * @return the location or value that triggered the error, e.g. the type selector
     */
    public String getDetail() {
        return detail;
    }
}
