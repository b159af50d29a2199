package software.amazon.keyword.fsa;

/**
 * Receives match events as a scan discovers them.
 */
@FunctionalInterface
public interface MatchListener {

    /**
     * @param keywordId the id of the keyword that matched
     * @param endOffset the offset one past the keyword's last byte, counted from the start of the scan
     */
    void onMatch(int keywordId, long endOffset);
}
