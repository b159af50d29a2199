package software.amazon.keyword.fsa;

import javax.annotation.concurrent.Immutable;

/**
 * One match event: a keyword id and the exclusive end offset of the occurrence.
 */
@Immutable
public final class Match {

    private final int keywordId;
    private final long endOffset;

    public Match(int keywordId, long endOffset) {
        this.keywordId = keywordId;
        this.endOffset = endOffset;
    }

    public int getKeywordId() {
        return keywordId;
    }

    public long getEndOffset() {
        return endOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match match = (Match) o;
        return keywordId == match.keywordId && endOffset == match.endOffset;
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(keywordId) + Long.hashCode(endOffset);
    }

    @Override
    public String toString() {
        return keywordId + "@" + endOffset;
    }
}
