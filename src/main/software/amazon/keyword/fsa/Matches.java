package software.amazon.keyword.fsa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered, append-only record of match events, kept in primitive lists so that collecting matches does not
 * box. Events are stored in the order the scan reported them.
 */
@NotThreadSafe
public final class Matches implements MatchListener {

    private final IntArrayList keywordIds = new IntArrayList();
    private final LongArrayList endOffsets = new LongArrayList();

    @Override
    public void onMatch(final int keywordId, final long endOffset) {
        keywordIds.add(keywordId);
        endOffsets.add(endOffset);
    }

    public int size() {
        return keywordIds.size();
    }

    public boolean isEmpty() {
        return keywordIds.isEmpty();
    }

    public int keywordId(final int index) {
        return keywordIds.getInt(index);
    }

    public long endOffset(final int index) {
        return endOffsets.getLong(index);
    }

    public Match get(final int index) {
        return new Match(keywordIds.getInt(index), endOffsets.getLong(index));
    }

    public void clear() {
        keywordIds.clear();
        endOffsets.clear();
    }

    public List<Match> asList() {
        final List<Match> list = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            list.add(get(i));
        }
        return list;
    }

    @Override
    public String toString() {
        return asList().toString();
    }
}
