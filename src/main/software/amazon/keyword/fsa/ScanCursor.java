package software.amazon.keyword.fsa;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Walks an {@link Automaton} over input one byte at a time. The cursor holds the only mutable scan state, the current
 * state and the number of bytes consumed, so each scanning thread needs its own cursor while the automaton is shared.
 *
 * Successive scan calls continue where the previous one stopped: feeding input in chunks reports exactly the
 * matches of the concatenated input, with offsets counted from the first byte after the last {@link #reset()}.
 */
@NotThreadSafe
public final class ScanCursor {

    private static final int BUFFER_SIZE = 8192;

    private final Automaton automaton;
    private final MatchListener listener;
    private int state;
    private long position;

    ScanCursor(final Automaton automaton, final MatchListener listener) {
        this.automaton = automaton;
        this.listener = listener;
        this.state = automaton.root();
    }

    /**
     * Scans a whole array.
     *
     * @return true if at least one match was reported by this call
     */
    public boolean scan(final byte[] input) {
        if (input == null) {
            throw new AutomatonException(AutomatonError.NULL_INPUT, "byte[] input");
        }
        return scan(input, 0, input.length);
    }

    /**
     * Scans {@code length} bytes of an array starting at {@code offset}.
     *
     * @return true if at least one match was reported by this call
     */
    public boolean scan(final byte[] input, final int offset, final int length) {
        if (input == null) {
            throw new AutomatonException(AutomatonError.NULL_INPUT, "byte[] input");
        }
        if (offset < 0 || length < 0 || offset > input.length - length) {
            throw new IndexOutOfBoundsException("offset " + offset + ", length " + length
                    + ", array length " + input.length);
        }
        automaton.ensureLive();

        int current = state;
        long pos = position;
        int reported = 0;
        final int end = offset + length;
        for (int i = offset; i < end; i++) {
            current = automaton.step(current, input[i]);
            pos++;
            reported += automaton.report(current, pos, listener);
        }
        state = current;
        position = pos;
        return reported > 0;
    }

    /**
     * Scans the remaining bytes of a buffer, leaving its position at its limit.
     *
     * @return true if at least one match was reported by this call
     */
    public boolean scan(final ByteBuffer input) {
        if (input == null) {
            throw new AutomatonException(AutomatonError.NULL_INPUT, "ByteBuffer input");
        }
        if (input.hasArray()) {
            final boolean matched = scan(input.array(), input.arrayOffset() + input.position(), input.remaining());
            input.position(input.limit());
            return matched;
        }
        automaton.ensureLive();

        int reported = 0;
        while (input.hasRemaining()) {
            state = automaton.step(state, input.get());
            position++;
            reported += automaton.report(state, position, listener);
        }
        return reported > 0;
    }

    /**
     * Scans a stream until its end. The stream is not closed.
     *
     * @return true if at least one match was reported by this call
     * @throws IOException if reading the stream fails; bytes consumed before the failure stay scanned
     */
    public boolean scan(final InputStream input) throws IOException {
        if (input == null) {
            throw new AutomatonException(AutomatonError.NULL_INPUT, "InputStream input");
        }
        final byte[] buffer = new byte[BUFFER_SIZE];
        boolean matched = false;
        int read;
        while ((read = input.read(buffer)) != -1) {
            matched |= scan(buffer, 0, read);
        }
        return matched;
    }

    /**
     * Restarts at the root with the offset back at zero, for scanning an unrelated input.
     */
    public void reset() {
        state = automaton.root();
        position = 0;
    }

    @Nonnull
    public Automaton getAutomaton() {
        return automaton;
    }

    public int getState() {
        return state;
    }

    /**
     * @return bytes consumed since construction or the last reset
     */
    public long getPosition() {
        return position;
    }
}
