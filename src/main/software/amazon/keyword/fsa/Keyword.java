package software.amazon.keyword.fsa;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * One fixed byte sequence an automaton recognizes, together with the identifier reported when it matches.
 * Identifiers are chosen by the keyword library; the automaton does not check them for uniqueness.
 */
@Immutable
public final class Keyword {

    private final int id;
    private final byte[] bytes;

    private Keyword(int id, byte[] bytes) {
        this.id = id;
        this.bytes = bytes;
    }

    public static Keyword of(int id, @Nonnull String text) {
        return new Keyword(id, text.getBytes(StandardCharsets.UTF_8));
    }

    public static Keyword of(int id, @Nonnull byte[] bytes) {
        return new Keyword(id, bytes.clone());
    }

    public int getId() {
        return id;
    }

    public int length() {
        return bytes.length;
    }

    byte byteAt(int index) {
        return bytes[index];
    }

    /**
     * @return a copy of the keyword's bytes
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Keyword keyword = (Keyword) o;
        return id == keyword.id && Arrays.equals(bytes, keyword.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(id) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "KW: id=" + id + " (" + new String(bytes, StandardCharsets.UTF_8) + ")";
    }
}
