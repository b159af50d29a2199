package software.amazon.keyword.fsa;

/**
 * Byte-to-byte folding applied to keywords at build time and to input at scan time by case-insensitive automata.
 * Only the ASCII letters a-z are folded (to A-Z); every other byte, including UTF-8 continuation bytes, maps to
 * itself, so multi-byte characters are matched exactly.
 */
final class CaseFolding {

    private static final byte[] ASCII_UPPER = new byte[256];

    static {
        for (int i = 0; i < ASCII_UPPER.length; i++) {
            ASCII_UPPER[i] = (byte) (i >= 'a' && i <= 'z' ? i - ('a' - 'A') : i);
        }
    }

    private CaseFolding() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static byte fold(final byte value) {
        return ASCII_UPPER[value & 0xFF];
    }
}
