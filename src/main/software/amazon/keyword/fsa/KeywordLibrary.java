package software.amazon.keyword.fsa;

import java.util.List;

/**
 * Read-only source of keyword sets, keyed by type selector. {@link KeywordAutomata} consults it once per build.
 */
public interface KeywordLibrary {

    /**
     * Returns the keywords configured for a type, in the order they should be entered into the automaton.
     *
     * @param type the type selector
     * @return the keywords, or {@code null} if the library does not know the type. The list may be empty.
     */
    List<Keyword> getKeywords(int type);
}
