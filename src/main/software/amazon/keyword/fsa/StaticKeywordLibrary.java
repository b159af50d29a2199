package software.amazon.keyword.fsa;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A keyword library fixed at construction time. Build one with {@link #builder()} or compile one from JSON with
 * {@link KeywordLibraryCompiler}.
 */
@Immutable
public final class StaticKeywordLibrary implements KeywordLibrary {

    private final Map<Integer, List<Keyword>> keywordsByType;

    private StaticKeywordLibrary(Map<Integer, List<Keyword>> keywordsByType) {
        this.keywordsByType = keywordsByType;
    }

    @Override
    public List<Keyword> getKeywords(int type) {
        return keywordsByType.get(type);
    }

    public Set<Integer> getTypes() {
        return keywordsByType.keySet();
    }

    @Override
    public String toString() {
        return "StaticKeywordLibrary{" + keywordsByType + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private final Map<Integer, List<Keyword>> keywordsByType = new LinkedHashMap<>();

        Builder() {}

        /**
         * Adds keywords to a type. Identifiers continue from the type's current keyword count, so the first keyword
         * of a type gets id 0.
         */
        public Builder addKeywords(int type, String... keywords) {
            List<Keyword> list = keywordsFor(type);
            for (String keyword : keywords) {
                list.add(Keyword.of(list.size(), keyword));
            }
            return this;
        }

        public Builder addKeyword(int type, Keyword keyword) {
            keywordsFor(type).add(keyword);
            return this;
        }

        /**
         * Declares a type with no keywords. Building such a type is refused with
         * {@link AutomatonError#EMPTY_KEYWORD_SET}.
         */
        public Builder addType(int type) {
            keywordsFor(type);
            return this;
        }

        private List<Keyword> keywordsFor(int type) {
            return keywordsByType.computeIfAbsent(type, k -> new ArrayList<>());
        }

        public StaticKeywordLibrary build() {
            Map<Integer, List<Keyword>> copy = new LinkedHashMap<>();
            for (Map.Entry<Integer, List<Keyword>> entry : keywordsByType.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
            return new StaticKeywordLibrary(Collections.unmodifiableMap(copy));
        }
    }
}
