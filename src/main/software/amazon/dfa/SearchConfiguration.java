package software.amazon.dfa;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a search run by DfaSearch.
 */
@Immutable
public class SearchConfiguration {

    public static final SearchConfiguration DEFAULT = new Builder().build();

    /**
     * When true, which is the default, the automaton is reset to its initial state before the search starts. Setting
     * this to false continues from whatever state the automaton was left in, so a match may span the end of the
     * previous search and the start of this one. This is what you want when the sequence arrives in chunks and each
     * chunk is searched separately, and what you do not want when searching unrelated sequences.
     */
    private final boolean resetBeforeSearch;

    /**
     * Stop after this many matches. 0 means no limit.
     */
    private final int maxMatches;

    private SearchConfiguration(boolean resetBeforeSearch, int maxMatches) {
        this.resetBeforeSearch = resetBeforeSearch;
        this.maxMatches = maxMatches;
    }

    public boolean isResetBeforeSearch() {
        return resetBeforeSearch;
    }

    public int getMaxMatches() {
        return maxMatches;
    }

    public static class Builder {

        private boolean resetBeforeSearch = true;
        private int maxMatches = 0;

        public Builder withResetBeforeSearch(boolean resetBeforeSearch) {
            this.resetBeforeSearch = resetBeforeSearch;
            return this;
        }

        public Builder withMaxMatches(int maxMatches) {
            if (maxMatches < 0) {
                throw new IllegalArgumentException("maxMatches must not be negative: " + maxMatches);
            }
            this.maxMatches = maxMatches;
            return this;
        }

        public SearchConfiguration build() {
            return new SearchConfiguration(resetBeforeSearch, maxMatches);
        }
    }
}
