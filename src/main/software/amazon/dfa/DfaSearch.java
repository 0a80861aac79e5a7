package software.amazon.dfa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Iterator;
import java.util.Objects;

/**
 * Drives a Dfa over a whole sequence. These are thin wrappers around the step / isAtFinalState loop for callers who
 * have the sequence at hand; callers receiving elements one at a time should drive the Dfa themselves.
 * <br/>
 * Positions reported are those of the last element of each match, counted from the start of the sequence passed in.
 * Once a match is found the automaton is reset and the scan carries on from the next element, so matches never
 * overlap: searching "ABAB" in "ABABAB" finds one match, ending at 3.
 * <br/>
 * The Dfa passed in is mutated. It is not safe to search with the same Dfa from several threads at once; give each
 * thread its own {@link Dfa#copy()}.
 */
@ThreadSafe
public final class DfaSearch {

    private static final int NOT_FOUND = -1;

    private DfaSearch() { }

    /**
     * Return true if the pattern occurs in the sequence.
     *
     * @param dfa the automaton for the pattern
     * @param sequence the sequence to search
     * @return true or false depending on whether the pattern was found
     */
    public static <E> boolean contains(final Dfa<E> dfa, final Iterable<? extends E> sequence) {
        return indexOf(dfa, sequence, SearchConfiguration.DEFAULT) != NOT_FOUND;
    }

    public static boolean contains(final Dfa<Character> dfa, final CharSequence sequence) {
        return indexOf(dfa, sequence, SearchConfiguration.DEFAULT) != NOT_FOUND;
    }

    public static <E> int indexOf(final Dfa<E> dfa, final Iterable<? extends E> sequence) {
        return indexOf(dfa, sequence, SearchConfiguration.DEFAULT);
    }

    public static int indexOf(final Dfa<Character> dfa, final CharSequence sequence) {
        return indexOf(dfa, sequence, SearchConfiguration.DEFAULT);
    }

    /**
     * Find the first occurrence of the pattern. The configured match limit does not apply; the scan always stops at
     * the first match.
     *
     * @param dfa the automaton for the pattern
     * @param sequence the sequence to search
     * @param configuration search options
     * @return index of the last element of the first match, or -1 if there is none
     */
    public static <E> int indexOf(final Dfa<E> dfa, final Iterable<? extends E> sequence,
                                  final SearchConfiguration configuration) {
        final IntList ends = scan(dfa, iterate(sequence), configuration.isResetBeforeSearch(), 1);
        return ends.isEmpty() ? NOT_FOUND : ends.getInt(0);
    }

    public static int indexOf(final Dfa<Character> dfa, final CharSequence sequence,
                              final SearchConfiguration configuration) {
        final IntList ends = scan(dfa, iterate(sequence), configuration.isResetBeforeSearch(), 1);
        return ends.isEmpty() ? NOT_FOUND : ends.getInt(0);
    }

    public static <E> IntList matchEnds(final Dfa<E> dfa, final Iterable<? extends E> sequence) {
        return matchEnds(dfa, sequence, SearchConfiguration.DEFAULT);
    }

    public static IntList matchEnds(final Dfa<Character> dfa, final CharSequence sequence) {
        return matchEnds(dfa, sequence, SearchConfiguration.DEFAULT);
    }

    /**
     * Find the non-overlapping occurrences of the pattern.
     *
     * @param dfa the automaton for the pattern
     * @param sequence the sequence to search
     * @param configuration search options
     * @return indexes of the last element of each match, ascending. May be empty but never null.
     */
    public static <E> IntList matchEnds(final Dfa<E> dfa, final Iterable<? extends E> sequence,
                                        final SearchConfiguration configuration) {
        return scan(dfa, iterate(sequence), configuration.isResetBeforeSearch(), configuration.getMaxMatches());
    }

    public static IntList matchEnds(final Dfa<Character> dfa, final CharSequence sequence,
                                    final SearchConfiguration configuration) {
        return scan(dfa, iterate(sequence), configuration.isResetBeforeSearch(), configuration.getMaxMatches());
    }

    public static <E> int count(final Dfa<E> dfa, final Iterable<? extends E> sequence) {
        return matchEnds(dfa, sequence).size();
    }

    public static int count(final Dfa<Character> dfa, final CharSequence sequence) {
        return matchEnds(dfa, sequence).size();
    }

    public static <E> int count(final Dfa<E> dfa, final Iterable<? extends E> sequence,
                                final SearchConfiguration configuration) {
        return matchEnds(dfa, sequence, configuration).size();
    }

    private static <E> Iterator<? extends E> iterate(@Nonnull final Iterable<? extends E> sequence) {
        return Objects.requireNonNull(sequence, "sequence").iterator();
    }

    private static Iterator<Character> iterate(@Nonnull final CharSequence sequence) {
        return Objects.requireNonNull(sequence, "sequence").chars().mapToObj(c -> (char) c).iterator();
    }

    private static <E> IntList scan(@Nonnull final Dfa<E> dfa, final Iterator<? extends E> elements,
                                    final boolean resetBeforeSearch, final int maxMatches) {
        Objects.requireNonNull(dfa, "dfa");
        if (resetBeforeSearch) {
            dfa.reset();
        }

        final IntList ends = new IntArrayList();
        int index = 0;
        while (elements.hasNext()) {
            dfa.step(elements.next());
            if (dfa.isAtFinalState()) {
                ends.add(index);
                dfa.reset();
                if (maxMatches > 0 && ends.size() >= maxMatches) {
                    break;
                }
            }
            index++;
        }
        return ends;
    }
}
