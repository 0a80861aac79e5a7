package software.amazon.dfa;

import it.unimi.dsi.fastutil.objects.Object2IntMap;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A deterministic finite-state automaton that recognizes a fixed pattern, a sequence of elements compared with
 * equals() and hashCode(), in another sequence fed to it one element at a time.
 * <br/>
 * Build it once from the pattern, then call {@link #step(Object)} with each element of the sequence being searched
 * and check {@link #isAtFinalState()} after each step:
 * <pre>
 *     Dfa&lt;Character&gt; dfa = Dfa.forCharacters("seashells");
 *     for (char c : "she sells seashells by the shoreline".toCharArray()) {
 *         dfa.step(c);
 *         if (dfa.isAtFinalState()) {
 *             // found
 *             break;
 *         }
 *     }
 * </pre>
 * The automaton remembers the state it was left in. Call {@link #reset()} before starting a search on an unrelated
 * sequence, otherwise a partial match at the end of the previous sequence carries over into the next one.
 * <br/>
 * The state table is built in time linear in the pattern length and never changes afterwards; only the current
 * state moves. Each step is O(1).
 * <br/>
 * States are numbered 0 to N, where N is the pattern length. 0 is the initial state and N the final state. An
 * automaton built from an empty pattern has one empty state node, a final state of 1, and never leaves state 0.
 *
 * @param <E> the element type
 */
@NotThreadSafe
public class Dfa<E> {

    private static final int INITIAL_STATE = 0;

    private final List<StateNode<E>> states;

    private int currentState = INITIAL_STATE;

    /**
     * Create an automaton recognizing the given pattern.
     *
     * @param pattern the elements to look for, iterated once
     */
    public Dfa(@Nonnull final Iterable<? extends E> pattern) {
        this(StateTableBuilder.build(Objects.requireNonNull(pattern, "pattern").iterator()));
    }

    private Dfa(final List<StateNode<E>> states) {
        this.states = states;
    }

    @SafeVarargs
    public static <E> Dfa<E> of(final E... pattern) {
        return new Dfa<>(Arrays.asList(pattern));
    }

    /**
     * Create an automaton over the UTF-16 code units of a string.
     *
     * @param pattern the characters to look for
     * @return a new automaton at its initial state
     */
    public static Dfa<Character> forCharacters(@Nonnull final CharSequence pattern) {
        Objects.requireNonNull(pattern, "pattern");
        final List<Character> chars = new ArrayList<>(pattern.length());
        for (int i = 0; i < pattern.length(); i++) {
            chars.add(pattern.charAt(i));
        }
        return new Dfa<>(chars);
    }

    /**
     * Move to the next state for the given element. An element with no transition out of the current state sends the
     * automaton back to its initial state. Stepping from the final state uses the initial state's transitions.
     *
     * @param element the next element of the sequence being searched, may be null
     */
    public void step(final E element) {
        currentState = states.get(currentState % states.size()).nextState(element);
    }

    /**
     * Return to the initial state.
     */
    public void reset() {
        currentState = INITIAL_STATE;
    }

    public int currentState() {
        return currentState;
    }

    public int initialState() {
        return INITIAL_STATE;
    }

    /**
     * @return the state reached once the whole pattern has been matched, equal to the number of state nodes
     */
    public int finalState() {
        return states.size();
    }

    public boolean isAtInitialState() {
        return currentState == INITIAL_STATE;
    }

    public boolean isAtFinalState() {
        return currentState == states.size();
    }

    /**
     * @return true if the pattern had no elements, in which case the final state is never reached
     */
    public boolean isEmpty() {
        return states.get(INITIAL_STATE).isEmpty();
    }

    /**
     * The pattern this automaton recognizes, recovered from the state table. Each call to iterator() starts a new,
     * independent traversal.
     *
     * @return the pattern's elements in order
     */
    public Iterable<E> pattern() {
        return PatternIterator::new;
    }

    /**
     * @return a new automaton sharing this one's state table, at the initial state
     */
    public Dfa<E> copy() {
        return new Dfa<E>(states);
    }

    List<StateNode<E>> states() {
        return states;
    }

    @Override
    public String toString() {
        return "DFA: state=" + currentState + " final=" + finalState() + " states=" + states;
    }

    private final class PatternIterator implements Iterator<E> {

        private int state = INITIAL_STATE;
        private Object2IntMap.Entry<E> next = advance();

        private Object2IntMap.Entry<E> advance() {
            if (state >= states.size()) {
                return null;
            }
            return states.get(state).transitionTo(state + 1);
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public E next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            final E element = next.getKey();
            state++;
            next = advance();
            return element;
        }
    }
}
