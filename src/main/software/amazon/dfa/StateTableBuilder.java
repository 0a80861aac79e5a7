package software.amazon.dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Compiles a pattern into the table of StateNodes driving a Dfa, in a single pass over the pattern.
 *
 * Node i holds the transitions taken after a prefix of length i has been matched. Each new node starts out as a copy
 * of the node for the restart state x, which is the state the automaton would be in had it been fed the pattern
 * minus its first element. The copy supplies the mismatch edges; the element being added is then pointed at the next
 * state. This is the construction from Sedgewick & Wayne's Algorithms, 4th edition, using sparse maps in place of a
 * fixed-radix array.
 */
final class StateTableBuilder {

    private StateTableBuilder() { }

    /**
     * Build the state table for a pattern.
     *
     * @param pattern the elements of the pattern, consumed exactly once
     * @return an unmodifiable table with one node per pattern element, or a single empty node for an empty pattern
     */
    static <E> List<StateNode<E>> build(final Iterator<? extends E> pattern) {
        final ArrayList<StateNode<E>> states = new ArrayList<>();
        states.add(new StateNode<>());
        if (!pattern.hasNext()) {
            return Collections.unmodifiableList(states);
        }

        states.get(0).putTransition(pattern.next(), 1);

        int restartState = 0;
        while (pattern.hasNext()) {
            final E element = pattern.next();
            final StateNode<E> restartNode = states.get(restartState);

            final StateNode<E> node = restartNode.copy();
            node.putTransition(element, states.size() + 1);
            states.add(node);

            // look up in the restart node itself, not in the copy that now points element at the new state
            restartState = restartNode.nextState(element);
        }

        states.trimToSize();
        return Collections.unmodifiableList(states);
    }
}
