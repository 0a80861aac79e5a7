package software.amazon.dfa;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collections;
import java.util.Set;

/**
 * The transitions out of one state of a Dfa, keyed by element. Only the elements actually seen while building the
 * table are stored; any other element leads back to the initial state.
 */
final class StateNode<E> {

    static final int NO_TRANSITION = 0;

    private final Object2IntOpenHashMap<E> transitions;

    StateNode() {
        this.transitions = new Object2IntOpenHashMap<>();
    }

    private StateNode(final Object2IntOpenHashMap<E> transitions) {
        this.transitions = transitions;
    }

    /**
     * @return an independent node holding the same transitions as this one
     */
    StateNode<E> copy() {
        return new StateNode<>(new Object2IntOpenHashMap<>(transitions));
    }

    void putTransition(final E element, final int nextState) {
        transitions.put(element, nextState);
    }

    int nextState(final E element) {
        if (transitions.containsKey(element)) {
            return transitions.getInt(element);
        }
        return NO_TRANSITION;
    }

    boolean hasTransition(final E element) {
        return transitions.containsKey(element);
    }

    /**
     * Find the transition leading to the given state. The element of the returned entry may itself be null, so
     * absence is signalled by a null entry.
     *
     * @param nextState the target state
     * @return the transition, or null if none leads there
     */
    Object2IntMap.Entry<E> transitionTo(final int nextState) {
        for (Object2IntMap.Entry<E> entry : transitions.object2IntEntrySet()) {
            if (entry.getIntValue() == nextState) {
                return entry;
            }
        }
        return null;
    }

    Set<Object2IntMap.Entry<E>> transitions() {
        return Collections.unmodifiableSet(transitions.object2IntEntrySet());
    }

    boolean isEmpty() {
        return transitions.isEmpty();
    }

    int numberOfTransitions() {
        return transitions.size();
    }

    @Override
    public String toString() {
        return "SN: " + transitions;
    }
}
