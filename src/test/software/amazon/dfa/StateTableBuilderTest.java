package software.amazon.dfa;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class StateTableBuilderTest {

    private static List<StateNode<Character>> build(final String pattern) {
        final List<Character> chars = new ArrayList<>();
        for (char c : pattern.toCharArray()) {
            chars.add(c);
        }
        return StateTableBuilder.build(chars.iterator());
    }

    @Test
    public void testEmptyPatternBuildsSingleEmptyNode() {
        List<StateNode<Character>> states = build("");
        assertEquals(1, states.size());
        assertTrue(states.get(0).isEmpty());
    }

    @Test
    public void testSingleElementPattern() {
        List<StateNode<Character>> states = build("x");
        assertEquals(1, states.size());
        assertEquals(1, states.get(0).numberOfTransitions());
        assertEquals(1, states.get(0).nextState('x'));
    }

    @Test
    public void testBookExample() {
        List<StateNode<Character>> states = build("ABABAC");
        assertEquals(6, states.size());

        assertEquals(1, states.get(0).nextState('A'));
        assertEquals(0, states.get(0).nextState('B'));
        assertEquals(0, states.get(0).nextState('C'));
        assertEquals(1, states.get(0).numberOfTransitions());

        assertEquals(1, states.get(1).nextState('A'));
        assertEquals(2, states.get(1).nextState('B'));
        assertEquals(0, states.get(1).nextState('C'));
        assertEquals(2, states.get(1).numberOfTransitions());

        assertEquals(3, states.get(2).nextState('A'));
        assertEquals(0, states.get(2).nextState('B'));
        assertEquals(0, states.get(2).nextState('C'));
        assertEquals(1, states.get(2).numberOfTransitions());

        assertEquals(1, states.get(3).nextState('A'));
        assertEquals(4, states.get(3).nextState('B'));
        assertEquals(0, states.get(3).nextState('C'));
        assertEquals(2, states.get(3).numberOfTransitions());

        assertEquals(5, states.get(4).nextState('A'));
        assertEquals(0, states.get(4).nextState('B'));
        assertEquals(0, states.get(4).nextState('C'));
        assertEquals(1, states.get(4).numberOfTransitions());

        assertEquals(1, states.get(5).nextState('A'));
        assertEquals(4, states.get(5).nextState('B'));
        assertEquals(6, states.get(5).nextState('C'));
        assertEquals(3, states.get(5).numberOfTransitions());
    }

    @Test
    public void testRepeatedElement() {
        List<StateNode<Character>> states = build("AAAA");
        assertEquals(4, states.size());
        for (int i = 0; i < states.size(); i++) {
            assertEquals(i + 1, states.get(i).nextState('A'));
            assertEquals(1, states.get(i).numberOfTransitions());
        }
    }

    @Test
    public void testTableIsUnmodifiable() {
        List<StateNode<Character>> states = build("AB");
        try {
            states.add(new StateNode<>());
            fail("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testNodesAreIndependentCopies() {
        // node 2 starts as a copy of node 0 and node 0 must not pick up node 2's "A" edge
        List<StateNode<Character>> states = build("ABA");
        assertEquals(1, states.get(0).nextState('A'));
        assertEquals(3, states.get(2).nextState('A'));
    }

    @Test
    public void testWorksForNonCharacterElements() {
        List<StateNode<Integer>> states = StateTableBuilder.build(Arrays.asList(7, 7, 8).iterator());
        assertEquals(3, states.size());
        assertEquals(1, states.get(0).nextState(7));
        assertEquals(2, states.get(1).nextState(7));
        assertEquals(3, states.get(2).nextState(8));
        assertEquals(2, states.get(2).nextState(7));
        assertFalse(states.get(2).hasTransition(9));
    }

    @Test
    public void testEveryTransitionMatchesLongestPrefixThatIsASuffix() {
        Random random = new Random(6L);
        char[] alphabet = { 'a', 'b', 'c' };
        for (int round = 0; round < 200; round++) {
            StringBuilder sb = new StringBuilder();
            int length = 1 + random.nextInt(12);
            for (int i = 0; i < length; i++) {
                sb.append(alphabet[random.nextInt(alphabet.length)]);
            }
            String pattern = sb.toString();
            List<StateNode<Character>> states = build(pattern);

            assertEquals(pattern, pattern.length(), states.size());
            for (int state = 0; state < pattern.length(); state++) {
                for (char c : new char[] { 'a', 'b', 'c', 'd' }) {
                    String seen = pattern.substring(0, state) + c;
                    assertEquals(pattern + " state " + state + " on " + c,
                            longestPrefixThatIsASuffix(pattern, seen), states.get(state).nextState(c));
                }
            }
        }
    }

    @Test
    public void testConsumesPatternOnce() {
        List<Character> pattern = new ArrayList<>(Collections.nCopies(5, 'z'));
        CountingIterator<Character> iterator = new CountingIterator<>(pattern);
        StateTableBuilder.build(iterator);
        assertEquals(5, iterator.count);
    }

    private static int longestPrefixThatIsASuffix(final String pattern, final String seen) {
        for (int length = Math.min(pattern.length(), seen.length()); length > 0; length--) {
            if (seen.endsWith(pattern.substring(0, length))) {
                return length;
            }
        }
        return 0;
    }

    private static final class CountingIterator<T> implements Iterator<T> {
        private final Iterator<T> delegate;
        private int count;

        CountingIterator(final List<T> list) {
            this.delegate = list.iterator();
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public T next() {
            count++;
            return delegate.next();
        }
    }
}
